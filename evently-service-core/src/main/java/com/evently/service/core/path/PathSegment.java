package com.evently.service.core.path;

import java.util.List;
import java.util.Map;

/** One step of a compiled path. Each step maps a node to zero or more child nodes. */
public interface PathSegment {

    /** Appends the children selected from {@code node} to {@code out}, in document order. */
    void select(Object node, List<Object> out);

    /** Key access into a mapping: {@code a.b}, {@code a[b]}, {@code a.'b.c'}. */
    record Field(String name) implements PathSegment {
        @Override
        public void select(Object node, List<Object> out) {
            if (node instanceof Map<?, ?> map && map.containsKey(name)) {
                out.add(map.get(name));
            }
        }

        @Override
        public String toString() {
            return "'" + name.replace("'", "\\'") + "'";
        }
    }

    /** Positional access into a sequence: {@code a[0]}. */
    record Index(int index) implements PathSegment {
        @Override
        public void select(Object node, List<Object> out) {
            if (node instanceof List<?> list && index >= 0 && index < list.size()) {
                out.add(list.get(index));
            }
        }

        @Override
        public String toString() {
            return "[" + index + "]";
        }
    }

    /** Every child of a mapping (iteration order) or every element of a sequence. */
    record Wildcard() implements PathSegment {
        @Override
        public void select(Object node, List<Object> out) {
            if (node instanceof Map<?, ?> map) {
                out.addAll(map.values());
            } else if (node instanceof List<?> list) {
                out.addAll(list);
            }
        }

        @Override
        public String toString() {
            return "*";
        }
    }
}
