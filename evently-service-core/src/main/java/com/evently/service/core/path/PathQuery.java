package com.evently.service.core.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Compiled union of field paths over a semi-structured document (nested {@code Map}, {@code List} and scalars).
 *
 * <p>Alternatives are evaluated in declaration order. A missing key or an index past the end simply yields nothing
 * for that alternative, and {@code null} values are treated as absent. Instances are immutable and safe to share.
 */
public final class PathQuery {

    private final List<String> expressions;
    private final List<List<PathSegment>> alternatives;

    private PathQuery(List<String> expressions, List<List<PathSegment>> alternatives) {
        this.expressions = expressions;
        this.alternatives = alternatives;
    }

    public static PathQuery compile(String expression) {
        return compile(List.of(Objects.requireNonNull(expression, "expression")));
    }

    /**
     * Compiles each expression and concatenates their alternatives.
     *
     * @throws PathSyntaxException if any expression is malformed
     */
    public static PathQuery compile(List<String> expressions) {
        Objects.requireNonNull(expressions, "expressions");
        if (expressions.isEmpty()) {
            throw new PathSyntaxException("", 0, "no path expressions given");
        }
        List<List<PathSegment>> alternatives = new ArrayList<>();
        for (String expression : expressions) {
            alternatives.addAll(PathExpressionParser.parse(expression));
        }
        return new PathQuery(List.copyOf(expressions), List.copyOf(alternatives));
    }

    /** All non-null values found, alternative by alternative. */
    public List<Object> evaluate(Object document) {
        List<Object> results = new ArrayList<>();
        for (List<PathSegment> alternative : alternatives) {
            for (Object value : walk(alternative, document)) {
                if (value != null) {
                    results.add(value);
                }
            }
        }
        return results;
    }

    /** The first non-null value; later alternatives are not walked once one yields a value. */
    public Optional<Object> first(Object document) {
        for (List<PathSegment> alternative : alternatives) {
            for (Object value : walk(alternative, document)) {
                if (value != null) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    public List<String> expressions() {
        return expressions;
    }

    public int alternativeCount() {
        return alternatives.size();
    }

    private static List<Object> walk(List<PathSegment> segments, Object document) {
        List<Object> current = new ArrayList<>();
        current.add(document);
        for (PathSegment segment : segments) {
            List<Object> next = new ArrayList<>();
            for (Object node : current) {
                if (node != null) {
                    segment.select(node, next);
                }
            }
            if (next.isEmpty()) {
                return List.of();
            }
            current = next;
        }
        return current;
    }

    @Override
    public String toString() {
        return alternatives.stream().map(PathQuery::render).collect(Collectors.joining("|"));
    }

    private static String render(List<PathSegment> segments) {
        StringBuilder sb = new StringBuilder("$");
        for (PathSegment segment : segments) {
            if (!(segment instanceof PathSegment.Index)) {
                sb.append('.');
            }
            sb.append(segment);
        }
        return sb.toString();
    }
}
