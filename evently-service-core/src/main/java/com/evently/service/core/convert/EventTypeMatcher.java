package com.evently.service.core.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Include/exclude shell-glob patterns over event types.
 *
 * <p>Entries starting with {@code !} are exclusions. A type matches when it matches any inclusion and no exclusion.
 * Exclusions with no inclusions imply an inclusion of {@code *}. Glob syntax is {@code *} (any run of characters)
 * and {@code ?} (one character); every other character is literal.
 */
public final class EventTypeMatcher {

    static final String MATCH_ALL = "*";

    private final List<String> includedTypes;
    private final List<String> excludedTypes;
    private final List<Pattern> included;
    private final List<Pattern> excluded;

    private EventTypeMatcher(List<String> includedTypes, List<String> excludedTypes) {
        this.includedTypes = List.copyOf(includedTypes);
        this.excludedTypes = List.copyOf(excludedTypes);
        this.included = includedTypes.stream().map(EventTypeMatcher::globToPattern).toList();
        this.excluded = excludedTypes.stream().map(EventTypeMatcher::globToPattern).toList();
    }

    public static EventTypeMatcher of(String... eventTypes) {
        return of(List.of(eventTypes));
    }

    public static EventTypeMatcher of(List<String> eventTypes) {
        Objects.requireNonNull(eventTypes, "eventTypes");
        List<String> include = new ArrayList<>();
        List<String> exclude = new ArrayList<>();
        for (String t : eventTypes) {
            if (t.startsWith("!")) {
                exclude.add(t.substring(1));
            } else {
                include.add(t);
            }
        }
        if (!exclude.isEmpty() && include.isEmpty()) {
            include.add(MATCH_ALL);
        }
        return new EventTypeMatcher(include, exclude);
    }

    public boolean includes(String eventType) {
        return anyMatch(included, eventType);
    }

    public boolean excludes(String eventType) {
        return anyMatch(excluded, eventType);
    }

    public boolean matches(String eventType) {
        return includes(eventType) && !excludes(eventType);
    }

    /** True when every event type matches: {@code *} is included and nothing is excluded. */
    public boolean isCatchAll() {
        return includedTypes.contains(MATCH_ALL) && excludedTypes.isEmpty();
    }

    public List<String> includedTypes() {
        return includedTypes;
    }

    public List<String> excludedTypes() {
        return excludedTypes;
    }

    private static boolean anyMatch(List<Pattern> patterns, String eventType) {
        if (eventType == null) return false;
        for (Pattern p : patterns) {
            if (p.matcher(eventType).matches()) {
                return true;
            }
        }
        return false;
    }

    static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    @Override
    public String toString() {
        return "EventTypeMatcher{included=" + includedTypes + ", excluded=" + excludedTypes + "}";
    }
}
