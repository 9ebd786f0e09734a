package com.evently.service.core.convert;

import com.evently.event.model.Event;
import com.evently.event.model.Trait;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One rule of the conversion table: which event types it accepts and which traits it extracts.
 *
 * <p>Required keys are {@code event_type} (a glob or list of globs, {@code !} marks exclusions) and {@code traits}
 * (trait name to trait definition). The {@link #DEFAULT_TRAITS} are always extracted; a rule trait with the same name
 * replaces the default in place.
 */
public final class EventDefinition {

    public static final Map<String, Map<String, Object>> DEFAULT_TRAITS = defaultTraits();

    private final Map<String, ?> config;
    private final EventTypeMatcher matcher;
    private final Map<String, TraitDefinition> traits;
    private final Clock clock;

    public EventDefinition(Map<String, ?> definitionConfig) {
        this(definitionConfig, Clock.systemUTC());
    }

    public EventDefinition(Map<String, ?> definitionConfig, Clock clock) {
        this.config = Objects.requireNonNull(definitionConfig, "definitionConfig");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (String required : List.of("event_type", "traits")) {
            if (!definitionConfig.containsKey(required)) {
                throw new EventDefinitionException("Required field " + required + " not specified", definitionConfig);
            }
        }
        this.matcher = EventTypeMatcher.of(eventTypes(definitionConfig));

        Map<String, TraitDefinition> merged = new LinkedHashMap<>();
        DEFAULT_TRAITS.forEach((name, traitCfg) -> merged.put(name, new TraitDefinition(name, traitCfg)));
        Object declared = definitionConfig.get("traits");
        if (declared != null) {
            if (!(declared instanceof Map<?, ?> declaredTraits)) {
                throw new EventDefinitionException("'traits' must be a mapping of trait name to definition", config);
            }
            for (Map.Entry<?, ?> e : declaredTraits.entrySet()) {
                String name = String.valueOf(e.getKey());
                merged.put(name, traitDefinition(name, traitConfig(name, e.getValue())));
            }
        }
        this.traits = Collections.unmodifiableMap(merged);
    }

    public boolean matchType(String eventType) {
        return matcher.matches(eventType);
    }

    public boolean isCatchAll() {
        return matcher.isCatchAll();
    }

    public EventTypeMatcher matcher() {
        return matcher;
    }

    /** Trait definitions in extraction order: defaults first, then rule-declared traits. */
    public Map<String, TraitDefinition> traits() {
        return traits;
    }

    public Map<String, ?> config() {
        return config;
    }

    /**
     * Builds the event for a notification this definition matched. Traits that resolve to nothing are omitted.
     *
     * @throws IllegalArgumentException when {@code event_type} is missing
     * @throws TraitConversionException when a trait value cannot be coerced
     */
    public Event toEvent(Map<String, ?> notification) {
        Object eventType = notification.get("event_type");
        if (eventType == null) {
            throw new IllegalArgumentException("Notification has no event_type");
        }
        Instant when = extractWhen(notification, clock);
        List<Trait> extracted = new ArrayList<>(traits.size());
        for (TraitDefinition def : traits.values()) {
            def.toTrait(notification).ifPresent(extracted::add);
        }
        return new Event(eventType.toString(), when, extracted);
    }

    /** Generation time: {@code timestamp}, then {@code _context_timestamp}, then the clock. */
    static Instant extractWhen(Map<String, ?> body, Clock clock) {
        Object when = present(body.get("timestamp")) ? body.get("timestamp") : body.get("_context_timestamp");
        if (present(when)) {
            return Timestamps.parse(when);
        }
        return clock.instant();
    }

    private static boolean present(Object value) {
        return value != null && !value.toString().isBlank();
    }

    private List<String> eventTypes(Map<String, ?> definitionConfig) {
        Object eventType = definitionConfig.get("event_type");
        if (eventType instanceof String single) {
            return List.of(single);
        }
        if (eventType instanceof Collection<?> many) {
            List<String> types = new ArrayList<>(many.size());
            for (Object t : many) {
                if (!(t instanceof String s)) {
                    throw new EventDefinitionException("event_type entries must be strings, got: " + t, config);
                }
                types.add(s);
            }
            return types;
        }
        throw new EventDefinitionException("event_type must be a string or a list of strings", config);
    }

    // Trait errors only know the trait's own config; rethrow against the whole rule.
    private TraitDefinition traitDefinition(String name, Map<String, ?> traitCfg) {
        try {
            return new TraitDefinition(name, traitCfg);
        } catch (EventDefinitionException ex) {
            throw new EventDefinitionException(
                    "Invalid trait " + name + " in event definition for " + matcher.includedTypes()
                            + excludedSuffix() + ": " + ex.getReason(),
                    config,
                    ex);
        }
    }

    private String excludedSuffix() {
        return matcher.excludedTypes().isEmpty() ? "" : " excluding " + matcher.excludedTypes();
    }

    @SuppressWarnings("unchecked")
    private Map<String, ?> traitConfig(String name, Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, ?>) map;
        }
        throw new EventDefinitionException("Definition of trait " + name + " must be a mapping", config);
    }

    private static Map<String, Map<String, Object>> defaultTraits() {
        Map<String, Map<String, Object>> defaults = new LinkedHashMap<>();
        defaults.put("message_id", Map.of("type", "text", "fields", "message_id"));
        defaults.put("service", Map.of("type", "text", "fields", "publisher_id"));
        defaults.put("request_id", Map.of("type", "text", "fields", "_context_request_id"));
        defaults.put("tenant_id", Map.of("type", "text", "fields", "_context_tenant"));
        return Collections.unmodifiableMap(defaults);
    }

    @Override
    public String toString() {
        return "EventDefinition{" + matcher + ", traits=" + traits.keySet() + "}";
    }
}
