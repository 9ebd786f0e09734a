package com.evently.service.core.convert;

import com.evently.event.model.Event;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts notifications into events using an ordered table of {@link EventDefinition}s.
 *
 * <p>Order is significant: a notification is handled by the FIRST definition whose event type patterns accept it,
 * even when a later definition is more specific. With {@code addCatchAll} a definition for {@code *} with only the
 * default traits is appended, unless the table already contains a catch-all, so every notification converts.
 *
 * <p>The table is immutable once built and {@link #toEvent} performs no I/O, so one instance can serve any number of
 * threads.
 */
public final class NotificationEventConverter {

    private final List<EventDefinition> definitions;

    public NotificationEventConverter(List<?> eventsConfig, boolean addCatchAll) {
        this(eventsConfig, addCatchAll, Clock.systemUTC());
    }

    public NotificationEventConverter(List<?> eventsConfig, boolean addCatchAll, Clock clock) {
        Objects.requireNonNull(clock, "clock");
        List<EventDefinition> defs = new ArrayList<>();
        if (eventsConfig != null) {
            for (Object eventDef : eventsConfig) {
                defs.add(new EventDefinition(definitionConfig(eventDef), clock));
            }
        }
        if (addCatchAll && defs.stream().noneMatch(EventDefinition::isCatchAll)) {
            defs.add(new EventDefinition(Map.of("event_type", EventTypeMatcher.MATCH_ALL, "traits", Map.of()), clock));
        }
        this.definitions = List.copyOf(defs);
    }

    public List<EventDefinition> definitions() {
        return definitions;
    }

    /** The definition that would handle {@code eventType}, if any. */
    public Optional<EventDefinition> definitionFor(String eventType) {
        for (EventDefinition d : definitions) {
            if (d.matchType(eventType)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }

    /**
     * @return the converted event, or empty when no definition matches and the notification is to be dropped
     * @throws IllegalArgumentException when {@code event_type} or {@code message_id} is missing
     * @throws TraitConversionException when a trait value cannot be coerced to its declared type
     */
    public Optional<Event> toEvent(Map<String, ?> notification) {
        Objects.requireNonNull(notification, "notification");
        Object eventType = notification.get("event_type");
        if (eventType == null) {
            throw new IllegalArgumentException("Notification has no event_type");
        }
        if (notification.get("message_id") == null) {
            throw new IllegalArgumentException("Notification " + eventType + " has no message_id");
        }
        return definitionFor(eventType.toString()).map(d -> d.toEvent(notification));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> definitionConfig(Object eventDef) {
        if (eventDef instanceof Map<?, ?> map) {
            return (Map<String, ?>) map;
        }
        throw new EventDefinitionException("Event definition must be a mapping, got: " + eventDef, null);
    }
}
