package com.evently.service.core.collector;

import com.evently.event.model.Event;
import com.evently.service.core.config.EventPipelineProperties;
import com.evently.service.core.convert.NotificationEventConverter;
import com.evently.service.core.deadletter.NotificationDeadLetterTable;
import com.evently.service.core.spi.EventStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Collector-side handling of one received notification: convert it and hand the event to the store.
 *
 * <p>A notification that cannot be converted is dead-lettered and processing continues with the next one. Failures of
 * the store itself are not handled here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationProcessor {

    static final String CONVERSION_ERROR = "EVENT_CONVERSION_ERROR";
    private static final String SOURCE = "EVENT_CONVERTER";

    private final NotificationEventConverter converter;
    private final EventStore eventStore;
    private final NotificationDeadLetterTable deadLetterTable;
    private final EventPipelineProperties properties;
    private final ObjectMapper mapper;

    public void processNotification(Map<String, Object> notification) {
        if (properties.isStoreEvents()) {
            messageToEvent(notification);
        }
    }

    /**
     * @return the converted event, or empty when the notification was dropped or dead-lettered
     */
    Optional<Event> messageToEvent(Map<String, Object> notification) {
        Optional<Event> event;
        try {
            event = converter.toEvent(notification);
        } catch (IllegalArgumentException ex) {
            log.warn(
                    "Unable to convert notification {} (uuid:{}): {}",
                    notification.get("event_type"),
                    notification.get("message_id"),
                    ex.getMessage());
            deadLetterTable.record(toJson(notification), CONVERSION_ERROR, ex.getMessage(), SOURCE);
            return Optional.empty();
        }

        if (event.isEmpty()) {
            log.debug(
                    "Dropping Notification {} (uuid:{})", notification.get("event_type"), notification.get("message_id"));
            return Optional.empty();
        }

        Event e = event.get();
        log.debug("Saving event \"{}\"", e.eventType());
        List<EventStore.RecordProblem> problems = eventStore.recordEvents(List.of(e));
        for (EventStore.RecordProblem problem : problems) {
            log.error(
                    "Failed to record event: {}, reason: {}",
                    problem.event().messageId().orElse(null),
                    problem.reason());
        }
        return event;
    }

    private String toJson(Map<String, Object> notification) {
        try {
            return mapper.writeValueAsString(notification);
        } catch (JsonProcessingException ex) {
            log.debug("Notification not serializable as JSON, recording toString(): {}", ex.getOriginalMessage());
            return String.valueOf(notification);
        }
    }
}
