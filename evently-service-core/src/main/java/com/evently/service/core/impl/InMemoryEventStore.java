package com.evently.service.core.impl;

import com.evently.event.model.Event;
import com.evently.service.core.spi.EventStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps events in memory keyed by message id. A second event with an already stored message id is reported as
 * {@link Reason#DUPLICATE}; an event without a message id is reported as {@link Reason#UNKNOWN}.
 */
public final class InMemoryEventStore implements EventStore {

    private final Map<String, Event> byMessageId = new ConcurrentHashMap<>();

    @Override
    public List<RecordProblem> recordEvents(List<Event> events) {
        if (events == null || events.isEmpty()) return List.of();
        List<RecordProblem> problems = new ArrayList<>();
        for (Event event : events) {
            String messageId = event.messageId().orElse(null);
            if (messageId == null) {
                problems.add(new RecordProblem(Reason.UNKNOWN, event));
            } else if (byMessageId.putIfAbsent(messageId, event) != null) {
                problems.add(new RecordProblem(Reason.DUPLICATE, event));
            }
        }
        return problems.isEmpty() ? List.of() : List.copyOf(problems);
    }

    public Event get(String messageId) {
        return messageId == null ? null : byMessageId.get(messageId);
    }

    public int size() {
        return byMessageId.size();
    }
}
