package com.evently.service.core.spi;

import com.evently.event.model.Event;
import java.util.List;

/** Destination for converted events. Implementations are expected to be idempotent on the message id. */
public interface EventStore {

    /**
     * @return the events that could not be recorded, with the reason; empty when all were stored
     */
    List<RecordProblem> recordEvents(List<Event> events);

    record RecordProblem(Reason reason, Event event) {}

    enum Reason {
        DUPLICATE,
        UNKNOWN
    }
}
