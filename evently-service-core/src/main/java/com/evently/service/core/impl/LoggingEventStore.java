package com.evently.service.core.impl;

import com.evently.event.model.Event;
import com.evently.service.core.spi.EventStore;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Store that only logs what it is given. Default when no real store is configured. */
public final class LoggingEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventStore.class);

    @Override
    public List<RecordProblem> recordEvents(List<Event> events) {
        if (events == null) return List.of();
        for (Event event : events) {
            log.info(
                    "event type={}, generated={}, messageId={}, traits={}",
                    event.eventType(),
                    event.generated(),
                    event.messageId().orElse(null),
                    event.traits());
        }
        return List.of();
    }
}
