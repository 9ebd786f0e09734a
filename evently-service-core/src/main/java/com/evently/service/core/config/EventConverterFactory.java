package com.evently.service.core.config;

import com.evently.service.core.convert.EventDefinition;
import com.evently.service.core.convert.NotificationEventConverter;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the converter from the configured definitions file and drop policy. */
public class EventConverterFactory {

    private static final Logger log = LoggerFactory.getLogger(EventConverterFactory.class);

    private final EventDefinitionsLoader loader;
    private final boolean allowDroppingOfNotifications;
    private final Clock clock;

    public EventConverterFactory(EventDefinitionsLoader loader, boolean allowDroppingOfNotifications, Clock clock) {
        this.loader = loader;
        this.allowDroppingOfNotifications = allowDroppingOfNotifications;
        this.clock = clock;
    }

    public NotificationEventConverter create() {
        List<Map<String, Object>> eventsConfig = loader.load();
        log.info("Event definitions: {}", eventsConfig);

        NotificationEventConverter converter =
                new NotificationEventConverter(eventsConfig, !allowDroppingOfNotifications, clock);
        for (EventDefinition d : converter.definitions()) {
            log.info(
                    "Event definition: include={} exclude={} traits={}",
                    d.matcher().includedTypes(),
                    d.matcher().excludedTypes(),
                    d.traits().keySet());
        }
        return converter;
    }
}
