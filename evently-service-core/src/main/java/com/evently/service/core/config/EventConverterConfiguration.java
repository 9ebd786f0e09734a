package com.evently.service.core.config;

import com.evently.service.core.convert.NotificationEventConverter;
import com.evently.service.core.deadletter.LoggingNotificationDeadLetterTable;
import com.evently.service.core.deadletter.NotificationDeadLetterTable;
import com.evently.service.core.impl.LoggingEventStore;
import com.evently.service.core.spi.EventStore;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(EventPipelineProperties.class)
public class EventConverterConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock systemUtcClock() {
        return Clock.systemUTC();
    }

    @Bean
    public NotificationEventConverter notificationEventConverter(EventPipelineProperties properties, Clock clock) {
        EventDefinitionsLoader loader = new EventDefinitionsLoader(properties.getDefinitionsFile());
        return new EventConverterFactory(loader, properties.isAllowDroppingOfNotifications(), clock).create();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventStore eventStore() {
        return new LoggingEventStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDeadLetterTable notificationDeadLetterTable() {
        return new LoggingNotificationDeadLetterTable();
    }
}
