package com.evently.ingest.rabbitmq;

import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Declares the notifications queue so the listener can start against a fresh broker. */
@Configuration
@EnableRabbit
@ConditionalOnProperty(prefix = "evently.ingest.rmq", name = "enabled", havingValue = "true")
public class RabbitMqIngestConfiguration {

    @Bean
    public Queue notificationsQueue(@Value("${evently.ingest.rmq.queue:evently.notifications}") String name) {
        return QueueBuilder.durable(name).build();
    }
}
