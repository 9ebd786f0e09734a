package com.evently.ingest.rabbitmq;

import com.evently.service.core.collector.NotificationProcessor;
import com.evently.service.core.config.EventConverterConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Collector process: notifications in from RabbitMQ, events out to the configured {@code EventStore}. */
@SpringBootApplication(
        scanBasePackageClasses = {
            EventConverterConfiguration.class,
            NotificationProcessor.class,
            RabbitMqIngestApplication.class
        })
public class RabbitMqIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(RabbitMqIngestApplication.class, args);
    }
}
