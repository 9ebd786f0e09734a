package com.evently.ingest.rabbitmq;

import com.evently.service.core.collector.NotificationProcessor;
import com.evently.service.core.deadletter.NotificationDeadLetterTable;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Consumes notification JSON objects from RabbitMQ, one notification per message. */
@Component
@ConditionalOnProperty(prefix = "evently.ingest.rmq", name = "enabled", havingValue = "true")
public class RabbitMqIngestListener {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqIngestListener.class);
    private static final String SOURCE = "RMQ_CONSUMER";
    private static final TypeReference<Map<String, Object>> NOTIFICATION_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final NotificationProcessor processor;
    private final NotificationDeadLetterTable deadLetterTable;

    public RabbitMqIngestListener(
            ObjectMapper mapper, NotificationProcessor processor, NotificationDeadLetterTable deadLetterTable) {
        this.mapper = mapper;
        this.processor = processor;
        this.deadLetterTable = deadLetterTable;
    }

    @RabbitListener(queues = "${evently.ingest.rmq.queue:evently.notifications}", ackMode = "MANUAL")
    public void handle(Message message, Channel channel) throws IOException {
        long tag = message.getMessageProperties().getDeliveryTag();
        byte[] body = message.getBody();
        try {
            Map<String, Object> notification = mapper.readValue(body, NOTIFICATION_TYPE);
            processor.processNotification(notification);
        } catch (Exception ex) {
            recordDeadLetter(body, ex);
            log.warn("RabbitMQ notification dead-lettered due to {}. Delivery acknowledged.", ex.getMessage());
        } finally {
            channel.basicAck(tag, false);
        }
    }

    private void recordDeadLetter(byte[] payload, Exception ex) {
        try {
            String raw = payload == null ? "" : new String(payload, StandardCharsets.UTF_8);
            String detail = (ex.getMessage() == null || ex.getMessage().isBlank())
                    ? ex.getClass().getSimpleName()
                    : ex.getMessage();
            deadLetterTable.record(raw, "RMQ_INGEST_ERROR", detail, SOURCE);
        } catch (Exception loggingError) {
            log.error("Failed to write dead letter entry for RMQ payload", loggingError);
        }
    }
}
