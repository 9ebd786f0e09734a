package com.evently.service.core.deadletter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingNotificationDeadLetterTable implements NotificationDeadLetterTable {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationDeadLetterTable.class);

    @Override
    public void record(String payload, String reason, String detail, String source) {
        log.warn("Dead letter: source={} reason={} detail={} payload={}", source, reason, detail, payload);
    }
}
