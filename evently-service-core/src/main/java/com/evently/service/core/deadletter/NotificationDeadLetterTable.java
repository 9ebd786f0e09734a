package com.evently.service.core.deadletter;

/**
 * Keeps notifications that could not be turned into events so they can be inspected or replayed later.
 */
public interface NotificationDeadLetterTable {
    void record(String payload, String reason, String detail, String source);
}
