package com.evently.event.model;

import java.util.Objects;

/**
 * One named, typed fact extracted from a notification.
 *
 * <p>The value class follows the type: {@code String} for TEXT, {@code Long} for INT, {@code Double} for FLOAT and
 * {@code java.time.Instant} for DATETIME.
 */
public record Trait(String name, TraitType type, Object value) {

    public Trait {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }
}
