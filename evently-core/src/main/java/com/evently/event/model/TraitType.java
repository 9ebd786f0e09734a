package com.evently.event.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Declared data type of a trait. Config values are the lowercase names. */
public enum TraitType {
    TEXT,
    INT,
    FLOAT,
    DATETIME;

    @JsonValue
    public String configValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a declared type from its config spelling. A missing value means {@link #TEXT}.
     *
     * @throws IllegalArgumentException for anything other than text, int, float or datetime
     */
    public static TraitType fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "text" -> TEXT;
            case "int" -> INT;
            case "float" -> FLOAT;
            case "datetime" -> DATETIME;
            default -> throw new IllegalArgumentException("Unsupported trait type: " + value);
        };
    }
}
