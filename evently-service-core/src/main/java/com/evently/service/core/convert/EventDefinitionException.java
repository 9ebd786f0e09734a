package com.evently.service.core.convert;

import java.util.Map;

/**
 * Malformed event definition. Raised only while definitions are built; a converter is never created from a
 * partially valid table.
 */
public class EventDefinitionException extends RuntimeException {

    private final String reason;
    private final Map<String, ?> definition;

    public EventDefinitionException(String reason, Map<String, ?> definition) {
        this(reason, definition, null);
    }

    public EventDefinitionException(String reason, Map<String, ?> definition, Throwable cause) {
        super(reason + " (definition: " + definition + ")", cause);
        this.reason = reason;
        this.definition = definition;
    }

    public String getReason() {
        return reason;
    }

    public Map<String, ?> getDefinition() {
        return definition;
    }
}
