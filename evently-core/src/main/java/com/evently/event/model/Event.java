package com.evently.event.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalized event produced from a single notification.
 *
 * <p>Trait names are unique within an event and traits without a value are never present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Event(String eventType, Instant generated, List<Trait> traits) {

    public Event {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(generated, "generated");
        traits = traits == null ? List.of() : List.copyOf(traits);
    }

    public Optional<Trait> trait(String name) {
        if (name == null) return Optional.empty();
        for (Trait t : traits) {
            if (t.name().equals(name)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /** The {@code message_id} trait value, when the notification carried one. */
    @JsonIgnore
    public Optional<String> messageId() {
        return trait("message_id").map(t -> String.valueOf(t.value()));
    }
}
