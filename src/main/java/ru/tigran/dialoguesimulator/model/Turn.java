package ru.tigran.dialoguesimulator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One role-attributed, timestamped utterance.
 */
public record Turn(
        @JsonProperty("role") Role role,
        @JsonProperty("text") String text,
        @JsonProperty("timestamp") Instant timestamp
) {
    public Turn {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
