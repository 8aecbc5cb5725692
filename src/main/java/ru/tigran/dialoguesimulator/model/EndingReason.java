package ru.tigran.dialoguesimulator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal tag on a finished conversation.
 */
public enum EndingReason {
    HARD_LIMIT("hard_limit"),
    NATURAL_ENDING("natural_ending"),
    SOFT_ENDING("soft_ending");

    private final String value;

    EndingReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Non-hard-limit endings get a trailing subject acknowledgment turn.
     */
    public boolean isNatural() {
        return this != HARD_LIMIT;
    }

    @JsonCreator
    public static EndingReason fromValue(String value) {
        for (EndingReason reason : values()) {
            if (reason.value.equalsIgnoreCase(value)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Invalid ending reason: " + value);
    }
}
