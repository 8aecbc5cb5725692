package ru.tigran.dialoguesimulator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Speaker of a turn: the intervention-carrying agent or the profile-driven subject.
 */
public enum Role {
    AGENT("agent", "Agent"),
    SUBJECT("subject", "User");

    private final String value;
    private final String historyLabel;

    Role(String value, String historyLabel) {
        this.value = value;
        this.historyLabel = historyLabel;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Label used when rendering conversation history into a prompt.
     */
    public String getHistoryLabel() {
        return historyLabel;
    }

    public Role opposite() {
        return this == AGENT ? SUBJECT : AGENT;
    }

    /**
     * Get Role enum by string value (case-insensitive).
     * Accepts the legacy "assistant"/"user" names as well.
     *
     * @param value the string value
     * @return Role enum or throws IllegalArgumentException if not found
     */
    @JsonCreator
    public static Role fromValue(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Role value cannot be null or empty");
        }
        if ("assistant".equalsIgnoreCase(value)) {
            return AGENT;
        }
        if ("user".equalsIgnoreCase(value)) {
            return SUBJECT;
        }
        for (Role role : Role.values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Invalid role value: " + value);
    }
}
