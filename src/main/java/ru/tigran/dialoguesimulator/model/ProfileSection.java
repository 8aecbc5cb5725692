package ru.tigran.dialoguesimulator.model;

import java.util.Optional;

/**
 * Closed set of section headers allowed in a subject profile file.
 */
public enum ProfileSection {
    BASIC_INFO("basic_info"),
    POLITICAL_BEHAVIOR("political_behavior"),
    CIVIC_DATA("civic_data"),
    WAR_POSITION("war_position"),
    CONVERSATION_STYLE("conversation_style"),
    FEELING_THERMOMETER_PRE("feeling_thermometer_pre"),
    SOCIAL_DISTANCE_PRE("social_distance_pre");

    private final String header;

    ProfileSection(String header) {
        this.header = header;
    }

    public String getHeader() {
        return header;
    }

    public static Optional<ProfileSection> fromHeader(String header) {
        for (ProfileSection section : values()) {
            if (section.header.equalsIgnoreCase(header)) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }
}
