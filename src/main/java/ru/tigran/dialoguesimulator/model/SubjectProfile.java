package ru.tigran.dialoguesimulator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Synthetic persona (demographics + political attitudes) driving the subject side of a dialogue.
 *
 * Defaults for missing values:
 * - age: 30
 * - politicalStance: 3 (center, scale 1 = left .. 5 = right)
 * - religiosity: 1
 * - openingResponse: {@link #DEFAULT_OPENING_RESPONSE}
 * - every other text field: empty string, collections: empty
 *
 * {@code sections} keeps the full parsed file, keyed by section header, for fields not promoted to components.
 */
public record SubjectProfile(
        @JsonProperty("profile_id") String profileId,
        @JsonProperty("age") int age,
        @JsonProperty("gender") String gender,
        @JsonProperty("marital_status") String maritalStatus,
        @JsonProperty("region") String region,
        @JsonProperty("religiosity") int religiosity,
        @JsonProperty("education") String education,
        @JsonProperty("political_stance") int politicalStance,
        @JsonProperty("last_election_vote") String lastElectionVote,
        @JsonProperty("military_service_recent") String militaryServiceRecent,
        @JsonProperty("war_priority") String warPriority,
        @JsonProperty("israel_action") String israelAction,
        @JsonProperty("opening_response") String openingResponse,
        @JsonProperty("typical_phrases") List<String> typicalPhrases,
        @JsonProperty("feeling_thermometer") Map<String, Object> feelingThermometer,
        @JsonProperty("social_distance") Map<String, Object> socialDistance,
        @JsonProperty("sections") Map<String, Map<String, Object>> sections
) {
    public static final int DEFAULT_AGE = 30;
    public static final int DEFAULT_POLITICAL_STANCE = 3;
    public static final int DEFAULT_RELIGIOSITY = 1;
    public static final String DEFAULT_OPENING_RESPONSE = "קשה לי עם כל המצב הזה";

    public SubjectProfile {
        gender = nullToEmpty(gender);
        maritalStatus = nullToEmpty(maritalStatus);
        region = nullToEmpty(region);
        education = nullToEmpty(education);
        lastElectionVote = nullToEmpty(lastElectionVote);
        militaryServiceRecent = nullToEmpty(militaryServiceRecent);
        warPriority = nullToEmpty(warPriority);
        israelAction = nullToEmpty(israelAction);
        openingResponse = openingResponse == null || openingResponse.isBlank()
                ? DEFAULT_OPENING_RESPONSE : openingResponse;
        typicalPhrases = typicalPhrases == null ? List.of() : List.copyOf(typicalPhrases);
        feelingThermometer = readOnly(feelingThermometer);
        socialDistance = readOnly(socialDistance);
        sections = sections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
    }

    /**
     * Builds a typed profile from parsed sections, applying the documented defaults.
     *
     * @param profileId profile id (file name without extension)
     * @param sections parsed key/value maps keyed by section
     * @return typed profile
     */
    public static SubjectProfile fromSections(String profileId, Map<ProfileSection, Map<String, Object>> sections) {
        Map<String, Object> basic = sections.getOrDefault(ProfileSection.BASIC_INFO, Map.of());
        Map<String, Object> political = sections.getOrDefault(ProfileSection.POLITICAL_BEHAVIOR, Map.of());
        Map<String, Object> war = sections.getOrDefault(ProfileSection.WAR_POSITION, Map.of());
        Map<String, Object> style = sections.getOrDefault(ProfileSection.CONVERSATION_STYLE, Map.of());

        Map<String, Map<String, Object>> raw = new LinkedHashMap<>();
        sections.forEach((section, values) -> raw.put(section.getHeader(), readOnly(values)));

        return new SubjectProfile(
                profileId,
                intValue(basic.get("age"), DEFAULT_AGE),
                stringValue(basic.get("gender")),
                stringValue(basic.get("marital_status")),
                stringValue(basic.get("region")),
                intValue(basic.get("religiosity"), DEFAULT_RELIGIOSITY),
                stringValue(basic.get("education")),
                intValue(basic.get("political_stance"), DEFAULT_POLITICAL_STANCE),
                stringValue(political.get("last_election_vote")),
                stringValue(political.get("military_service_recent")),
                stringValue(war.get("war_priority_pre")),
                stringValue(war.get("israel_action_pre")),
                stringValue(style.get("opening_response")),
                listValue(style.get("typical_phrases")),
                sections.getOrDefault(ProfileSection.FEELING_THERMOMETER_PRE, Map.of()),
                sections.getOrDefault(ProfileSection.SOCIAL_DISTANCE_PRE, Map.of()),
                raw
        );
    }

    /**
     * Profile group used for balance checks and test-mode selection: the id without its trailing
     * {@code _<number>}, so center_left_1 belongs to center_left and not to center.
     */
    public static String groupOf(String profileId) {
        return profileId.toLowerCase(Locale.ROOT).replaceFirst("_\\d+$", "");
    }

    private static int intValue(Object value, int defaultValue) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && text.trim().matches("-?\\d{1,9}")) {
            return Integer.parseInt(text.trim());
        }
        return defaultValue;
    }

    private static String stringValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof List<?> list) {
            return String.join(", ", list.stream().map(String::valueOf).toList());
        }
        return String.valueOf(value);
    }

    private static List<String> listValue(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).filter(item -> !item.isBlank()).toList();
        }
        if (value instanceof String text && !text.isBlank()) {
            return List.of(text);
        }
        return List.of();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static Map<String, Object> readOnly(Map<String, Object> values) {
        return values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
