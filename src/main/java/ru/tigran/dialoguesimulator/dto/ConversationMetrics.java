package ru.tigran.dialoguesimulator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Flat feature vector of one finished conversation; one CSV row in the analysis report.
 */
@JsonPropertyOrder({
        "profile_id", "intervention", "political_stance", "age", "gender", "military_service",
        "war_priority", "israel_action", "total_messages", "user_messages", "agent_messages",
        "ending_reason", "agreement_signals", "disagreement_signals", "empathy_expressions",
        "shared_identity_refs", "emotion_level", "avg_message_length", "back_and_forth_ratio",
        "topic_consistency"
})
public record ConversationMetrics(
        @JsonProperty("profile_id") String profileId,
        @JsonProperty("intervention") String intervention,
        @JsonProperty("political_stance") int politicalStance,
        @JsonProperty("age") int age,
        @JsonProperty("gender") String gender,
        @JsonProperty("military_service") String militaryService,
        @JsonProperty("war_priority") String warPriority,
        @JsonProperty("israel_action") String israelAction,
        @JsonProperty("total_messages") int totalMessages,
        @JsonProperty("user_messages") int userMessages,
        @JsonProperty("agent_messages") int agentMessages,
        @JsonProperty("ending_reason") String endingReason,
        @JsonProperty("agreement_signals") int agreementSignals,
        @JsonProperty("disagreement_signals") int disagreementSignals,
        @JsonProperty("empathy_expressions") int empathyExpressions,
        @JsonProperty("shared_identity_refs") int sharedIdentityRefs,
        @JsonProperty("emotion_level") double emotionLevel,
        @JsonProperty("avg_message_length") double avgMessageLength,
        @JsonProperty("back_and_forth_ratio") double backAndForthRatio,
        @JsonProperty("topic_consistency") double topicConsistency
) {
}
