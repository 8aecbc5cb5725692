package ru.tigran.dialoguesimulator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ConversationMetadata(
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("total_messages") int totalMessages,
        @JsonProperty("ending_reason") EndingReason endingReason
) {
}
