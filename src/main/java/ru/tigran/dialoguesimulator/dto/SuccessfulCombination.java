package ru.tigran.dialoguesimulator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import ru.tigran.dialoguesimulator.model.EndingReason;
import ru.tigran.dialoguesimulator.model.Intervention;

public record SuccessfulCombination(
        @JsonProperty("profile_id") String profileId,
        @JsonProperty("intervention") Intervention intervention,
        @JsonProperty("message_count") int messageCount,
        @JsonProperty("ending_reason") EndingReason endingReason,
        @JsonProperty("file_path") String filePath
) {
}
