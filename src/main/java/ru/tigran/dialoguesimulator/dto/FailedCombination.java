package ru.tigran.dialoguesimulator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import ru.tigran.dialoguesimulator.model.Intervention;

public record FailedCombination(
        @JsonProperty("profile_id") String profileId,
        @JsonProperty("intervention") Intervention intervention,
        @JsonProperty("error") String error
) {
}
