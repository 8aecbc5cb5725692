package ru.tigran.dialoguesimulator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import ru.tigran.dialoguesimulator.model.Intervention;

/**
 * One planned (profile × intervention) cell of the experiment.
 */
public record Combination(
        @JsonProperty("profile_id") String profileId,
        @JsonProperty("intervention") Intervention intervention
) {
}
