package ru.tigran.dialoguesimulator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A finished two-party dialogue.
 * The turn list is copied on construction, so a Conversation never changes after the simulator returns it.
 * The profile snapshot is kept so transcripts can be analyzed without the profile files.
 */
public record Conversation(
        @JsonProperty("profile_id") String profileId,
        @JsonProperty("intervention") Intervention intervention,
        @JsonProperty("turns") List<Turn> turns,
        @JsonProperty("metadata") ConversationMetadata metadata,
        @JsonProperty("profile") SubjectProfile profile
) {
    public Conversation {
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    @JsonIgnore
    public int turnCount() {
        return turns.size();
    }

    @JsonIgnore
    public long countByRole(Role role) {
        return turns.stream().filter(turn -> turn.role() == role).count();
    }
}
