package ru.tigran.dialoguesimulator.config;

import java.time.Duration;

/**
 * Conversation driver settings.
 *
 * @param model provider model name
 * @param hardLimit turn ceiling, never exceeded
 * @param minEndingTurns turn count from which closing phrases end the conversation
 * @param softEndingTurns turn count from which the random soft ending applies
 * @param softEndingProbability per-turn chance of a soft ending
 * @param maxRetries attempts per generation call before falling back
 * @param retryBuffer added to the provider-advised retry delay
 * @param agentHistoryTurns recent turns shown to the agent
 * @param subjectHistoryTurns recent turns shown to the subject
 * @param estimatedTokensPerCall rate limiter token estimate for one generation call
 */
public record ConversationSettings(
        String model,
        int hardLimit,
        int minEndingTurns,
        int softEndingTurns,
        double softEndingProbability,
        int maxRetries,
        Duration retryBuffer,
        int agentHistoryTurns,
        int subjectHistoryTurns,
        int estimatedTokensPerCall
) {
    public ConversationSettings {
        if (hardLimit < 2) {
            throw new IllegalArgumentException("hardLimit must leave room for the two opening turns");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1");
        }
        if (softEndingProbability < 0.0 || softEndingProbability > 1.0) {
            throw new IllegalArgumentException("softEndingProbability must be within [0, 1]");
        }
        if (agentHistoryTurns < 1 || subjectHistoryTurns < 1) {
            throw new IllegalArgumentException("History windows must hold at least one turn");
        }
    }
}
