package ru.tigran.dialoguesimulator.config;

import java.time.Duration;
import java.util.List;

/**
 * Experiment pacing and bookkeeping settings. These throttles sit on top of the rate limiter.
 *
 * @param conversationDelay pause between conversations
 * @param longPause pause after every {@code longPauseEvery}-th conversation
 * @param rateLimitCooldown pause after a combination failed on a rate limit signal
 * @param checkpointAfterFailures failures after which a checkpoint log is written on every further failure
 * @param estimatedTokensPerConversation coarse conversation-level token estimate
 * @param testModeCombinations combinations kept in test mode
 * @param testModeStances profile id fragments, one profile picked per fragment in test mode
 * @param balanceTolerance allowed spread between cell counts
 */
public record ExperimentSettings(
        Duration conversationDelay,
        Duration longPause,
        int longPauseEvery,
        Duration rateLimitCooldown,
        int checkpointAfterFailures,
        int estimatedTokensPerConversation,
        int testModeCombinations,
        List<String> testModeStances,
        int balanceTolerance
) {
    public ExperimentSettings {
        if (longPauseEvery < 1) {
            throw new IllegalArgumentException("longPauseEvery must be >= 1");
        }
        testModeStances = testModeStances == null ? List.of() : List.copyOf(testModeStances);
    }
}
