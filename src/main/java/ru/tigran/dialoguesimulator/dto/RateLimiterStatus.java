package ru.tigran.dialoguesimulator.dto;

/**
 * Read-only snapshot of quota usage against each ceiling.
 */
public record RateLimiterStatus(
        int dailyRequestsUsed,
        int dailyRequestsLimit,
        int recentRequestsPerMinute,
        int requestsPerMinuteLimit,
        long recentTokensPerMinute,
        long tokensPerMinuteLimit,
        boolean canMakeRequest
) {
}
