package ru.tigran.dialoguesimulator.config;

import java.time.Duration;

/**
 * Provider quota ceilings. Defaults match the Gemini 2.0 Flash free tier.
 *
 * @param safetyMargin added to every per-minute wait so the recheck lands after the window edge
 */
public record RateLimitSettings(
        int requestsPerMinute,
        long tokensPerMinute,
        int requestsPerDay,
        Duration safetyMargin
) {
    public RateLimitSettings {
        if (requestsPerMinute <= 0 || tokensPerMinute <= 0 || requestsPerDay <= 0) {
            throw new IllegalArgumentException("Rate limit ceilings must be positive");
        }
        if (safetyMargin == null || safetyMargin.isNegative()) {
            throw new IllegalArgumentException("safetyMargin must be >= 0");
        }
    }
}
