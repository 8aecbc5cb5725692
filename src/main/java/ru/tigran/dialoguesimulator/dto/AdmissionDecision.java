package ru.tigran.dialoguesimulator.dto;

import java.time.Duration;

/**
 * Result of a rate limiter admission check.
 *
 * @param allowed whether a request may be sent now
 * @param reason which ceiling blocked the request, OK when allowed
 * @param message human readable explanation
 * @param retryAfter time until the oldest relevant in-window event leaves the window (zero when allowed or daily-blocked)
 */
public record AdmissionDecision(
        boolean allowed,
        Reason reason,
        String message,
        Duration retryAfter
) {
    public static AdmissionDecision allow() {
        return new AdmissionDecision(true, Reason.OK, "OK", Duration.ZERO);
    }

    public static AdmissionDecision block(Reason reason, String message, Duration retryAfter) {
        Duration wait = retryAfter == null || retryAfter.isNegative() ? Duration.ZERO : retryAfter;
        return new AdmissionDecision(false, reason, message, wait);
    }

    public enum Reason {
        OK, DAILY_LIMIT, REQUESTS_PER_MINUTE, TOKENS_PER_MINUTE
    }
}
