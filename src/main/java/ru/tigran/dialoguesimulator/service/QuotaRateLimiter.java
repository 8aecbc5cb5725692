package ru.tigran.dialoguesimulator.service;

import lombok.extern.slf4j.Slf4j;
import ru.tigran.dialoguesimulator.config.RateLimitSettings;
import ru.tigran.dialoguesimulator.dto.AdmissionDecision;
import ru.tigran.dialoguesimulator.dto.RateLimiterStatus;
import ru.tigran.dialoguesimulator.exception.DailyQuotaExceededException;
import ru.tigran.dialoguesimulator.util.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Client-side guard for three independent provider quotas: requests per minute,
 * tokens per minute and requests per day.
 *
 * The per-minute checks are an exact sliding window over a log of admitted requests:
 * an event at time t is in the window at time now iff t > now - 60s. Nothing runs in
 * the background; every check recomputes the windows from the logs. The daily counter
 * is reset lazily on the first check more than 24 hours after the previous reset.
 *
 * Token costs are caller-supplied estimates, never reconciled with provider-reported usage.
 *
 * The check-then-record sequence is not atomic. Methods are synchronized so the
 * bookkeeping itself stays consistent, but callers sharing one limiter across threads
 * must serialize waitIfNeeded + recordRequest themselves.
 */
@Slf4j
public class QuotaRateLimiter {

    private static final Duration WINDOW = Duration.ofMinutes(1);
    private static final Duration DAY = Duration.ofDays(1);

    private final RateLimitSettings limits;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Deque<Instant> requestLog = new ArrayDeque<>();
    private final Deque<TokenEntry> tokenLog = new ArrayDeque<>();
    private int dailyRequestCount;
    private Instant dailyResetTime;

    public QuotaRateLimiter(RateLimitSettings limits, Clock clock, Sleeper sleeper) {
        this.limits = limits;
        this.clock = clock;
        this.sleeper = sleeper;
        this.dailyResetTime = clock.instant();
    }

    /**
     * Checks whether a request estimated at {@code estimatedTokens} may be sent now.
     * Never throws.
     *
     * @param estimatedTokens caller's token estimate for the request
     * @return admission decision with the blocking reason and the time until the window frees up
     */
    public synchronized AdmissionDecision canMakeRequest(int estimatedTokens) {
        Instant now = clock.instant();
        rollDailyWindowIfNeeded(now);

        if (dailyRequestCount >= limits.requestsPerDay()) {
            return AdmissionDecision.block(
                    AdmissionDecision.Reason.DAILY_LIMIT,
                    String.format("Daily limit reached (%d requests)", limits.requestsPerDay()),
                    Duration.ZERO
            );
        }

        evictExpired(now);

        if (requestLog.size() >= limits.requestsPerMinute()) {
            Duration wait = Duration.between(now, requestLog.peekFirst().plus(WINDOW));
            return AdmissionDecision.block(
                    AdmissionDecision.Reason.REQUESTS_PER_MINUTE,
                    String.format("Rate limit: wait %d seconds", wait.toSeconds()),
                    wait
            );
        }

        long recentTokens = tokensInWindow();
        if (recentTokens + estimatedTokens > limits.tokensPerMinute()) {
            Duration wait = tokenLog.isEmpty()
                    ? Duration.ZERO
                    : Duration.between(now, tokenLog.peekFirst().time().plus(WINDOW));
            return AdmissionDecision.block(
                    AdmissionDecision.Reason.TOKENS_PER_MINUTE,
                    String.format("Token limit would be exceeded (%d > %d)",
                            recentTokens + estimatedTokens, limits.tokensPerMinute()),
                    wait
            );
        }

        return AdmissionDecision.allow();
    }

    /**
     * Blocks until a request estimated at {@code estimatedTokens} is admissible.
     * On a per-minute block sleeps until the oldest in-window event leaves the window
     * (plus the safety margin) and checks again.
     *
     * @param estimatedTokens caller's token estimate for the request
     * @throws DailyQuotaExceededException if the daily ceiling is reached
     * @throws IllegalArgumentException if the estimate alone exceeds the tokens-per-minute ceiling
     * @throws InterruptedException if interrupted while sleeping
     */
    public void waitIfNeeded(int estimatedTokens) throws InterruptedException {
        if (estimatedTokens > limits.tokensPerMinute()) {
            throw new IllegalArgumentException(String.format(
                    "Estimated tokens %d exceed the per-minute ceiling %d and can never be admitted",
                    estimatedTokens, limits.tokensPerMinute()));
        }

        while (true) {
            AdmissionDecision decision = canMakeRequest(estimatedTokens);
            if (decision.allowed()) {
                return;
            }
            if (decision.reason() == AdmissionDecision.Reason.DAILY_LIMIT) {
                log.error("Rate limit error: {}", decision.message());
                throw new DailyQuotaExceededException("Rate limit error: " + decision.message());
            }

            Duration wait = decision.retryAfter().plus(limits.safetyMargin());
            log.info("Rate limited: {}. Waiting {} ms", decision.message(), wait.toMillis());
            sleeper.sleep(wait);
        }
    }

    /**
     * Records one admitted request. Called once per attempt whatever its outcome,
     * since the attempt itself consumed quota.
     *
     * @param tokensUsed caller's token estimate for the request
     */
    public synchronized void recordRequest(int tokensUsed) {
        Instant now = clock.instant();
        rollDailyWindowIfNeeded(now);
        evictExpired(now);

        requestLog.addLast(now);
        tokenLog.addLast(new TokenEntry(now, tokensUsed));
        dailyRequestCount++;

        if (dailyRequestCount % 10 == 0) {
            log.info("Progress: {}/{} daily requests used", dailyRequestCount, limits.requestsPerDay());
        }
    }

    /**
     * Snapshot of usage against each ceiling. Does not modify the logs.
     */
    public synchronized RateLimiterStatus getStatus() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(WINDOW);

        int recentRequests = (int) requestLog.stream().filter(time -> time.isAfter(cutoff)).count();
        long recentTokens = tokenLog.stream()
                .filter(entry -> entry.time().isAfter(cutoff))
                .mapToLong(TokenEntry::tokens)
                .sum();
        boolean dailyAvailable = isNewDay(now) || dailyRequestCount < limits.requestsPerDay();
        boolean canRequest = dailyAvailable
                && recentRequests < limits.requestsPerMinute()
                && recentTokens < limits.tokensPerMinute();

        return new RateLimiterStatus(
                isNewDay(now) ? 0 : dailyRequestCount,
                limits.requestsPerDay(),
                recentRequests,
                limits.requestsPerMinute(),
                recentTokens,
                limits.tokensPerMinute(),
                canRequest
        );
    }

    private void rollDailyWindowIfNeeded(Instant now) {
        if (isNewDay(now)) {
            dailyRequestCount = 0;
            dailyResetTime = now;
            log.info("Daily limit reset. New day started at {}", now);
        }
    }

    private boolean isNewDay(Instant now) {
        return Duration.between(dailyResetTime, now).compareTo(DAY) > 0;
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!requestLog.isEmpty() && !requestLog.peekFirst().isAfter(cutoff)) {
            requestLog.removeFirst();
        }
        while (!tokenLog.isEmpty() && !tokenLog.peekFirst().time().isAfter(cutoff)) {
            tokenLog.removeFirst();
        }
    }

    private long tokensInWindow() {
        return tokenLog.stream().mapToLong(TokenEntry::tokens).sum();
    }

    private record TokenEntry(Instant time, long tokens) {
    }
}
