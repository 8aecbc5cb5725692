package ru.tigran.dialoguesimulator.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrapes {@code "retryDelay": "<n>s"} out of a Gemini RESOURCE_EXHAUSTED payload.
 * Accepts single or double quotes and a fractional part, which is dropped.
 * Falls back to a fixed delay when the payload has no hint.
 */
@Slf4j
public class RegexRetryDelayExtractor implements RetryDelayExtractor {

    public static final Duration DEFAULT_FALLBACK = Duration.ofSeconds(60);

    private static final Pattern RETRY_DELAY_PATTERN =
            Pattern.compile("[\"']retryDelay[\"']\\s*:\\s*[\"'](\\d+)(?:\\.\\d+)?s[\"']");

    private final Duration fallback;

    public RegexRetryDelayExtractor() {
        this(DEFAULT_FALLBACK);
    }

    public RegexRetryDelayExtractor(Duration fallback) {
        this.fallback = fallback;
    }

    @Override
    public Duration retryDelay(String payload) {
        if (payload == null || payload.isBlank()) {
            return fallback;
        }
        Matcher matcher = RETRY_DELAY_PATTERN.matcher(payload);
        if (matcher.find()) {
            try {
                return Duration.ofSeconds(Long.parseLong(matcher.group(1)));
            } catch (NumberFormatException e) {
                log.warn("Unparseable retry delay '{}', using fallback {}s", matcher.group(1), fallback.toSeconds());
                return fallback;
            }
        }
        log.debug("No retry delay hint in payload, using fallback {}s", fallback.toSeconds());
        return fallback;
    }
}
