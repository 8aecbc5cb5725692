package ru.tigran.dialoguesimulator.service;

import java.time.Duration;

/**
 * Reads a provider-advised retry delay out of a quota-exhaustion error payload.
 */
public interface RetryDelayExtractor {

    /**
     * @param payload raw error payload, may be null
     * @return advised delay, or the implementation's fallback when the payload carries none
     */
    Duration retryDelay(String payload);
}
