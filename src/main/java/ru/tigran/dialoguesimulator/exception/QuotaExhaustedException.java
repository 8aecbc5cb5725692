package ru.tigran.dialoguesimulator.exception;

/**
 * Thrown when the provider reports quota exhaustion (HTTP 429 / RESOURCE_EXHAUSTED).
 * Keeps the raw error payload so a retry delay hint can be extracted from it.
 */
public class QuotaExhaustedException extends ProviderException {
    private final String payload;

    public QuotaExhaustedException(String message, String payload) {
        super(message, ErrorCode.QUOTA_EXHAUSTED, true);
        this.payload = payload;
    }

    public String getPayload() {
        return payload;
    }
}
