package ru.tigran.dialoguesimulator.exception;

/**
 * Thrown when a completion provider call fails (HTTP error, unparseable or empty response).
 *
 * Retriable for 5xx responses and network errors, non-retriable for other 4xx and malformed payloads.
 * The flag is informational only: the conversation simulator gives both the same bounded retries,
 * then fallback text.
 */
public class ProviderException extends ApplicationException {
    public ProviderException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }

    public ProviderException(String message, ErrorCode errorCode, boolean retriable) {
        super(message, errorCode, retriable);
    }

    public ProviderException(String message, ErrorCode errorCode, boolean retriable, Throwable cause) {
        super(message, errorCode, retriable, cause);
    }
}
