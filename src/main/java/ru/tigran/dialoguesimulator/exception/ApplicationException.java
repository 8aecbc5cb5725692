package ru.tigran.dialoguesimulator.exception;

/**
 * Base exception class for all application-specific exceptions.
 * Carries an error code and a retriability flag.
 *
 * The flag classifies the failure (transient quota exhaustion, 5xx or network errors vs. permanent
 * client errors) for logs and callers; it does not change control flow. The conversation simulator
 * retries every provider failure up to its attempt limit regardless of the flag.
 */
public abstract class ApplicationException extends RuntimeException {
    private final String errorCode;
    private final boolean retriable;

    protected ApplicationException(String message, ErrorCode errorCode) {
        this(message, errorCode, false);
    }

    protected ApplicationException(String message, ErrorCode errorCode, boolean retriable) {
        super(message);
        this.errorCode = errorCode.getCode();
        this.retriable = retriable;
    }

    protected ApplicationException(String message, ErrorCode errorCode, boolean retriable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode.getCode();
        this.retriable = retriable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Returns true if this exception represents a transient error that can be retried.
     *
     * @return true if retriable, false if permanent error
     */
    public boolean isRetriable() {
        return retriable;
    }
}
