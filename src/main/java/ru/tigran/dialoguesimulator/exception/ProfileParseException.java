package ru.tigran.dialoguesimulator.exception;

/**
 * Thrown when a subject profile file cannot be read or violates the profile grammar.
 */
public class ProfileParseException extends ApplicationException {
    public ProfileParseException(String message) {
        super(message, ErrorCode.INVALID_PROFILE);
    }

    public ProfileParseException(String message, Throwable cause) {
        super(message, ErrorCode.INVALID_PROFILE, false, cause);
    }
}
