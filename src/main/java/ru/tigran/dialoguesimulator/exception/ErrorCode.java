package ru.tigran.dialoguesimulator.exception;

/**
 * Enum for application error codes.
 * Each code has a default message for logging purposes.
 */
public enum ErrorCode {
    // Configuration errors
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", "Invalid simulator configuration"),
    NO_PROFILES_FOUND("NO_PROFILES_FOUND", "No subject profiles found"),
    PROFILE_NOT_FOUND("PROFILE_NOT_FOUND", "Subject profile not found"),
    INVALID_PROFILE("INVALID_PROFILE", "Subject profile file could not be parsed"),

    // Quota errors
    QUOTA_EXHAUSTED("QUOTA_EXHAUSTED", "Provider quota exhausted"),
    DAILY_LIMIT_REACHED("DAILY_LIMIT_REACHED", "Daily request limit reached"),

    // AI service errors
    AI_SERVICE_ERROR("AI_SERVICE_ERROR", "AI service error"),
    INVALID_AI_RESPONSE("INVALID_AI_RESPONSE", "Invalid response from AI service"),
    INTERRUPTED("INTERRUPTED", "Interrupted while waiting"),

    // Artifact errors
    PERSISTENCE_ERROR("PERSISTENCE_ERROR", "Failed to read or write an artifact");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
