package ru.tigran.dialoguesimulator.exception;

/**
 * Thrown for configuration-fatal problems that abort a whole run.
 * Examples: profiles directory missing, no profiles found, none of the requested profile ids exist.
 */
public class ConfigurationException extends ApplicationException {
    public ConfigurationException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }
}
