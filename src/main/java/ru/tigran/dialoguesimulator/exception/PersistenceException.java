package ru.tigran.dialoguesimulator.exception;

/**
 * Thrown when a conversation, experiment log or metrics report cannot be written or read.
 */
public class PersistenceException extends ApplicationException {
    public PersistenceException(String message, Throwable cause) {
        super(message, ErrorCode.PERSISTENCE_ERROR, false, cause);
    }
}
