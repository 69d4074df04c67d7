package com.example.chatorchestrator.exception;

/**
 * A read-through fetch from the store failed. Writes never throw this; they report a
 * failed sync result instead.
 */
public class PersistenceException extends ChatOrchestrationException {

    public PersistenceException(String message, Throwable cause) {
        super("PERSISTENCE_FAILURE", message, cause);
    }
}
