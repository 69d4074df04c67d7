package com.example.chatorchestrator.exception;

/**
 * Structural failure that aborts an orchestrator operation.
 */
public class ChatOrchestrationException extends RuntimeException {

    private final String code;

    public ChatOrchestrationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ChatOrchestrationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
