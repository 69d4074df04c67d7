package com.example.chatorchestrator.exception;

public class NotFoundException extends ChatOrchestrationException {

    public NotFoundException(String kind, String id) {
        super("NOT_FOUND", kind + " not found: " + id);
    }
}
