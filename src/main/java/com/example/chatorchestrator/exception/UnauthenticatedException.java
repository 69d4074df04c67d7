package com.example.chatorchestrator.exception;

public class UnauthenticatedException extends ChatOrchestrationException {

    public UnauthenticatedException() {
        super("UNAUTHENTICATED", "No current user in the caller context");
    }
}
