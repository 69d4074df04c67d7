package com.example.chatorchestrator.exception;

public class CapacityExceededException extends ChatOrchestrationException {

    private final String sessionId;
    private final int maxParticipants;

    public CapacityExceededException(String sessionId, int maxParticipants) {
        super("CAPACITY_EXCEEDED", "Session " + sessionId + " is full (max " + maxParticipants + " participants)");
        this.sessionId = sessionId;
        this.maxParticipants = maxParticipants;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getMaxParticipants() {
        return maxParticipants;
    }
}
