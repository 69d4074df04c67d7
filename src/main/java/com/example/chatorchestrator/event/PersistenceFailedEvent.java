package com.example.chatorchestrator.event;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class PersistenceFailedEvent extends ChatEvent {

    private final String operation;
    private final String error;

    public PersistenceFailedEvent(String sessionId, String operation, String error) {
        super(sessionId);
        this.operation = operation;
        this.error = error;
    }

    @Override
    public ChatEventType getType() {
        return ChatEventType.PERSISTENCE_FAILED;
    }
}
