package com.example.chatorchestrator.event;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@ToString
public abstract class ChatEvent {

    private final String sessionId;
    private final Instant timestamp;

    protected ChatEvent(String sessionId) {
        this.sessionId = sessionId;
        this.timestamp = Instant.now();
    }

    public abstract ChatEventType getType();

    public String getEventName() {
        return getType().getEventName();
    }
}
