package com.example.chatorchestrator.event;

import com.example.chatorchestrator.model.SessionMode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class SessionCreatedEvent extends ChatEvent {

    private final String hostUserId;
    private final SessionMode mode;

    public SessionCreatedEvent(String sessionId, String hostUserId, SessionMode mode) {
        super(sessionId);
        this.hostUserId = hostUserId;
        this.mode = mode;
    }

    @Override
    public ChatEventType getType() {
        return ChatEventType.SESSION_CREATED;
    }
}
