package com.example.chatorchestrator.event;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class PresenceChangedEvent extends ChatEvent {

    private final String userId;
    private final boolean online;

    public PresenceChangedEvent(String sessionId, String userId, boolean online) {
        super(sessionId);
        this.userId = userId;
        this.online = online;
    }

    @Override
    public ChatEventType getType() {
        return ChatEventType.PRESENCE_CHANGED;
    }
}
