package com.example.chatorchestrator.event;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class TypingStatusChangedEvent extends ChatEvent {

    private final String userId;
    private final boolean typing;

    public TypingStatusChangedEvent(String sessionId, String userId, boolean typing) {
        super(sessionId);
        this.userId = userId;
        this.typing = typing;
    }

    @Override
    public ChatEventType getType() {
        return ChatEventType.TYPING_STATUS_CHANGED;
    }
}
