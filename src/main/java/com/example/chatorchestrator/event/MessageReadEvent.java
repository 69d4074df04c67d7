package com.example.chatorchestrator.event;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class MessageReadEvent extends ChatEvent {

    private final String messageId;
    private final String userId;

    public MessageReadEvent(String sessionId, String messageId, String userId) {
        super(sessionId);
        this.messageId = messageId;
        this.userId = userId;
    }

    @Override
    public ChatEventType getType() {
        return ChatEventType.MESSAGE_READ;
    }
}
