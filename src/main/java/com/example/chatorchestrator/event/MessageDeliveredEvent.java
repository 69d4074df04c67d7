package com.example.chatorchestrator.event;

import com.example.chatorchestrator.model.DeliveryResult;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class MessageDeliveredEvent extends ChatEvent {

    private final String messageId;
    private final DeliveryResult result;

    public MessageDeliveredEvent(String sessionId, String messageId, DeliveryResult result) {
        super(sessionId);
        this.messageId = messageId;
        this.result = result;
    }

    @Override
    public ChatEventType getType() {
        return ChatEventType.MESSAGE_DELIVERED;
    }
}
