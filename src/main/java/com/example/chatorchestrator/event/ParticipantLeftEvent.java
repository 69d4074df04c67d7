package com.example.chatorchestrator.event;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class ParticipantLeftEvent extends ChatEvent {

    private final String userId;

    public ParticipantLeftEvent(String sessionId, String userId) {
        super(sessionId);
        this.userId = userId;
    }

    @Override
    public ChatEventType getType() {
        return ChatEventType.PARTICIPANT_LEFT;
    }
}
