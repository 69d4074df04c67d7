package com.example.chatorchestrator.event;

import com.example.chatorchestrator.model.Participant;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class ParticipantJoinedEvent extends ChatEvent {

    private final Participant participant;

    public ParticipantJoinedEvent(String sessionId, Participant participant) {
        super(sessionId);
        this.participant = participant;
    }

    @Override
    public ChatEventType getType() {
        return ChatEventType.PARTICIPANT_JOINED;
    }
}
