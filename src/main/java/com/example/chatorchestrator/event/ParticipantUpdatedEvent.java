package com.example.chatorchestrator.event;

import com.example.chatorchestrator.model.Participant;
import com.example.chatorchestrator.model.ParticipantRole;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class ParticipantUpdatedEvent extends ChatEvent {

    private final Participant participant;
    private final ParticipantRole previousRole;

    public ParticipantUpdatedEvent(String sessionId, Participant participant, ParticipantRole previousRole) {
        super(sessionId);
        this.participant = participant;
        this.previousRole = previousRole;
    }

    @Override
    public ChatEventType getType() {
        return ChatEventType.PARTICIPANT_UPDATED;
    }
}
