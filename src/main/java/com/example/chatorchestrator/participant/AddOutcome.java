package com.example.chatorchestrator.participant;

import com.example.chatorchestrator.model.Participant;
import lombok.Value;

/**
 * What {@link ParticipantRegistry#add} did with the candidate.
 */
@Value
public class AddOutcome {

    public enum Kind { JOINED, UPDATED, UNCHANGED }

    Kind kind;
    Participant participant;

    public boolean isChanged() {
        return kind != Kind.UNCHANGED;
    }
}
