package com.example.chatorchestrator.event;

import com.example.chatorchestrator.model.SessionMode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class SessionModeChangedEvent extends ChatEvent {

    private final SessionMode oldMode;
    private final SessionMode newMode;

    public SessionModeChangedEvent(String sessionId, SessionMode oldMode, SessionMode newMode) {
        super(sessionId);
        this.oldMode = oldMode;
        this.newMode = newMode;
    }

    @Override
    public ChatEventType getType() {
        return ChatEventType.SESSION_MODE_CHANGED;
    }
}
