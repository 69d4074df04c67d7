package com.example.chatorchestrator.event;

import com.example.chatorchestrator.model.ThreadActivity;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class ThreadActivityEvent extends ChatEvent {

    private final ThreadActivity activity;

    public ThreadActivityEvent(String sessionId, ThreadActivity activity) {
        super(sessionId);
        this.activity = activity;
    }

    @Override
    public ChatEventType getType() {
        return ChatEventType.THREAD_ACTIVITY;
    }
}
