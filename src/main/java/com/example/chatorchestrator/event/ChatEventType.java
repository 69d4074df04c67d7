package com.example.chatorchestrator.event;

import java.util.Arrays;
import java.util.Optional;

public enum ChatEventType {
    PARTICIPANT_JOINED("participantJoined", ParticipantJoinedEvent.class),
    PARTICIPANT_LEFT("participantLeft", ParticipantLeftEvent.class),
    PARTICIPANT_UPDATED("participantUpdated", ParticipantUpdatedEvent.class),
    TYPING_STATUS_CHANGED("typingStatusChanged", TypingStatusChangedEvent.class),
    PRESENCE_CHANGED("presenceChanged", PresenceChangedEvent.class),
    SESSION_MODE_CHANGED("sessionModeChanged", SessionModeChangedEvent.class),
    MESSAGE_DELIVERED("messageDelivered", MessageDeliveredEvent.class),
    MESSAGE_READ("messageRead", MessageReadEvent.class),
    SESSION_CREATED("sessionCreated", SessionCreatedEvent.class),
    THREAD_ACTIVITY("threadActivity", ThreadActivityEvent.class),
    PERSISTENCE_FAILED("persistenceFailed", PersistenceFailedEvent.class);

    private final String eventName;
    private final Class<? extends ChatEvent> eventClass;

    ChatEventType(String eventName, Class<? extends ChatEvent> eventClass) {
        this.eventName = eventName;
        this.eventClass = eventClass;
    }

    public String getEventName() {
        return eventName;
    }

    public Class<? extends ChatEvent> getEventClass() {
        return eventClass;
    }

    public static Optional<ChatEventType> fromEventName(String eventName) {
        return Arrays.stream(values())
                .filter(t -> t.eventName.equals(eventName))
                .findFirst();
    }

    public static ChatEventType of(Class<? extends ChatEvent> eventClass) {
        return Arrays.stream(values())
                .filter(t -> t.eventClass.equals(eventClass))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Not a chat event class: " + eventClass.getName()));
    }
}
