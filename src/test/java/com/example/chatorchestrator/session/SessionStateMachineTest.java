package com.example.chatorchestrator.session;

import com.example.chatorchestrator.event.ChatEventBus;
import com.example.chatorchestrator.event.SessionModeChangedEvent;
import com.example.chatorchestrator.model.*;
import com.example.chatorchestrator.participant.ParticipantRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionStateMachineTest {

    @Mock
    private ParticipantRegistry registry;

    @Mock
    private SessionModeListener listener;

    private SessionStateMachine stateMachine;
    private final List<SessionModeChangedEvent> modeEvents = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ChatEventBus eventBus = new ChatEventBus();
        eventBus.subscribe(SessionModeChangedEvent.class, modeEvents::add);
        stateMachine = new SessionStateMachine(registry, eventBus, List.of(listener));
    }

    @Test
    void testDeriveMode_AgentsDoNotCount() {
        assertEquals(SessionMode.DIRECT, SessionStateMachine.deriveMode(List.of()));
        assertEquals(SessionMode.DIRECT, SessionStateMachine.deriveMode(List.of(
                participant("host", ParticipantRole.HOST),
                participant("bot", ParticipantRole.AGENT),
                participant("bot2", ParticipantRole.AGENT))));
        assertEquals(SessionMode.SHARED, SessionStateMachine.deriveMode(List.of(
                participant("host", ParticipantRole.HOST),
                participant("watcher", ParticipantRole.OBSERVER))));
    }

    @Test
    void testCreate_BroadcastsInitialMode() {
        // When
        ChatSession session = stateMachine.create("s1", "Support", "host", "bot", null, false);

        // Then
        assertEquals(SessionMode.DIRECT, session.getMode());
        assertTrue(stateMachine.isResident("s1"));
        verify(listener, times(1)).onSessionModeChanged("s1", SessionMode.DIRECT, DeliveryMode.direct());
        assertTrue(modeEvents.isEmpty());
    }

    @Test
    void testCreate_DuplicateIsRejected() {
        // Given
        stateMachine.create("s1", "Support", "host", null, null, false);

        // When / Then
        assertThrows(IllegalStateException.class,
                () -> stateMachine.create("s1", "Again", "host", null, null, false));
    }

    @Test
    void testRecompute_SwitchesAndNotifies() {
        // Given
        stateMachine.create("s1", "Support", "host", null,
                SessionMetadata.builder().linkedSessionId("direct-1").build(), false);
        when(registry.list("s1")).thenReturn(List.of(
                participant("host", ParticipantRole.HOST),
                participant("u2", ParticipantRole.PARTICIPANT)));

        // When
        Optional<SessionMode> changed = stateMachine.recompute("s1");

        // Then
        assertEquals(Optional.of(SessionMode.SHARED), changed);
        assertEquals(SessionMode.SHARED, stateMachine.find("s1").orElseThrow().getMode());
        assertEquals(1, modeEvents.size());
        assertEquals(SessionMode.DIRECT, modeEvents.get(0).getOldMode());
        assertEquals(SessionMode.SHARED, modeEvents.get(0).getNewMode());
        verify(listener).onSessionModeChanged("s1", SessionMode.SHARED, DeliveryMode.hybridLinkedTo("direct-1"));
    }

    @Test
    void testRecompute_NoChangeIsSilent() {
        // Given
        stateMachine.create("s1", "Support", "host", null, null, false);
        when(registry.list("s1")).thenReturn(List.of(participant("host", ParticipantRole.HOST)));
        clearInvocations(listener);

        // When
        Optional<SessionMode> changed = stateMachine.recompute("s1");

        // Then
        assertTrue(changed.isEmpty());
        assertTrue(modeEvents.isEmpty());
        verify(listener, never()).onSessionModeChanged(anyString(), any(), any());
    }

    @Test
    void testRecompute_UnknownSession() {
        assertTrue(stateMachine.recompute("missing").isEmpty());
        verifyNoInteractions(registry);
    }

    @Test
    void testFind_ReturnsCopy() {
        // Given
        stateMachine.create("s1", "Support", "host", null, null, false);

        // When
        ChatSession copy = stateMachine.find("s1").orElseThrow();
        copy.setMode(SessionMode.SHARED);

        // Then
        assertEquals(SessionMode.DIRECT, stateMachine.find("s1").orElseThrow().getMode());
    }

    @Test
    void testRecordMessage_MovesPointersAndActivity() {
        // Given
        stateMachine.create("s1", "Support", "host", null, null, false);
        Instant later = Instant.now().plusSeconds(5);

        // When
        stateMachine.recordMessage("s1", "m1", later);

        // Then
        ChatSession session = stateMachine.find("s1").orElseThrow();
        assertEquals("m1", session.getLastMessageId());
        assertEquals(later, session.getLastMessageTimestamp());
        assertEquals(later, session.getLastActivity());
    }

    @Test
    void testIdleSinceAndEvict() {
        // Given
        stateMachine.create("s1", "Support", "host", null, null, false);
        stateMachine.create("s2", "Sales", "host", null, null, false);
        stateMachine.touchActivity("s2", Instant.now().plusSeconds(60));

        // When
        List<String> idle = stateMachine.idleSince(Instant.now().plusSeconds(1));
        stateMachine.evict("s1");

        // Then
        assertEquals(List.of("s1"), idle);
        assertFalse(stateMachine.isResident("s1"));
        assertEquals(1, stateMachine.residentCount());
    }

    @Test
    void testRestore_KeepsStoredModeAndLink() {
        // Given
        ChatSession stored = ChatSession.builder()
                .id("s1")
                .mode(SessionMode.SHARED)
                .hostUserId("host")
                .metadata(SessionMetadata.builder().linkedSessionId("direct-1").build())
                .build();

        // When
        ChatSession restored = stateMachine.restore(stored);

        // Then
        assertEquals(SessionMode.SHARED, restored.getMode());
        assertEquals("direct-1", restored.getLinkedSessionId());
        verify(listener).onSessionModeChanged("s1", SessionMode.SHARED, DeliveryMode.hybridLinkedTo("direct-1"));
    }

    private static Participant participant(String userId, ParticipantRole role) {
        return Participant.builder().userId(userId).role(role).build();
    }
}
