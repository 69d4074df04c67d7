package com.example.chatorchestrator.presence;

import com.example.chatorchestrator.config.ChatProperties;
import com.example.chatorchestrator.event.ChatEvent;
import com.example.chatorchestrator.event.ChatEventBus;
import com.example.chatorchestrator.event.PresenceChangedEvent;
import com.example.chatorchestrator.event.TypingStatusChangedEvent;
import com.example.chatorchestrator.model.DeliveryMode;
import com.example.chatorchestrator.model.PresenceRecord;
import com.example.chatorchestrator.model.SessionMode;
import com.example.chatorchestrator.model.TypingRecord;
import com.example.chatorchestrator.session.SessionSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class PresenceTrackerTest {

    private ChatProperties properties;
    private PresenceTracker tracker;
    private final List<ChatEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new ChatProperties();
        properties.setPresenceTimeout(Duration.ofMillis(400));
        properties.setTypingTimeout(Duration.ofMillis(300));
        ChatEventBus eventBus = new ChatEventBus();
        eventBus.allEvents().subscribe(events::add);
        tracker = new PresenceTracker(eventBus, new SessionSerializer(), properties);
    }

    @AfterEach
    void tearDown() {
        tracker.shutdown();
    }

    @Test
    void testTouch_EmitsOnlyOnTransition() {
        // When
        tracker.touch("s1", "u1");
        tracker.touch("s1", "u1");

        // Then
        assertTrue(tracker.isOnline("s1", "u1"));
        List<PresenceChangedEvent> presence = eventsOf(PresenceChangedEvent.class);
        assertEquals(1, presence.size());
        assertTrue(presence.get(0).isOnline());
    }

    @Test
    void testPresenceExpires() {
        // Given
        tracker.touch("s1", "u1");

        // When
        await().atMost(Duration.ofSeconds(3)).until(() -> eventsOf(PresenceChangedEvent.class).size() == 2);

        // Then
        List<PresenceChangedEvent> presence = eventsOf(PresenceChangedEvent.class);
        assertEquals(2, presence.size());
        assertFalse(presence.get(1).isOnline());
        PresenceRecord record = tracker.getPresence("s1", "u1").orElseThrow();
        assertFalse(record.isOnline());
        assertNotNull(record.getLastActivity());
    }

    @Test
    void testTouch_RearmsExpiry() throws InterruptedException {
        // Given
        tracker.touch("s1", "u1");
        Thread.sleep(250);

        // When
        tracker.touch("s1", "u1");
        Thread.sleep(250);

        // Then
        assertTrue(tracker.isOnline("s1", "u1"));
        assertEquals(1, eventsOf(PresenceChangedEvent.class).size());
    }

    @Test
    void testTyping_RefreshDoesNotEmit() {
        // When
        tracker.setTyping("s1", "u1", true);
        tracker.setTyping("s1", "u1", true);
        tracker.setTyping("s1", "u1", false);
        tracker.setTyping("s1", "u1", false);

        // Then
        List<Boolean> typing = eventsOf(TypingStatusChangedEvent.class).stream()
                .map(TypingStatusChangedEvent::isTyping)
                .collect(Collectors.toList());
        assertEquals(List.of(true, false), typing);
        assertFalse(tracker.isTyping("s1", "u1"));
    }

    @Test
    void testTypingExpires() {
        // Given
        tracker.setTyping("s1", "u1", true);
        assertEquals(1, tracker.listTyping("s1").size());

        // When
        await().atMost(Duration.ofSeconds(3)).until(() -> eventsOf(TypingStatusChangedEvent.class).size() == 2);

        // Then
        assertTrue(tracker.listTyping("s1").isEmpty());
        List<TypingStatusChangedEvent> typing = eventsOf(TypingStatusChangedEvent.class);
        assertEquals(2, typing.size());
        assertFalse(typing.get(1).isTyping());
    }

    @Test
    void testPresenceExpiry_ClearsTypingAfterPresence() {
        // Given
        properties.setTypingTimeout(Duration.ofSeconds(30));
        tracker.touch("s1", "u1");
        tracker.setTyping("s1", "u1", true);

        // When
        await().atMost(Duration.ofSeconds(3)).until(() -> eventsOf(TypingStatusChangedEvent.class).size() == 2);

        // Then
        assertFalse(tracker.isOnline("s1", "u1"));
        assertFalse(tracker.isTyping("s1", "u1"));
        List<ChatEvent> tail = events.subList(events.size() - 2, events.size());
        assertInstanceOf(PresenceChangedEvent.class, tail.get(0));
        assertInstanceOf(TypingStatusChangedEvent.class, tail.get(1));
        assertFalse(((TypingStatusChangedEvent) tail.get(1)).isTyping());
    }

    @Test
    void testListTyping_OnlyActiveUsersOfSession() {
        // Given
        tracker.setTyping("s1", "u1", true);
        tracker.setTyping("s1", "u2", true);
        tracker.setTyping("s2", "u3", true);
        tracker.setTyping("s1", "u2", false);

        // When
        List<TypingRecord> typing = tracker.listTyping("s1");

        // Then
        assertEquals(1, typing.size());
        assertEquals("u1", typing.get(0).getUserId());
        assertNotNull(typing.get(0).getExpiresAt());
    }

    @Test
    void testClear_EmitsNothing() {
        // Given
        tracker.touch("s1", "u1");
        tracker.setTyping("s1", "u1", true);
        events.clear();

        // When
        tracker.clear("s1", "u1");

        // Then
        assertFalse(tracker.isOnline("s1", "u1"));
        assertFalse(tracker.isTyping("s1", "u1"));
        assertTrue(tracker.getPresence("s1", "u1").isEmpty());
        assertTrue(events.isEmpty());
    }

    @Test
    void testPresenceRecord_CarriesSessionMode() {
        // Given
        tracker.onSessionModeChanged("s1", SessionMode.SHARED, DeliveryMode.shared());

        // When
        tracker.touch("s1", "u1");

        // Then
        assertEquals(SessionMode.SHARED, tracker.getPresence("s1", "u1").orElseThrow().getSessionMode());
        assertTrue(tracker.hasOnlineUsers("s1"));
        assertFalse(tracker.hasOnlineUsers("s2"));
    }

    private <E extends ChatEvent> List<E> eventsOf(Class<E> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }
}
