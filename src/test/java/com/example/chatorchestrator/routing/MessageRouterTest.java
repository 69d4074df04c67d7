package com.example.chatorchestrator.routing;

import com.example.chatorchestrator.ChatTestFixture;
import com.example.chatorchestrator.context.CallerContext;
import com.example.chatorchestrator.event.MessageDeliveredEvent;
import com.example.chatorchestrator.event.MessageReadEvent;
import com.example.chatorchestrator.exception.NotFoundException;
import com.example.chatorchestrator.model.*;
import com.example.chatorchestrator.store.InMemoryStoreClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MessageRouterTest {

    private ChatTestFixture fixture = new ChatTestFixture();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void testRoute_OfflineRecipientIsReportedAndQueued() {
        // Given
        ChatSession session = createSession("s1", "host", null, List.of("a", "b", "c", "d"));
        fixture.presenceTracker.touch("s1", "a");
        fixture.presenceTracker.touch("s1", "b");
        fixture.presenceTracker.touch("s1", "c");
        ChatMessage message = message("s1", "host", null);

        // When
        DeliveryResult result = fixture.router.route(message, session);

        // Then
        assertEquals(DeliveryResult.Status.PARTIAL_FAILURE, result.getStatus());
        assertEquals(List.of("a", "b", "c"), result.getDeliveredTo());
        assertEquals(1, result.getFailedDeliveries().size());
        assertEquals("d", result.getFailedDeliveries().get(0).getUserId());
        assertEquals(MessageRouter.OFFLINE, result.getFailedDeliveries().get(0).getError());
        assertFalse(message.isDelivered());
        assertEquals("PARTIAL_FAILURE", message.getMetadata().get("deliveryStatus"));
        assertEquals(List.of("d"), message.getMetadata().get("failedRecipients"));
        assertEquals(List.of(message.getId()), fixture.router.pendingFor("s1", "d"));
        assertEquals(1, fixture.events(MessageDeliveredEvent.class).size());
    }

    @Test
    void testFlushPending_DeliversWhenRecipientComesOnline() {
        // Given
        ChatSession session = createSession("s1", "host", null, List.of("a", "d"));
        fixture.presenceTracker.touch("s1", "a");
        ChatMessage message = message("s1", "host", null);
        fixture.router.route(message, session);
        assertFalse(message.isDelivered());

        // When
        fixture.presenceTracker.touch("s1", "d");

        // Then
        assertTrue(message.isDelivered());
        assertTrue(message.getDeliveredTo().containsAll(List.of("a", "d")));
        assertTrue(message.getFailedRecipients().isEmpty());
        assertTrue(fixture.router.pendingFor("s1", "d").isEmpty());
        assertEquals(2, fixture.events(MessageDeliveredEvent.class).size());
    }

    @Test
    void testRoute_NonParticipantUserTargetIsNotQueued() {
        // Given
        ChatSession session = createSession("s1", "host", null, List.of("a"));
        ChatMessage message = message("s1", "host", MessageTarget.builder().type(TargetType.USER).id("ghost").build());

        // When
        DeliveryResult result = fixture.router.route(message, session);

        // Then
        assertEquals(DeliveryResult.Status.FAILED, result.getStatus());
        assertEquals(MessageRouter.NOT_A_PARTICIPANT, result.getFailedDeliveries().get(0).getError());
        assertEquals(MessageRouter.NOT_A_PARTICIPANT, message.getFailedRecipients().get("ghost"));
        assertTrue(fixture.router.pendingFor("s1", "ghost").isEmpty());
    }

    @Test
    void testIndex_KeepsRecentAndQueuedMessagesOnly() {
        // Given
        fixture.properties.setMessageIndexSize(2);
        ChatSession session = createSession("s1", "host", null, List.of("a", "d"));
        fixture.presenceTracker.touch("s1", "a");
        ChatMessage queued = message("s1", "host", MessageTarget.builder().type(TargetType.USER).id("d").build());
        fixture.router.route(queued, session);

        // When
        MessageTarget toA = MessageTarget.builder().type(TargetType.USER).id("a").build();
        List<ChatMessage> later = List.of(message("s1", "host", toA), message("s1", "host", toA),
                message("s1", "host", toA));
        later.forEach(m -> fixture.router.route(m, session));

        // Then
        assertEquals(2, fixture.router.indexedCount());
        assertTrue(fixture.router.find(later.get(0).getId()).isEmpty());
        assertTrue(fixture.router.find(later.get(2).getId()).isPresent());
        assertSame(queued, fixture.router.find(queued.getId()).orElseThrow());

        // When
        fixture.presenceTracker.touch("s1", "d");

        // Then
        assertTrue(queued.isDelivered());
        assertTrue(fixture.router.pendingFor("s1", "d").isEmpty());
        assertTrue(fixture.router.find(queued.getId()).isEmpty());
    }

    @Test
    void testRoute_DirectSessionWritesInbox() {
        // Given
        ChatSession session = createSession("s1", "host", "bot", List.of());
        assertEquals(SessionMode.DIRECT, session.getMode());
        ChatMessage message = message("s1", "host", null);

        // When
        DeliveryResult result = fixture.router.route(message, session);

        // Then
        assertEquals(DeliveryResult.Status.DELIVERED, result.getStatus());
        assertEquals(List.of("bot"), result.getDeliveredTo());
        assertTrue(message.isDelivered());
        assertEquals(1, fixture.store.find("inbox", Map.of("userId", "bot"), null, null).size());
    }

    @Test
    void testRoute_AgentTargetIsAlwaysReachable() {
        // Given
        ChatSession session = createSession("s1", "host", null, List.of("a"));
        ChatMessage message = message("s1", "host",
                MessageTarget.builder().type(TargetType.AGENT).id("helper-bot").build());

        // When
        DeliveryResult result = fixture.router.route(message, session);

        // Then
        assertEquals(List.of("helper-bot"), result.getDeliveredTo());
        assertTrue(result.isDelivered());
    }

    @Test
    void testResolveRecipients_RoleTargetExcludesSender() {
        // Given
        createSession("s1", "host", null, List.of("a", "b"));
        fixture.orchestrator.addParticipant("s1", "w1", ParticipantRole.OBSERVER);
        fixture.orchestrator.addParticipant("s1", "w2", ParticipantRole.OBSERVER);

        // When
        List<String> observers = fixture.router.resolveRecipients(
                message("s1", "w1", MessageTarget.builder().type(TargetType.ROLE).id("observer").build()), "s1");
        List<String> everyone = fixture.router.resolveRecipients(message("s1", "a", null), "s1");

        // Then
        assertEquals(List.of("w2"), observers);
        assertEquals(List.of("host", "b", "w1", "w2"), everyone);
    }

    @Test
    void testResolveRecipients_UserTargetRequiresId() {
        // Given
        createSession("s1", "host", null, List.of("a"));
        ChatMessage message = message("s1", "host", MessageTarget.builder().type(TargetType.USER).build());

        // When / Then
        assertThrows(IllegalArgumentException.class, () -> fixture.router.resolveRecipients(message, "s1"));
    }

    @Test
    void testMarkAsRead_OnlyFirstReadEmits() {
        // Given
        ChatSession session = createSession("s1", "host", null, List.of("a"));
        fixture.presenceTracker.touch("s1", "a");
        ChatMessage message = message("s1", "host", null);
        fixture.router.route(message, session);

        // When
        boolean first = fixture.router.markAsRead(message.getId(), "a");
        boolean second = fixture.router.markAsRead(message.getId(), "a");

        // Then
        assertTrue(first);
        assertFalse(second);
        assertTrue(message.isRead());
        assertEquals(List.of("a"), message.getReadBy());
        assertEquals(1, fixture.events(MessageReadEvent.class).size());
        assertThrows(NotFoundException.class, () -> fixture.router.markAsRead("missing", "a"));
    }

    @Test
    void testRoute_HybridRequiresLinkedCopy() {
        // Given
        fixture.close();
        fixture = new ChatTestFixture(new InMemoryStoreClient() {
            @Override
            public void put(String collection, String key, Map<String, Object> doc) {
                if ("messages".equals(collection) && key.startsWith("direct-1_")) {
                    throw new IllegalStateException("linked session unavailable");
                }
                super.put(collection, key, doc);
            }
        });
        ChatSession session = CallerContext.runAs("host", () -> fixture.orchestrator.createOrGetSession(
                "s1", "Hybrid", null, List.of("a"), SessionMetadata.builder().linkedSessionId("direct-1").build()));
        assertEquals(DeliveryMode.hybridLinkedTo("direct-1"), fixture.router.deliveryMode("s1").orElseThrow());
        fixture.presenceTracker.touch("s1", "a");
        ChatMessage message = message("s1", "host", null);

        // When
        DeliveryResult result = fixture.router.route(message, session);

        // Then
        assertEquals(DeliveryResult.Status.FAILED, result.getStatus());
        assertTrue(result.getFailedDeliveries().get(0).getError().contains("Linked copy"));
        assertFalse(message.isDelivered());
        assertTrue(fixture.router.pendingFor("s1", "a").isEmpty());
    }

    @Test
    void testRoute_ModeSwitchChangesChannel() {
        // Given
        ChatSession direct = createSession("s1", "host", "bot", List.of());
        fixture.router.route(message("s1", "host", null), direct);
        assertEquals(DeliveryMode.direct(), fixture.router.deliveryMode("s1").orElseThrow());

        // When
        fixture.orchestrator.addParticipant("s1", "a", ParticipantRole.PARTICIPANT);

        // Then
        assertEquals(DeliveryMode.shared(), fixture.router.deliveryMode("s1").orElseThrow());
    }

    private ChatSession createSession(String sessionId, String host, String agent, List<String> participants) {
        return CallerContext.runAs(host,
                () -> fixture.orchestrator.createOrGetSession(sessionId, "Test", agent, participants));
    }

    private static ChatMessage message(String sessionId, String senderId, MessageTarget target) {
        return ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .senderId(senderId)
                .content("hello")
                .target(target)
                .timestamp(Instant.now())
                .build();
    }
}
