package com.example.chatorchestrator.service;

import com.example.chatorchestrator.ChatTestFixture;
import com.example.chatorchestrator.context.CallerContext;
import com.example.chatorchestrator.event.ThreadActivityEvent;
import com.example.chatorchestrator.exception.NotFoundException;
import com.example.chatorchestrator.model.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ChatOrchestratorThreadTest {

    private final ChatTestFixture fixture = new ChatTestFixture();
    private ChatMessage parent;

    @BeforeEach
    void setUp() {
        CallerContext.runAs("host", () -> fixture.orchestrator.createOrGetSession("s1", "Support", null, List.of("a")));
        parent = CallerContext.runAs("host", () -> fixture.orchestrator.sendMessage("s1", "release plan", null, null));
        fixture.clearEvents();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
        CallerContext.clear();
    }

    @Test
    void testCreateThread_PersistsAndRecordsActivity() {
        // When
        ChatThread thread = CallerContext.runAs("a", () -> fixture.orchestrator.createThread(
                "s1", parent.getId(), "Rollout order", "Which region first", List.of("deploy")));

        // Then
        assertEquals(ThreadStatus.ACTIVE, thread.getStatus());
        assertEquals(List.of("a"), thread.getParticipants());
        assertEquals(0, thread.getMessageCount());
        Map<String, Object> stored = fixture.store.get("threads", thread.getId()).orElseThrow();
        assertEquals("Rollout order", stored.get("title"));
        assertEquals(parent.getId(), stored.get("parentMessageId"));
        assertEquals("active", stored.get("status"));

        List<ThreadActivity> activities = fixture.orchestrator.getThreadActivities("s1", 10);
        assertEquals(1, activities.size());
        assertEquals(ThreadActivityType.CREATED, activities.get(0).getType());
        assertEquals("a", activities.get(0).getUserId());
        assertEquals(1, fixture.events(ThreadActivityEvent.class).size());
    }

    @Test
    void testCreateThread_Validation() {
        // Given
        CallerContext.runAs("host", () -> fixture.orchestrator.createOrGetSession("s2", "Other", null, List.of()));
        ChatMessage elsewhere = CallerContext.runAs("host", () -> fixture.orchestrator.sendMessage("s2", "hi", null, null));

        // When / Then
        assertThrows(NotFoundException.class, () -> CallerContext.runAs("host",
                () -> fixture.orchestrator.createThread("s1", elsewhere.getId(), "Wrong session", null, null)));
        assertThrows(NotFoundException.class, () -> CallerContext.runAs("stranger",
                () -> fixture.orchestrator.createThread("s1", parent.getId(), "Not a member", null, null)));
        assertThrows(IllegalArgumentException.class, () -> CallerContext.runAs("host",
                () -> fixture.orchestrator.createThread("s1", parent.getId(), " ", null, null)));
        assertEquals(0, fixture.store.count("threads"));
    }

    @Test
    void testReplyToThread_CountsRepliesAndJoinsSender() throws InterruptedException {
        // Given
        ChatThread thread = CallerContext.runAs("host", () -> fixture.orchestrator.createThread(
                "s1", parent.getId(), "Rollout order", null, null));

        // When
        CallerContext.runAs("a", () -> fixture.orchestrator.replyToThread(thread.getId(), "EU first", null));
        Thread.sleep(5);
        ThreadMessage second = CallerContext.runAs("host",
                () -> fixture.orchestrator.replyToThread(thread.getId(), "Agreed", List.of("plan.pdf")));

        // Then
        ChatThread updated = fixture.orchestrator.getThread(thread.getId()).orElseThrow();
        assertEquals(2, updated.getMessageCount());
        assertEquals(List.of("host", "a"), updated.getParticipants());
        assertEquals(second.getTimestamp(), updated.getLastActivityAt());
        assertEquals(2, fixture.store.get("threads", thread.getId()).orElseThrow().get("messageCount"));

        List<ThreadMessage> replies = fixture.orchestrator.getThreadMessages(thread.getId(), 0);
        assertEquals(List.of("EU first", "Agreed"), replies.stream().map(ThreadMessage::getContent).collect(Collectors.toList()));
        assertEquals(List.of("plan.pdf"), replies.get(1).getAttachments());

        long repliedActivities = fixture.orchestrator.getThreadActivities("s1", 10).stream()
                .filter(activity -> activity.getType() == ThreadActivityType.REPLIED)
                .count();
        assertEquals(2, repliedActivities);
    }

    @Test
    void testArchivedThread_RejectsReplies() {
        // Given
        ChatThread thread = CallerContext.runAs("host", () -> fixture.orchestrator.createThread(
                "s1", parent.getId(), "Rollout order", null, null));

        // When
        ChatThread archived = CallerContext.runAs("host",
                () -> fixture.orchestrator.updateThreadStatus(thread.getId(), ThreadStatus.ARCHIVED));
        ChatThread again = CallerContext.runAs("host",
                () -> fixture.orchestrator.updateThreadStatus(thread.getId(), ThreadStatus.ARCHIVED));

        // Then
        assertEquals(ThreadStatus.ARCHIVED, archived.getStatus());
        assertEquals(ThreadStatus.ARCHIVED, again.getStatus());
        assertEquals("archived", fixture.store.get("threads", thread.getId()).orElseThrow().get("status"));
        assertEquals(2, fixture.events(ThreadActivityEvent.class).size());
        assertThrows(IllegalArgumentException.class, () -> CallerContext.runAs("a",
                () -> fixture.orchestrator.replyToThread(thread.getId(), "too late", null)));
        assertTrue(fixture.orchestrator.getThreadMessages(thread.getId(), 0).isEmpty());
    }

    @Test
    void testThreadLookups_UnknownThread() {
        assertTrue(fixture.orchestrator.getThread("missing").isEmpty());
        assertThrows(NotFoundException.class, () -> fixture.orchestrator.getThreadMessages("missing", 0));
        assertThrows(NotFoundException.class, () -> CallerContext.runAs("host",
                () -> fixture.orchestrator.replyToThread("missing", "hi", null)));
    }

    @Test
    void testGetSessionThreads_MostRecentlyActiveFirst() throws InterruptedException {
        // Given
        ChatThread older = CallerContext.runAs("host", () -> fixture.orchestrator.createThread(
                "s1", parent.getId(), "Rollout order", null, null));
        Thread.sleep(5);
        ChatThread newer = CallerContext.runAs("host", () -> fixture.orchestrator.createThread(
                "s1", parent.getId(), "Release notes", null, List.of("docs")));
        Thread.sleep(5);

        // When
        CallerContext.runAs("a", () -> fixture.orchestrator.replyToThread(older.getId(), "bump", null));
        List<ChatThread> threads = fixture.orchestrator.getSessionThreads("s1");

        // Then
        assertEquals(List.of(older.getId(), newer.getId()),
                threads.stream().map(ChatThread::getId).collect(Collectors.toList()));
    }

    @Test
    void testSearchThreads_ByTagAndStatus() {
        // Given
        ChatThread notes = CallerContext.runAs("host", () -> fixture.orchestrator.createThread(
                "s1", parent.getId(), "Release notes", null, List.of("docs")));
        ChatThread order = CallerContext.runAs("host", () -> fixture.orchestrator.createThread(
                "s1", parent.getId(), "Rollout order", "docs for ops", null));
        CallerContext.runAs("host", () -> fixture.orchestrator.updateThreadStatus(order.getId(), ThreadStatus.RESOLVED));

        // When
        List<ChatThread> found = fixture.orchestrator.searchThreads("s1", ThreadSearchCriteria.builder()
                .query("DOCS")
                .statuses(EnumSet.of(ThreadStatus.ACTIVE))
                .build());

        // Then
        assertEquals(List.of(notes.getId()), found.stream().map(ChatThread::getId).collect(Collectors.toList()));
    }
}
