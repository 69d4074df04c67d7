package com.example.chatorchestrator.mcp;

import com.example.chatorchestrator.context.CallerContext;
import com.example.chatorchestrator.model.*;
import com.example.chatorchestrator.service.ChatOrchestrator;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;

/**
 * Caller API of the orchestrator as tools. Operations acting on behalf of a user take
 * the acting user id explicitly.
 */
@Service
public class ChatSessionTools {

    private final ChatOrchestrator orchestrator;

    public ChatSessionTools(ChatOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Tool(description = "Create a chat session hosted by the acting user, or return it if it already exists")
    public Map<String, Object> chat_createOrGetSession(
            String actingUserId,
            @ToolParam(required = false, description = "Session id, generated when absent") String sessionId,
            @ToolParam(required = false) String name,
            @ToolParam(required = false, description = "Agent linked to the session") String agentId,
            @ToolParam(required = false) List<String> initialParticipants,
            @ToolParam(required = false, description = "Direct session mirrored by hybrid delivery") String linkedSessionId) {
        SessionMetadata metadata = linkedSessionId == null ? null
                : SessionMetadata.builder().linkedSessionId(linkedSessionId).build();
        ChatSession session = as(actingUserId,
                () -> orchestrator.createOrGetSession(sessionId, name, agentId, initialParticipants, metadata));
        return Map.of("session", session);
    }

    @Tool(description = "Add a participant to a session, or update its role if already present")
    public Map<String, Object> chat_addParticipant(String sessionId, String userId,
            @ToolParam(required = false, description = "host, participant, agent or observer") String role) {
        orchestrator.addParticipant(sessionId, userId, role == null ? null : ParticipantRole.fromValue(role));
        return Map.of("ok", true, "participants", participantsOf(sessionId));
    }

    @Tool(description = "Remove a participant from a session")
    public Map<String, Object> chat_removeParticipant(String sessionId, String userId) {
        orchestrator.removeParticipant(sessionId, userId);
        return Map.of("ok", true, "participants", participantsOf(sessionId));
    }

    @Tool(description = "Send a message as the acting user. Target type all, user, agent or role")
    public Map<String, Object> chat_sendMessage(String actingUserId, String sessionId, String content,
            @ToolParam(required = false) String targetType,
            @ToolParam(required = false, description = "User id, agent id or role name") String targetId,
            @ToolParam(required = false) List<String> attachments) {
        MessageTarget target = targetType == null ? null
                : MessageTarget.builder().type(TargetType.fromValue(targetType)).id(targetId).build();
        ChatMessage message = as(actingUserId, () -> orchestrator.sendMessage(sessionId, content, target, attachments));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("messageId", message.getId());
        result.put("delivered", message.isDelivered());
        result.put("recipients", message.getRecipients());
        result.put("deliveredTo", message.getDeliveredTo());
        result.put("failedRecipients", message.getFailedRecipients());
        return result;
    }

    @Tool(description = "Set or clear the acting user's typing indicator")
    public Map<String, Object> chat_setTyping(String actingUserId, String sessionId, Boolean isTyping) {
        CallerContext.doAs(actingUserId, () -> orchestrator.setTyping(sessionId, Boolean.TRUE.equals(isTyping)));
        return Map.of("ok", true);
    }

    @Tool(description = "Keep the acting user online in a session")
    public Map<String, Object> chat_heartbeat(String actingUserId, String sessionId) {
        CallerContext.doAs(actingUserId, () -> orchestrator.heartbeat(sessionId));
        return Map.of("ok", true);
    }

    @Tool(description = "Mark a message as read by the acting user")
    public Map<String, Object> chat_markAsRead(String actingUserId, String messageId) {
        boolean added = as(actingUserId, () -> orchestrator.markAsRead(messageId));
        return Map.of("ok", true, "newlyRead", added);
    }

    @Tool(description = "Get a session with its participants")
    public Map<String, Object> chat_getSession(String sessionId) {
        return orchestrator.getSession(sessionId)
                .<Map<String, Object>>map(s -> Map.of("found", true, "session", s))
                .orElseGet(() -> Map.of("found", false));
    }

    @Tool(description = "List the sessions a user belongs to, most recently active first")
    public Map<String, Object> chat_getUserSessions(String userId) {
        return Map.of("sessions", orchestrator.getUserSessions(userId));
    }

    @Tool(description = "Get the latest messages of a session, oldest first")
    public Map<String, Object> chat_getMessages(String sessionId, @ToolParam(required = false) Integer limit) {
        return Map.of("messages", orchestrator.getMessages(sessionId, limit == null ? 0 : limit));
    }

    @Tool(description = "List users currently typing in a session")
    public Map<String, Object> chat_listTyping(String sessionId) {
        return Map.of("typing", orchestrator.listTyping(sessionId));
    }

    @Tool(description = "Grant a permission (read, write, invite, moderate) to a participant")
    public Map<String, Object> chat_grantPermission(String sessionId, String userId, String permission) {
        return Map.of("changed", orchestrator.grantPermission(sessionId, userId, Permission.fromValue(permission)));
    }

    @Tool(description = "Revoke a permission (read, write, invite, moderate) from a participant")
    public Map<String, Object> chat_revokePermission(String sessionId, String userId, String permission) {
        return Map.of("changed", orchestrator.revokePermission(sessionId, userId, Permission.fromValue(permission)));
    }

    @Tool(description = "Open a thread on a message of the session as the acting user")
    public Map<String, Object> chat_createThread(String actingUserId, String sessionId, String parentMessageId,
            String title,
            @ToolParam(required = false) String description,
            @ToolParam(required = false) List<String> tags) {
        ChatThread thread = as(actingUserId,
                () -> orchestrator.createThread(sessionId, parentMessageId, title, description, tags));
        return Map.of("thread", thread);
    }

    @Tool(description = "Reply in a thread as the acting user")
    public Map<String, Object> chat_replyToThread(String actingUserId, String threadId, String content,
            @ToolParam(required = false) List<String> attachments) {
        ThreadMessage reply = as(actingUserId, () -> orchestrator.replyToThread(threadId, content, attachments));
        return Map.of("message", reply);
    }

    @Tool(description = "Change the status of a thread: active, resolved or archived")
    public Map<String, Object> chat_updateThreadStatus(String actingUserId, String threadId, String status) {
        ChatThread thread = as(actingUserId,
                () -> orchestrator.updateThreadStatus(threadId, ThreadStatus.fromValue(status)));
        return Map.of("thread", thread);
    }

    @Tool(description = "Get a thread")
    public Map<String, Object> chat_getThread(String threadId) {
        return orchestrator.getThread(threadId)
                .<Map<String, Object>>map(t -> Map.of("found", true, "thread", t))
                .orElseGet(() -> Map.of("found", false));
    }

    @Tool(description = "List the threads of a session, most recently active first")
    public Map<String, Object> chat_getSessionThreads(String sessionId) {
        return Map.of("threads", orchestrator.getSessionThreads(sessionId));
    }

    @Tool(description = "Get the latest replies of a thread, oldest first")
    public Map<String, Object> chat_getThreadMessages(String threadId, @ToolParam(required = false) Integer limit) {
        return Map.of("messages", orchestrator.getThreadMessages(threadId, limit == null ? 0 : limit));
    }

    @Tool(description = "Search the threads of a session by text, status, participants and creation time")
    public Map<String, Object> chat_searchThreads(String sessionId,
            @ToolParam(required = false, description = "Matched against title, description and tags") String query,
            @ToolParam(required = false) List<String> statuses,
            @ToolParam(required = false) List<String> participants,
            @ToolParam(required = false, description = "ISO-8601 instant") String createdFrom,
            @ToolParam(required = false, description = "ISO-8601 instant") String createdTo,
            @ToolParam(required = false, description = "lastActivityAt, createdAt or messageCount") String sortBy,
            @ToolParam(required = false) Boolean ascending,
            @ToolParam(required = false) Integer limit) {
        Set<ThreadStatus> wanted = EnumSet.noneOf(ThreadStatus.class);
        if (statuses != null) {
            statuses.forEach(value -> wanted.add(ThreadStatus.fromValue(value)));
        }
        ThreadSearchCriteria criteria = ThreadSearchCriteria.builder()
                .query(query)
                .statuses(wanted)
                .participants(participants == null ? List.of() : participants)
                .createdFrom(createdFrom == null ? null : Instant.parse(createdFrom))
                .createdTo(createdTo == null ? null : Instant.parse(createdTo))
                .sortBy(sortBy == null ? ThreadSearchCriteria.SORT_LAST_ACTIVITY : sortBy)
                .ascending(Boolean.TRUE.equals(ascending))
                .limit(limit)
                .build();
        return Map.of("threads", orchestrator.searchThreads(sessionId, criteria));
    }

    @Tool(description = "Get the latest thread activity of a session, newest first")
    public Map<String, Object> chat_getThreadActivities(String sessionId, @ToolParam(required = false) Integer limit) {
        return Map.of("activities", orchestrator.getThreadActivities(sessionId, limit == null ? 0 : limit));
    }

    private List<Participant> participantsOf(String sessionId) {
        return orchestrator.getSession(sessionId).map(ChatSession::getParticipants).orElse(List.of());
    }

    private static <T> T as(String actingUserId, Supplier<T> action) {
        return CallerContext.runAs(actingUserId, action);
    }
}
