package com.example.chatorchestrator.service;

import com.example.chatorchestrator.config.ChatProperties;
import com.example.chatorchestrator.context.CallerContext;
import com.example.chatorchestrator.event.*;
import com.example.chatorchestrator.exception.CapacityExceededException;
import com.example.chatorchestrator.exception.NotFoundException;
import com.example.chatorchestrator.exception.PersistenceException;
import com.example.chatorchestrator.model.*;
import com.example.chatorchestrator.participant.AddOutcome;
import com.example.chatorchestrator.participant.ParticipantRegistry;
import com.example.chatorchestrator.presence.PresenceTracker;
import com.example.chatorchestrator.routing.MessageRouter;
import com.example.chatorchestrator.session.SessionSerializer;
import com.example.chatorchestrator.session.SessionStateMachine;
import com.example.chatorchestrator.store.StoreSubscription;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Entry point for callers. Every mutating call runs under the session's serializer:
 * validate, delegate, update last activity, persist, emit.
 * <p>
 * In-memory state is authoritative. A failed write is logged and published as
 * {@code persistenceFailed}; it never rolls back the change that triggered it.
 */
@Service
public class ChatOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ChatOrchestrator.class);

    private static final String DEFAULT_SESSION_NAME = "Chat";

    private final SessionStateMachine stateMachine;
    private final ParticipantRegistry registry;
    private final PresenceTracker presenceTracker;
    private final MessageRouter router;
    private final SessionSynchronizer synchronizer;
    private final SessionSerializer serializer;
    private final ChatEventBus eventBus;
    private final ChatProperties properties;
    private final Map<String, ChatThread> threads = new ConcurrentHashMap<>();
    private final List<Disposable> subscriptions = new ArrayList<>();

    public ChatOrchestrator(SessionStateMachine stateMachine, ParticipantRegistry registry,
                            PresenceTracker presenceTracker, MessageRouter router,
                            SessionSynchronizer synchronizer, SessionSerializer serializer,
                            ChatEventBus eventBus, ChatProperties properties) {
        this.stateMachine = stateMachine;
        this.registry = registry;
        this.presenceTracker = presenceTracker;
        this.router = router;
        this.synchronizer = synchronizer;
        this.serializer = serializer;
        this.eventBus = eventBus;
        this.properties = properties;

        subscriptions.add(eventBus.subscribe(PresenceChangedEvent.class, e -> report(e.getSessionId(),
                synchronizer.upsertPresence(e.getSessionId(), e.getUserId(), e.isOnline(), e.getTimestamp()))));
        subscriptions.add(eventBus.subscribe(TypingStatusChangedEvent.class, e -> report(e.getSessionId(),
                synchronizer.upsertTyping(e.getSessionId(), e.getUserId(), e.isTyping()))));
        subscriptions.add(eventBus.subscribe(MessageDeliveredEvent.class, e -> router.find(e.getMessageId())
                .ifPresent(message -> report(e.getSessionId(), synchronizer.updateMessageLedger(message)))));
    }

    public ChatSession createOrGetSession(String sessionId, String name, String agentId, List<String> initialParticipants) {
        return createOrGetSession(sessionId, name, agentId, initialParticipants, null);
    }

    /**
     * Returns the resident session, re-hydrates it from the store, or creates it with the
     * current user as host.
     *
     * @throws CapacityExceededException if host, agent and initial participants do not fit
     */
    public ChatSession createOrGetSession(String sessionId, String name, String agentId,
                                          List<String> initialParticipants, SessionMetadata metadata) {
        String hostId = CallerContext.requireUserId();
        String id = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
        Optional<ChatSession> resident = residentSnapshot(id);
        if (resident.isPresent()) {
            return resident.get();
        }
        return serializer.execute(id, () -> {
            Optional<ChatSession> current = residentSnapshot(id);
            if (current.isPresent()) {
                return current.get();
            }
            Optional<ChatSession> stored = Optional.empty();
            try {
                stored = synchronizer.getSession(id);
            } catch (PersistenceException e) {
                logger.warn("Read-through of session {} failed, creating it in memory", id, e);
            }
            if (stored.isPresent()) {
                return hydrate(stored.get());
            }
            return create(id, name, hostId, agentId, initialParticipants, metadata);
        });
    }

    public void addParticipant(String sessionId, String userId, ParticipantRole role) {
        addParticipant(sessionId, Participant.builder()
                .userId(userId)
                .role(role != null ? role : ParticipantRole.PARTICIPANT)
                .build());
    }

    /**
     * Adds the participant or updates its role and permissions in place.
     */
    public void addParticipant(String sessionId, Participant participant) {
        if (participant == null || participant.getUserId() == null || participant.getUserId().isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        serializer.run(sessionId, () -> {
            requireSession(sessionId);
            AddOutcome outcome = join(sessionId, participant);
            if (outcome.isChanged()) {
                touchSession(sessionId);
                recomputeMode(sessionId);
            }
        });
    }

    /**
     * No-op when the user is not a participant.
     */
    public void removeParticipant(String sessionId, String userId) {
        serializer.run(sessionId, () -> {
            requireSession(sessionId);
            if (registry.remove(sessionId, userId)) {
                report(sessionId, synchronizer.removeParticipant(sessionId, userId, registry.count(sessionId)));
                touchSession(sessionId);
                recomputeMode(sessionId);
            }
        });
    }

    /**
     * Sends as the current user. Delivery problems are reported in the message metadata
     * and the {@code messageDelivered} event, never thrown.
     */
    public ChatMessage sendMessage(String sessionId, String content, MessageTarget target, List<String> attachments) {
        String senderId = CallerContext.requireUserId();
        boolean noAttachments = attachments == null || attachments.isEmpty();
        if ((content == null || content.isBlank()) && noAttachments) {
            throw new IllegalArgumentException("Message content must not be empty");
        }
        return serializer.execute(sessionId, () -> {
            ChatSession session = requireSession(sessionId);
            Participant sender = requireParticipant(sessionId, senderId);
            ChatMessage message = ChatMessage.builder()
                    .id(UUID.randomUUID().toString())
                    .sessionId(sessionId)
                    .senderId(senderId)
                    .senderName(sender.getDisplayName() != null ? sender.getDisplayName() : sender.getName())
                    .content(content)
                    .target(target)
                    .attachments(attachments)
                    .timestamp(Instant.now())
                    .build();
            // an unroutable target is rejected before anything is recorded or stored
            message.resolveRecipients(router.resolveRecipients(message, sessionId));
            presenceTracker.touch(sessionId, senderId);
            presenceTracker.setTyping(sessionId, senderId, false);
            stateMachine.recordMessage(sessionId, message.getId(), message.getTimestamp());
            report(sessionId, synchronizer.saveMessage(message));
            DeliveryResult result = router.route(message, session);
            if (!result.isDelivered()) {
                logger.info("Message {} in session {} not delivered to {}", message.getId(), sessionId,
                        result.getFailedDeliveries().stream().map(FailedDelivery::getUserId).collect(Collectors.toList()));
            }
            return message;
        });
    }

    public void setTyping(String sessionId, boolean isTyping) {
        String userId = CallerContext.requireUserId();
        serializer.run(sessionId, () -> {
            requireSession(sessionId);
            requireParticipant(sessionId, userId);
            if (isTyping) {
                presenceTracker.touch(sessionId, userId);
            }
            presenceTracker.setTyping(sessionId, userId, isTyping);
        });
    }

    /**
     * Keeps the current user online in the session.
     */
    public void heartbeat(String sessionId) {
        String userId = CallerContext.requireUserId();
        serializer.run(sessionId, () -> {
            requireSession(sessionId);
            requireParticipant(sessionId, userId);
            presenceTracker.touch(sessionId, userId);
        });
    }

    /**
     * Marks the message read by the current user.
     *
     * @return {@code false} if it was already read by that user
     */
    public boolean markAsRead(String messageId) {
        String userId = CallerContext.requireUserId();
        ChatMessage message = router.find(messageId)
                .orElseGet(() -> synchronizer.getMessage(messageId)
                        .map(router::index)
                        .orElseThrow(() -> new NotFoundException("Message", messageId)));
        return serializer.execute(message.getSessionId(), () -> {
            boolean added = router.markAsRead(messageId, userId);
            if (added) {
                report(message.getSessionId(), synchronizer.saveReadReceipt(message, userId));
            }
            return added;
        });
    }

    public Optional<ChatSession> getSession(String sessionId) {
        Optional<ChatSession> resident = residentSnapshot(sessionId);
        if (resident.isPresent()) {
            return resident;
        }
        return serializer.execute(sessionId, () -> {
            Optional<ChatSession> current = residentSnapshot(sessionId);
            if (current.isPresent()) {
                return current;
            }
            return synchronizer.getSession(sessionId).map(this::hydrate);
        });
    }

    /**
     * Sessions the user belongs to, most recently active first. Resident state wins over
     * stored documents.
     */
    public List<ChatSession> getUserSessions(String userId) {
        Map<String, ChatSession> byId = new LinkedHashMap<>();
        for (ChatSession stored : synchronizer.getUserSessions(userId)) {
            byId.put(stored.getId(), residentSnapshot(stored.getId()).orElse(stored));
        }
        for (String id : stateMachine.residentIds()) {
            if (!byId.containsKey(id) && registry.contains(id, userId)) {
                residentSnapshot(id).ifPresent(s -> byId.put(id, s));
            }
        }
        return byId.values().stream()
                .sorted(Comparator.comparing(ChatSession::getLastActivity,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(properties.getUserSessionLimit())
                .collect(Collectors.toList());
    }

    public List<ChatMessage> getMessages(String sessionId, int limit) {
        if (getSession(sessionId).isEmpty()) {
            throw new NotFoundException("Session", sessionId);
        }
        return synchronizer.getMessages(sessionId, limit).stream()
                .map(router::index)
                .collect(Collectors.toList());
    }

    public List<TypingRecord> listTyping(String sessionId) {
        return presenceTracker.listTyping(sessionId);
    }

    public StoreSubscription watchSession(String sessionId, Consumer<ChatSession> callback) {
        return synchronizer.watchSession(sessionId, callback);
    }

    public boolean hasPermission(String sessionId, String userId, Permission permission) {
        return registry.hasPermission(sessionId, userId, permission);
    }

    public boolean grantPermission(String sessionId, String userId, Permission permission) {
        return changePermission(sessionId, userId, permission, true);
    }

    public boolean revokePermission(String sessionId, String userId, Permission permission) {
        return changePermission(sessionId, userId, permission, false);
    }

    /**
     * Drops idle sessions nobody is online in. They are re-hydrated on next access.
     *
     * @return number of sessions evicted
     */
    public int evictIdleSessions() {
        Instant cutoff = Instant.now().minus(properties.getIdleEviction());
        int evicted = 0;
        for (String id : stateMachine.idleSince(cutoff)) {
            boolean done = serializer.execute(id, () -> {
                boolean idle = stateMachine.find(id)
                        .map(s -> s.getLastActivity() == null || s.getLastActivity().isBefore(cutoff))
                        .orElse(false);
                if (!idle || presenceTracker.hasOnlineUsers(id)) {
                    return false;
                }
                stateMachine.evict(id);
                registry.evict(id);
                presenceTracker.clearSession(id);
                router.evict(id);
                threads.values().removeIf(t -> id.equals(t.getSessionId()));
                serializer.release(id);
                return true;
            });
            if (done) {
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * Opens a thread on a message of the session, with the current user as its first
     * participant.
     *
     * @throws NotFoundException if the parent message does not belong to the session
     */
    public ChatThread createThread(String sessionId, String parentMessageId, String title,
                                   String description, List<String> tags) {
        String userId = CallerContext.requireUserId();
        if (parentMessageId == null || parentMessageId.isBlank()) {
            throw new IllegalArgumentException("parentMessageId is required");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Thread title must not be empty");
        }
        return serializer.execute(sessionId, () -> {
            requireSession(sessionId);
            requireParticipant(sessionId, userId);
            router.find(parentMessageId)
                    .or(() -> synchronizer.getMessage(parentMessageId))
                    .filter(m -> sessionId.equals(m.getSessionId()))
                    .orElseThrow(() -> new NotFoundException("Message", parentMessageId));
            Instant now = Instant.now();
            ChatThread thread = ChatThread.builder()
                    .id(UUID.randomUUID().toString())
                    .sessionId(sessionId)
                    .parentMessageId(parentMessageId)
                    .title(title)
                    .description(description)
                    .createdBy(userId)
                    .createdAt(now)
                    .lastActivityAt(now)
                    .participants(new ArrayList<>(List.of(userId)))
                    .tags(tags == null ? new ArrayList<>() : new ArrayList<>(tags))
                    .build();
            threads.put(thread.getId(), thread);
            report(sessionId, synchronizer.saveThread(thread));
            recordThreadActivity(thread, userId, ThreadActivityType.CREATED, title);
            return thread.copy();
        });
    }

    /**
     * Replies in a thread as the current user, who joins the thread's participants.
     *
     * @throws IllegalArgumentException if the thread is archived
     */
    public ThreadMessage replyToThread(String threadId, String content, List<String> attachments) {
        String userId = CallerContext.requireUserId();
        boolean noAttachments = attachments == null || attachments.isEmpty();
        if ((content == null || content.isBlank()) && noAttachments) {
            throw new IllegalArgumentException("Reply content must not be empty");
        }
        String sessionId = requireThread(threadId).getSessionId();
        return serializer.execute(sessionId, () -> {
            requireSession(sessionId);
            Participant sender = requireParticipant(sessionId, userId);
            ChatThread thread = requireThread(threadId).copy();
            if (thread.getStatus() == ThreadStatus.ARCHIVED) {
                throw new IllegalArgumentException("Thread " + threadId + " is archived");
            }
            ThreadMessage reply = ThreadMessage.builder()
                    .id(UUID.randomUUID().toString())
                    .threadId(threadId)
                    .sessionId(sessionId)
                    .senderId(userId)
                    .senderName(sender.getDisplayName() != null ? sender.getDisplayName() : sender.getName())
                    .content(content)
                    .attachments(noAttachments ? new ArrayList<>() : new ArrayList<>(attachments))
                    .timestamp(Instant.now())
                    .build();
            presenceTracker.touch(sessionId, userId);
            report(sessionId, synchronizer.saveThreadMessage(reply));

            thread.setMessageCount(thread.getMessageCount() + 1);
            thread.setLastActivityAt(reply.getTimestamp());
            if (!thread.getParticipants().contains(userId)) {
                thread.getParticipants().add(userId);
            }
            threads.put(threadId, thread);
            report(sessionId, synchronizer.updateThread(thread));
            recordThreadActivity(thread, userId, ThreadActivityType.REPLIED, reply.getId());
            return reply;
        });
    }

    /**
     * @return the thread after the change; unchanged if it already had that status
     */
    public ChatThread updateThreadStatus(String threadId, ThreadStatus status) {
        String userId = CallerContext.requireUserId();
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        String sessionId = requireThread(threadId).getSessionId();
        return serializer.execute(sessionId, () -> {
            requireSession(sessionId);
            requireParticipant(sessionId, userId);
            ChatThread thread = requireThread(threadId).copy();
            if (thread.getStatus() == status) {
                return thread;
            }
            thread.setStatus(status);
            thread.setLastActivityAt(Instant.now());
            threads.put(threadId, thread);
            report(sessionId, synchronizer.updateThread(thread));
            recordThreadActivity(thread, userId, ThreadActivityType.STATUS_CHANGED, status.getValue());
            return thread.copy();
        });
    }

    public Optional<ChatThread> getThread(String threadId) {
        return findThread(threadId).map(ChatThread::copy);
    }

    /**
     * Threads of the session, most recently active first. Resident threads win over stored ones.
     */
    public List<ChatThread> getSessionThreads(String sessionId) {
        Map<String, ChatThread> byId = new LinkedHashMap<>();
        for (ChatThread stored : synchronizer.getSessionThreads(sessionId)) {
            byId.put(stored.getId(), threads.getOrDefault(stored.getId(), stored));
        }
        threads.values().stream()
                .filter(t -> sessionId.equals(t.getSessionId()))
                .forEach(t -> byId.putIfAbsent(t.getId(), t));
        return byId.values().stream()
                .sorted(Comparator.comparing(ChatThread::getLastActivityAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .map(ChatThread::copy)
                .collect(Collectors.toList());
    }

    public List<ChatThread> searchThreads(String sessionId, ThreadSearchCriteria criteria) {
        return synchronizer.searchThreads(sessionId, criteria);
    }

    public List<ThreadMessage> getThreadMessages(String threadId, int limit) {
        requireThread(threadId);
        return synchronizer.getThreadMessages(threadId, limit);
    }

    public List<ThreadActivity> getThreadActivities(String sessionId, int limit) {
        return synchronizer.getThreadActivities(sessionId, limit);
    }

    public int residentSessionCount() {
        return stateMachine.residentCount();
    }

    @PreDestroy
    public void shutdown() {
        subscriptions.forEach(Disposable::dispose);
    }

    private Optional<ChatThread> findThread(String threadId) {
        ChatThread resident = threads.get(threadId);
        if (resident != null) {
            return Optional.of(resident);
        }
        return synchronizer.getThread(threadId).map(stored -> {
            ChatThread existing = threads.putIfAbsent(threadId, stored);
            return existing != null ? existing : stored;
        });
    }

    private ChatThread requireThread(String threadId) {
        return findThread(threadId).orElseThrow(() -> new NotFoundException("Thread", threadId));
    }

    private void recordThreadActivity(ChatThread thread, String userId, ThreadActivityType type, String details) {
        ThreadActivity activity = ThreadActivity.builder()
                .id(UUID.randomUUID().toString())
                .threadId(thread.getId())
                .sessionId(thread.getSessionId())
                .userId(userId)
                .type(type)
                .details(details)
                .timestamp(Instant.now())
                .build();
        report(thread.getSessionId(), synchronizer.saveThreadActivity(activity));
        eventBus.publish(new ThreadActivityEvent(thread.getSessionId(), activity));
    }

    private ChatSession create(String id, String name, String hostId, String agentId,
                               List<String> initialParticipants, SessionMetadata metadata) {
        String agent = agentId == null || agentId.isBlank() || agentId.equals(hostId) ? null : agentId;
        List<String> others = initialParticipants == null ? List.of() : initialParticipants.stream()
                .filter(Objects::nonNull)
                .filter(u -> !u.equals(hostId) && !u.equals(agent))
                .distinct()
                .collect(Collectors.toList());
        if (1 + (agent != null ? 1 : 0) + others.size() > properties.getMaxParticipants()) {
            throw new CapacityExceededException(id, properties.getMaxParticipants());
        }

        ChatSession session = stateMachine.create(id, name != null && !name.isBlank() ? name : DEFAULT_SESSION_NAME,
                hostId, agent, metadata, !others.isEmpty());
        // the session document must exist before any participant sub-write
        report(id, synchronizer.saveSession(session, List.of(), List.of()));
        eventBus.publish(new SessionCreatedEvent(id, hostId, session.getMode()));

        join(id, Participant.builder()
                .userId(hostId)
                .name(CallerContext.getDisplayName())
                .role(ParticipantRole.HOST)
                .permissions(Permission.FULL)
                .build());
        presenceTracker.touch(id, hostId);
        if (agent != null) {
            join(id, Participant.builder().userId(agent).role(ParticipantRole.AGENT).permissions(Permission.DEFAULT).build());
        }
        for (String userId : others) {
            join(id, Participant.builder().userId(userId).role(ParticipantRole.PARTICIPANT).build());
        }
        recomputeMode(id);
        return snapshot(id);
    }

    private ChatSession hydrate(ChatSession stored) {
        stateMachine.restore(stored);
        registry.restore(stored.getId(), stored.getParticipants());
        recomputeMode(stored.getId());
        return snapshot(stored.getId());
    }

    private AddOutcome join(String sessionId, Participant candidate) {
        AddOutcome outcome = registry.add(sessionId, candidate);
        if (outcome.isChanged()) {
            report(sessionId, synchronizer.saveParticipant(sessionId, outcome.getParticipant(), registry.count(sessionId)));
        }
        return outcome;
    }

    private boolean changePermission(String sessionId, String userId, Permission permission, boolean granted) {
        return serializer.execute(sessionId, () -> {
            requireSession(sessionId);
            boolean changed = granted
                    ? registry.grant(sessionId, userId, permission)
                    : registry.revoke(sessionId, userId, permission);
            if (changed) {
                registry.get(sessionId, userId).ifPresent(p ->
                        report(sessionId, synchronizer.saveParticipant(sessionId, p, registry.count(sessionId))));
            }
            return changed;
        });
    }

    // a failed switch must not undo the membership change that triggered it
    private void recomputeMode(String sessionId) {
        try {
            stateMachine.recompute(sessionId).ifPresent(mode ->
                    report(sessionId, synchronizer.updateSession(sessionId, Map.of("mode", mode.getValue()))));
        } catch (RuntimeException e) {
            logger.warn("Mode recomputation failed for session {}", sessionId, e);
        }
    }

    private void touchSession(String sessionId) {
        Instant now = Instant.now();
        stateMachine.touchActivity(sessionId, now);
        report(sessionId, synchronizer.updateSession(sessionId, Map.of("lastActivity", now)));
    }

    // caller holds the session's serializer
    private ChatSession requireSession(String sessionId) {
        Optional<ChatSession> resident = residentSnapshot(sessionId);
        if (resident.isPresent()) {
            return resident.get();
        }
        return synchronizer.getSession(sessionId)
                .map(this::hydrate)
                .orElseThrow(() -> new NotFoundException("Session", sessionId));
    }

    private Participant requireParticipant(String sessionId, String userId) {
        return registry.get(sessionId, userId)
                .orElseThrow(() -> new NotFoundException("Participant", userId + " in session " + sessionId));
    }

    private Optional<ChatSession> residentSnapshot(String sessionId) {
        return stateMachine.find(sessionId).map(session -> {
            session.setParticipants(registry.list(sessionId));
            return session;
        });
    }

    private ChatSession snapshot(String sessionId) {
        return residentSnapshot(sessionId).orElseThrow(() -> new NotFoundException("Session", sessionId));
    }

    private SessionSynchronizer.SyncResult report(String sessionId, SessionSynchronizer.SyncResult result) {
        if (!result.isSuccess()) {
            logger.warn("Persistence {} failed for session {}: {}", result.getOperation(), sessionId, result.getMessage());
            eventBus.publish(new PersistenceFailedEvent(sessionId, result.getOperation(), result.getMessage()));
        }
        return result;
    }
}
