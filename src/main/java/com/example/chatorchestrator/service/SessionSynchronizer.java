package com.example.chatorchestrator.service;

import com.example.chatorchestrator.config.ChatProperties;
import com.example.chatorchestrator.exception.PersistenceException;
import com.example.chatorchestrator.kv.KvClient;
import com.example.chatorchestrator.model.*;
import com.example.chatorchestrator.store.StoreClient;
import com.example.chatorchestrator.store.StoreSubscription;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.example.chatorchestrator.service.ChatDocumentMapper.*;

/**
 * Mirrors session, participant, message and thread state into the document store, and
 * presence and typing into the key/value store.
 * <p>
 * Every store call runs on the sync pool and is bounded by {@code app.sync.async-timeout-ms}.
 * Writes never throw: they return a {@link SyncResult} the caller reports. Reads throw
 * {@link PersistenceException} when the store cannot be reached.
 */
@Service
public class SessionSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(SessionSynchronizer.class);

    static final String SESSIONS = "sessions";
    static final String PARTICIPANTS = "participants";
    static final String MESSAGES = "messages";
    static final String USER_SESSIONS = "user_sessions";
    static final String INBOX = "inbox";
    static final String THREADS = "threads";
    static final String THREAD_MESSAGES = "thread_messages";
    static final String THREAD_ACTIVITIES = "thread_activities";

    private final StoreClient store;
    private final KvClient kvClient;
    private final ChatProperties properties;
    private final Map<String, StoreSubscription> watches = new ConcurrentHashMap<>();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();
    private volatile ExecutorService asyncExecutor;

    @Value("${app.sync.async-timeout-ms:2000}")
    private long asyncTimeoutMs = 2000;

    @Value("${app.sync.max-async-threads:10}")
    private int maxAsyncThreads = 10;

    public SessionSynchronizer(StoreClient store, KvClient kvClient, ChatProperties properties) {
        this.store = store;
        this.kvClient = kvClient;
        this.properties = properties;
    }

    public SyncResult saveSession(ChatSession session, List<String> participantIds, List<String> activeIds) {
        return write("saveSession", session.getId(), () -> {
            store.put(SESSIONS, session.getId(), DocumentSanitizer.sanitize(toSessionDocument(session, participantIds, activeIds)));
            store.put(USER_SESSIONS, userSessionKey(session.getHostUserId(), session.getId()),
                    userSessionDocument(session.getHostUserId(), session.getId(), session.getCreatedAt()));
        });
    }

    /**
     * Field-level update of the session document. {@link Instant} values are stored as dates.
     */
    public SyncResult updateSession(String sessionId, Map<String, Object> fields) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        fields.forEach((k, v) -> normalized.put(k, v instanceof Instant ? toDate((Instant) v) : v));
        return write("updateSession", sessionId,
                () -> store.updateFields(SESSIONS, sessionId, DocumentSanitizer.sanitize(normalized)));
    }

    /**
     * Loads a session with its participants, or empty if the store has no such session.
     */
    public Optional<ChatSession> getSession(String sessionId) {
        return read("getSession", sessionId, () -> store.get(SESSIONS, sessionId).map(this::hydrate));
    }

    public List<ChatSession> getUserSessions(String userId) {
        return read("getUserSessions", userId, () -> store.find(SESSIONS,
                        Map.of("participantIds", userId),
                        Map.of("lastActivity", -1),
                        properties.getUserSessionLimit())
                .stream()
                .map(this::hydrate)
                .collect(Collectors.toList()));
    }

    public SyncResult saveParticipant(String sessionId, Participant participant, int participantCount) {
        return write("saveParticipant", sessionId, () -> {
            store.put(PARTICIPANTS, participantKey(sessionId, participant.getUserId()),
                    DocumentSanitizer.sanitize(toParticipantDocument(sessionId, participant)));
            store.addToSet(SESSIONS, sessionId, "participantIds", participant.getUserId());
            store.updateFields(SESSIONS, sessionId, Map.of("participantCount", participantCount));
            store.put(USER_SESSIONS, userSessionKey(participant.getUserId(), sessionId),
                    userSessionDocument(participant.getUserId(), sessionId, participant.getJoinedAt()));
        });
    }

    public SyncResult removeParticipant(String sessionId, String userId, int participantCount) {
        return write("removeParticipant", sessionId, () -> {
            store.delete(PARTICIPANTS, participantKey(sessionId, userId));
            store.removeFromSet(SESSIONS, sessionId, "participantIds", userId);
            store.removeFromSet(SESSIONS, sessionId, "activeParticipants", userId);
            store.updateFields(SESSIONS, sessionId, Map.of("participantCount", participantCount));
            store.delete(USER_SESSIONS, userSessionKey(userId, sessionId));
            kvClient.del(presenceKey(sessionId, userId), typingKey(sessionId, userId));
        });
    }

    /**
     * Stores the message and moves the session's last-message pointers to it.
     */
    public SyncResult saveMessage(ChatMessage message) {
        return write("saveMessage", message.getSessionId(), () -> {
            store.put(MESSAGES, message.getId(), DocumentSanitizer.sanitize(toMessageDocument(message)));
            Map<String, Object> pointers = new LinkedHashMap<>();
            pointers.put("lastMessageId", message.getId());
            pointers.put("lastMessageTimestamp", toDate(message.getTimestamp()));
            pointers.put("lastActivity", toDate(message.getTimestamp()));
            store.updateFields(SESSIONS, message.getSessionId(), pointers);
        });
    }

    public SyncResult updateMessageLedger(ChatMessage message) {
        Map<String, Object> fields = toLedgerDocument(message);
        fields.put("metadata", message.getMetadata());
        return write("updateMessageLedger", message.getSessionId(),
                () -> store.updateFields(MESSAGES, message.getId(), DocumentSanitizer.sanitize(fields)));
    }

    public SyncResult saveReadReceipt(ChatMessage message, String userId) {
        return write("saveReadReceipt", message.getSessionId(), () -> {
            store.addToSet(MESSAGES, message.getId(), "readBy", userId);
            store.updateFields(MESSAGES, message.getId(), Map.of("read", true));
        });
    }

    /**
     * Latest messages of a session, oldest first.
     */
    public List<ChatMessage> getMessages(String sessionId, int limit) {
        int pageSize = limit > 0 ? limit : properties.getMessagePageSize();
        List<ChatMessage> messages = read("getMessages", sessionId, () -> store.find(MESSAGES,
                        Map.of("sessionId", sessionId),
                        Map.of("timestamp", -1),
                        pageSize)
                .stream()
                .map(ChatDocumentMapper::toMessage)
                .collect(Collectors.toList()));
        Collections.reverse(messages);
        return messages;
    }

    public Optional<ChatMessage> getMessage(String messageId) {
        return read("getMessage", messageId, () -> store.get(MESSAGES, messageId).map(ChatDocumentMapper::toMessage));
    }

    /**
     * Direct delivery: one inbox entry per recipient.
     */
    public SyncResult saveInboxEntry(String recipientId, ChatMessage message) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("userId", recipientId);
        entry.put("sessionId", message.getSessionId());
        entry.put("messageId", message.getId());
        entry.put("senderId", message.getSenderId());
        entry.put("timestamp", toDate(message.getTimestamp()));
        return write("saveInboxEntry", message.getSessionId(),
                () -> store.put(INBOX, recipientId + "_" + message.getId(), DocumentSanitizer.sanitize(entry)));
    }

    /**
     * Shared delivery: marks the recipient on the stored message.
     */
    public SyncResult fanOutDelivery(ChatMessage message, String recipientId) {
        return write("fanOutDelivery", message.getSessionId(),
                () -> store.addToSet(MESSAGES, message.getId(), "deliveredTo", recipientId));
    }

    /**
     * Hybrid delivery: mirrors the message into the linked direct session. Idempotent.
     */
    public SyncResult saveLinkedCopy(String linkedSessionId, ChatMessage message) {
        Map<String, Object> doc = toMessageDocument(message);
        doc.put("id", linkedSessionId + "_" + message.getId());
        doc.put("sessionId", linkedSessionId);
        doc.put("linkedFrom", message.getSessionId());
        doc.put("originalMessageId", message.getId());
        return write("saveLinkedCopy", linkedSessionId,
                () -> store.put(MESSAGES, linkedSessionId + "_" + message.getId(), DocumentSanitizer.sanitize(doc)));
    }

    public SyncResult saveThread(ChatThread thread) {
        return write("saveThread", thread.getSessionId(),
                () -> store.put(THREADS, thread.getId(), DocumentSanitizer.sanitize(toThreadDocument(thread))));
    }

    /**
     * Overwrites the stored fields of an existing thread.
     */
    public SyncResult updateThread(ChatThread thread) {
        Map<String, Object> fields = toThreadDocument(thread);
        fields.remove("id");
        return write("updateThread", thread.getSessionId(),
                () -> store.updateFields(THREADS, thread.getId(), DocumentSanitizer.sanitize(fields)));
    }

    public Optional<ChatThread> getThread(String threadId) {
        return read("getThread", threadId, () -> store.get(THREADS, threadId).map(ChatDocumentMapper::toThread));
    }

    /**
     * Threads of a session, most recently active first.
     */
    public List<ChatThread> getSessionThreads(String sessionId) {
        return read("getSessionThreads", sessionId, () -> store.find(THREADS,
                        Map.of("sessionId", sessionId),
                        Map.of("lastActivityAt", -1),
                        null)
                .stream()
                .map(ChatDocumentMapper::toThread)
                .collect(Collectors.toList()));
    }

    public SyncResult saveThreadMessage(ThreadMessage message) {
        return write("saveThreadMessage", message.getSessionId(), () -> store.put(THREAD_MESSAGES, message.getId(),
                DocumentSanitizer.sanitize(toThreadMessageDocument(message))));
    }

    /**
     * Latest replies of a thread, oldest first.
     */
    public List<ThreadMessage> getThreadMessages(String threadId, int limit) {
        int pageSize = limit > 0 ? limit : properties.getMessagePageSize();
        List<ThreadMessage> messages = read("getThreadMessages", threadId, () -> store.find(THREAD_MESSAGES,
                        Map.of("threadId", threadId),
                        Map.of("timestamp", -1),
                        pageSize)
                .stream()
                .map(ChatDocumentMapper::toThreadMessage)
                .collect(Collectors.toList()));
        Collections.reverse(messages);
        return messages;
    }

    /**
     * Threads of a session matching the criteria. The store narrows by session and sorts;
     * status, participant, date and text filters run here, before the limit applies.
     */
    public List<ChatThread> searchThreads(String sessionId, ThreadSearchCriteria criteria) {
        ThreadSearchCriteria c = criteria != null ? criteria : ThreadSearchCriteria.builder().build();
        String sortBy = c.getSortBy() != null ? c.getSortBy() : ThreadSearchCriteria.SORT_LAST_ACTIVITY;
        List<ChatThread> found = read("searchThreads", sessionId, () -> store.find(THREADS,
                        Map.of("sessionId", sessionId),
                        Map.of(sortBy, c.isAscending() ? 1 : -1),
                        null)
                .stream()
                .map(ChatDocumentMapper::toThread)
                .collect(Collectors.toList()));
        return found.stream()
                .filter(t -> c.getStatuses() == null || c.getStatuses().isEmpty() || c.getStatuses().contains(t.getStatus()))
                .filter(t -> c.getParticipants() == null || c.getParticipants().isEmpty()
                        || t.getParticipants().stream().anyMatch(c.getParticipants()::contains))
                .filter(t -> c.getCreatedFrom() == null || (t.getCreatedAt() != null && !t.getCreatedAt().isBefore(c.getCreatedFrom())))
                .filter(t -> c.getCreatedTo() == null || (t.getCreatedAt() != null && !t.getCreatedAt().isAfter(c.getCreatedTo())))
                .filter(t -> matchesText(t, c.getQuery()))
                .limit(c.getLimit() != null && c.getLimit() > 0 ? c.getLimit() : Long.MAX_VALUE)
                .collect(Collectors.toList());
    }

    public SyncResult saveThreadActivity(ThreadActivity activity) {
        return write("saveThreadActivity", activity.getSessionId(), () -> store.put(THREAD_ACTIVITIES, activity.getId(),
                DocumentSanitizer.sanitize(toActivityDocument(activity))));
    }

    /**
     * Thread activity across a session, newest first.
     */
    public List<ThreadActivity> getThreadActivities(String sessionId, int limit) {
        int pageSize = limit > 0 ? limit : properties.getMessagePageSize();
        return read("getThreadActivities", sessionId, () -> store.find(THREAD_ACTIVITIES,
                        Map.of("sessionId", sessionId),
                        Map.of("timestamp", -1),
                        pageSize)
                .stream()
                .map(ChatDocumentMapper::toActivity)
                .collect(Collectors.toList()));
    }

    public SyncResult upsertPresence(String sessionId, String userId, boolean online, Instant lastActivity) {
        Instant seen = lastActivity != null ? lastActivity : Instant.now();
        return write("upsertPresence", sessionId, () -> {
            if (online) {
                kvClient.set(presenceKey(sessionId, userId), seen.toString(), properties.getPresenceTimeout());
                store.addToSet(SESSIONS, sessionId, "activeParticipants", userId);
            } else {
                kvClient.del(presenceKey(sessionId, userId));
                store.removeFromSet(SESSIONS, sessionId, "activeParticipants", userId);
            }
            store.updateFields(PARTICIPANTS, participantKey(sessionId, userId),
                    Map.of("isOnline", online, "lastSeen", toDate(seen)));
        });
    }

    public SyncResult upsertTyping(String sessionId, String userId, boolean typing) {
        return write("upsertTyping", sessionId, () -> {
            if (typing) {
                kvClient.set(typingKey(sessionId, userId), Instant.now().toString(), properties.getTypingTimeout());
            } else {
                kvClient.del(typingKey(sessionId, userId));
            }
        });
    }

    /**
     * Presence mirror keys of a session with their remaining TTL in milliseconds.
     */
    public Map<String, Long> getPresenceMirror(String sessionId) {
        return read("getPresenceMirror", sessionId, () -> kvClient.ttlMillis("presence:" + sessionId + ":", 1000));
    }

    /**
     * Follows the stored session document. The subscription is cancelled by the returned
     * handle or by {@link #cleanup()}.
     */
    public StoreSubscription watchSession(String sessionId, Consumer<ChatSession> callback) {
        String watchId = sessionId + ":" + UUID.randomUUID();
        StoreSubscription subscription = store.subscribe(SESSIONS, Map.of("id", sessionId),
                doc -> callback.accept(toSession(doc)));
        watches.put(watchId, subscription);
        logger.debug("Watching session {} ({})", sessionId, watchId);
        return () -> {
            StoreSubscription live = watches.remove(watchId);
            if (live != null) {
                live.cancel();
            }
        };
    }

    public int activeWatchCount() {
        return watches.size();
    }

    @PreDestroy
    public void cleanup() {
        watches.forEach((id, subscription) -> {
            try {
                subscription.cancel();
            } catch (RuntimeException e) {
                logger.warn("Failed to cancel watch {}", id, e);
            }
        });
        watches.clear();
        if (asyncExecutor != null) {
            asyncExecutor.shutdown();
        }
    }

    public Map<String, Object> getSyncStats() {
        ThreadPoolExecutor executor = (ThreadPoolExecutor) executor();
        return Map.of(
            "asyncThreads", Map.of(
                "activeCount", executor.getActiveCount(),
                "poolSize", executor.getPoolSize(),
                "maxPoolSize", executor.getMaximumPoolSize(),
                "queueSize", executor.getQueue().size(),
                "completedTasks", executor.getCompletedTaskCount()
            ),
            "configuration", Map.of(
                "asyncTimeoutMs", asyncTimeoutMs,
                "maxAsyncThreads", maxAsyncThreads
            ),
            "operations", Map.of(
                "succeeded", succeeded.get(),
                "failed", failed.get(),
                "timedOut", timedOut.get()
            ),
            "activeWatches", watches.size()
        );
    }

    static String presenceKey(String sessionId, String userId) {
        return "presence:" + sessionId + ":" + userId;
    }

    static String typingKey(String sessionId, String userId) {
        return "typing:" + sessionId + ":" + userId;
    }

    private static boolean matchesText(ChatThread thread, String query) {
        if (query == null || query.isBlank()) {
            return true;
        }
        String needle = query.toLowerCase(Locale.ROOT);
        return contains(thread.getTitle(), needle)
                || contains(thread.getDescription(), needle)
                || thread.getTags().stream().anyMatch(tag -> contains(tag, needle));
    }

    private static boolean contains(String text, String needle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
    }

    private ChatSession hydrate(Map<String, Object> doc) {
        ChatSession session = toSession(doc);
        List<Participant> participants = store.find(PARTICIPANTS,
                        Map.of("sessionId", session.getId()),
                        Map.of("joinedAt", 1),
                        null)
                .stream()
                .map(ChatDocumentMapper::toParticipant)
                .collect(Collectors.toList());
        session.setParticipants(participants);
        return session;
    }

    private static Map<String, Object> userSessionDocument(String userId, String sessionId, Instant joinedAt) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("userId", userId);
        doc.put("sessionId", sessionId);
        doc.put("joinedAt", toDate(joinedAt != null ? joinedAt : Instant.now()));
        return DocumentSanitizer.sanitize(doc);
    }

    private SyncResult write(String operation, String target, Runnable work) {
        CompletableFuture<Void> future = CompletableFuture.runAsync(work, executor());
        try {
            future.get(asyncTimeoutMs, TimeUnit.MILLISECONDS);
            succeeded.incrementAndGet();
            logger.debug("{} completed for {}", operation, target);
            return SyncResult.success(operation, "Persisted " + target);
        } catch (TimeoutException e) {
            timedOut.incrementAndGet();
            future.cancel(true);
            logger.warn("{} timed out for {} after {}ms", operation, target, asyncTimeoutMs);
            return SyncResult.failure(operation, "Timed out after " + asyncTimeoutMs + "ms");
        } catch (ExecutionException e) {
            failed.incrementAndGet();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("{} failed for {}: {}", operation, target, cause.getMessage());
            return SyncResult.failure(operation, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed.incrementAndGet();
            return SyncResult.failure(operation, "Interrupted");
        }
    }

    private <T> T read(String operation, String target, Supplier<T> query) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(query, executor());
        try {
            return future.get(asyncTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            timedOut.incrementAndGet();
            future.cancel(true);
            throw new PersistenceException(operation + " timed out for " + target, e);
        } catch (ExecutionException e) {
            failed.incrementAndGet();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("{} failed for {}: {}", operation, target, cause.getMessage());
            throw new PersistenceException(operation + " failed for " + target + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PersistenceException(operation + " interrupted for " + target, e);
        }
    }

    // created on first use so that the configured pool size applies
    private ExecutorService executor() {
        ExecutorService executor = asyncExecutor;
        if (executor == null) {
            synchronized (this) {
                executor = asyncExecutor;
                if (executor == null) {
                    int threadCount = maxAsyncThreads > 0 ? maxAsyncThreads : 10;
                    executor = Executors.newFixedThreadPool(threadCount, r -> {
                        Thread t = new Thread(r, "session-sync");
                        t.setDaemon(true);
                        return t;
                    });
                    asyncExecutor = executor;
                }
            }
        }
        return executor;
    }

    /**
     * Result of one persistence write.
     */
    public static class SyncResult {
        private final boolean success;
        private final String operation;
        private final String message;
        private final Instant timestamp;

        private SyncResult(boolean success, String operation, String message) {
            this.success = success;
            this.operation = operation;
            this.message = message;
            this.timestamp = Instant.now();
        }

        public static SyncResult success(String operation, String message) {
            return new SyncResult(true, operation, message);
        }

        public static SyncResult failure(String operation, String message) {
            return new SyncResult(false, operation, message);
        }

        public boolean isSuccess() { return success; }
        public String getOperation() { return operation; }
        public String getMessage() { return message; }
        public Instant getTimestamp() { return timestamp; }

        public Map<String, Object> toMap() {
            return Map.of(
                "success", success,
                "operation", operation,
                "message", message,
                "timestamp", timestamp
            );
        }
    }
}
