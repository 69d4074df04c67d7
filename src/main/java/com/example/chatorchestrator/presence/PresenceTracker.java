package com.example.chatorchestrator.presence;

import com.example.chatorchestrator.config.ChatProperties;
import com.example.chatorchestrator.event.ChatEventBus;
import com.example.chatorchestrator.event.PresenceChangedEvent;
import com.example.chatorchestrator.event.TypingStatusChangedEvent;
import com.example.chatorchestrator.model.DeliveryMode;
import com.example.chatorchestrator.model.PresenceRecord;
import com.example.chatorchestrator.model.SessionMode;
import com.example.chatorchestrator.model.SessionUserKey;
import com.example.chatorchestrator.model.TypingRecord;
import com.example.chatorchestrator.session.SessionModeListener;
import com.example.chatorchestrator.session.SessionSerializer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Online and typing state per (session, user), each backed by a resettable expiry timer.
 * <p>
 * Ephemeral: nothing here is part of durable session state. Expiry callbacks run through
 * the session's {@link SessionSerializer} so they are ordered with the session's other
 * mutations, and each armed timer applies its transition at most once.
 */
@Component
public class PresenceTracker implements SessionModeListener {

    private static final Logger logger = LoggerFactory.getLogger(PresenceTracker.class);

    private final ChatEventBus eventBus;
    private final SessionSerializer serializer;
    private final ChatProperties properties;
    private final ScheduledExecutorService timers;
    private final Map<SessionUserKey, PresenceHandle> handles = new ConcurrentHashMap<>();
    private final Map<String, SessionMode> sessionModes = new ConcurrentHashMap<>();

    public PresenceTracker(ChatEventBus eventBus, SessionSerializer serializer, ChatProperties properties) {
        this.eventBus = eventBus;
        this.serializer = serializer;
        this.properties = properties;
        this.timers = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "presence-timer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Marks the user online and re-arms the presence expiry timer.
     */
    public void touch(String sessionId, String userId) {
        SessionUserKey key = SessionUserKey.of(sessionId, userId);
        PresenceHandle handle = handles.computeIfAbsent(key, k -> new PresenceHandle());
        Duration timeout = properties.getPresenceTimeout();
        boolean cameOnline;
        synchronized (handle) {
            Instant now = Instant.now();
            cameOnline = !handle.online;
            handle.online = true;
            handle.lastActivity = now;
            handle.presenceExpiresAt = now.plus(timeout);
            long generation = ++handle.presenceGeneration;
            cancel(handle.presenceTimer);
            handle.presenceTimer = timers.schedule(() -> expirePresence(key, handle, generation),
                    timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        if (cameOnline) {
            logger.debug("User {} online in session {}", userId, sessionId);
            eventBus.publish(new PresenceChangedEvent(sessionId, userId, true));
        }
    }

    /**
     * Starts, refreshes or stops the user's typing indicator. Refreshing an active
     * indicator only pushes its expiry out and emits nothing.
     */
    public void setTyping(String sessionId, String userId, boolean isTyping) {
        SessionUserKey key = SessionUserKey.of(sessionId, userId);
        if (!isTyping) {
            PresenceHandle handle = handles.get(key);
            if (handle == null) {
                return;
            }
            boolean stopped;
            synchronized (handle) {
                stopped = clearTyping(handle);
            }
            if (stopped) {
                eventBus.publish(new TypingStatusChangedEvent(sessionId, userId, false));
            }
            return;
        }

        PresenceHandle handle = handles.computeIfAbsent(key, k -> new PresenceHandle());
        Duration timeout = properties.getTypingTimeout();
        boolean started;
        synchronized (handle) {
            Instant now = Instant.now();
            started = !handle.typing;
            handle.typing = true;
            handle.typingActivity = now;
            handle.typingExpiresAt = now.plus(timeout);
            long generation = ++handle.typingGeneration;
            cancel(handle.typingTimer);
            handle.typingTimer = timers.schedule(() -> expireTyping(key, handle, generation),
                    timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        if (started) {
            eventBus.publish(new TypingStatusChangedEvent(sessionId, userId, true));
        }
    }

    public List<TypingRecord> listTyping(String sessionId) {
        Instant now = Instant.now();
        return handles.entrySet().stream()
                .filter(e -> e.getKey().getSessionId().equals(sessionId))
                .map(e -> typingRecord(e.getKey(), e.getValue(), now))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(TypingRecord::getLastActivity))
                .collect(Collectors.toList());
    }

    public boolean isOnline(String sessionId, String userId) {
        PresenceHandle handle = handles.get(SessionUserKey.of(sessionId, userId));
        if (handle == null) {
            return false;
        }
        synchronized (handle) {
            return handle.online;
        }
    }

    public boolean isTyping(String sessionId, String userId) {
        PresenceHandle handle = handles.get(SessionUserKey.of(sessionId, userId));
        if (handle == null) {
            return false;
        }
        synchronized (handle) {
            return handle.typing;
        }
    }

    public Optional<PresenceRecord> getPresence(String sessionId, String userId) {
        PresenceHandle handle = handles.get(SessionUserKey.of(sessionId, userId));
        if (handle == null) {
            return Optional.empty();
        }
        synchronized (handle) {
            return Optional.of(PresenceRecord.builder()
                    .sessionId(sessionId)
                    .userId(userId)
                    .online(handle.online)
                    .lastActivity(handle.lastActivity)
                    .expiresAt(handle.online ? handle.presenceExpiresAt : null)
                    .sessionMode(sessionModes.get(sessionId))
                    .build());
        }
    }

    public boolean hasOnlineUsers(String sessionId) {
        return handles.keySet().stream()
                .filter(k -> k.getSessionId().equals(sessionId))
                .anyMatch(k -> isOnline(sessionId, k.getUserId()));
    }

    /**
     * Forgets the user's presence and typing state without emitting events.
     */
    public void clear(String sessionId, String userId) {
        PresenceHandle handle = handles.remove(SessionUserKey.of(sessionId, userId));
        if (handle != null) {
            synchronized (handle) {
                disarm(handle);
            }
        }
    }

    public void clearSession(String sessionId) {
        handles.keySet().removeIf(key -> {
            if (!key.getSessionId().equals(sessionId)) {
                return false;
            }
            PresenceHandle handle = handles.get(key);
            if (handle != null) {
                synchronized (handle) {
                    disarm(handle);
                }
            }
            return true;
        });
        sessionModes.remove(sessionId);
    }

    @Override
    public void onSessionModeChanged(String sessionId, SessionMode mode, DeliveryMode deliveryMode) {
        sessionModes.put(sessionId, mode);
    }

    @PreDestroy
    public void shutdown() {
        timers.shutdownNow();
    }

    private void expirePresence(SessionUserKey key, PresenceHandle handle, long generation) {
        serializer.run(key.getSessionId(), () -> {
            boolean wasTyping;
            synchronized (handle) {
                if (handle.presenceGeneration != generation || !handle.online || handles.get(key) != handle) {
                    return;
                }
                handle.online = false;
                handle.presenceTimer = null;
                wasTyping = clearTyping(handle);
            }
            logger.debug("Presence of {} expired in session {}", key.getUserId(), key.getSessionId());
            eventBus.publish(new PresenceChangedEvent(key.getSessionId(), key.getUserId(), false));
            if (wasTyping) {
                eventBus.publish(new TypingStatusChangedEvent(key.getSessionId(), key.getUserId(), false));
            }
        });
    }

    private void expireTyping(SessionUserKey key, PresenceHandle handle, long generation) {
        serializer.run(key.getSessionId(), () -> {
            synchronized (handle) {
                if (handle.typingGeneration != generation || !handle.typing || handles.get(key) != handle) {
                    return;
                }
                clearTyping(handle);
            }
            logger.debug("Typing indicator of {} expired in session {}", key.getUserId(), key.getSessionId());
            eventBus.publish(new TypingStatusChangedEvent(key.getSessionId(), key.getUserId(), false));
        });
    }

    private Optional<TypingRecord> typingRecord(SessionUserKey key, PresenceHandle handle, Instant now) {
        synchronized (handle) {
            if (!handle.typing || handle.typingExpiresAt == null || !handle.typingExpiresAt.isAfter(now)) {
                return Optional.empty();
            }
            return Optional.of(TypingRecord.builder()
                    .sessionId(key.getSessionId())
                    .userId(key.getUserId())
                    .isTyping(true)
                    .lastActivity(handle.typingActivity)
                    .expiresAt(handle.typingExpiresAt)
                    .build());
        }
    }

    // caller holds the handle monitor
    private static boolean clearTyping(PresenceHandle handle) {
        if (!handle.typing) {
            return false;
        }
        handle.typing = false;
        handle.typingGeneration++;
        handle.typingExpiresAt = null;
        cancel(handle.typingTimer);
        handle.typingTimer = null;
        return true;
    }

    private static void disarm(PresenceHandle handle) {
        clearTyping(handle);
        handle.online = false;
        handle.presenceGeneration++;
        cancel(handle.presenceTimer);
        handle.presenceTimer = null;
    }

    private static void cancel(ScheduledFuture<?> timer) {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private static final class PresenceHandle {
        boolean online;
        Instant lastActivity;
        Instant presenceExpiresAt;
        ScheduledFuture<?> presenceTimer;
        long presenceGeneration;

        boolean typing;
        Instant typingActivity;
        Instant typingExpiresAt;
        ScheduledFuture<?> typingTimer;
        long typingGeneration;
    }
}
