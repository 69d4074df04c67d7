package com.example.chatorchestrator.session;

import com.example.chatorchestrator.event.ChatEventBus;
import com.example.chatorchestrator.event.SessionModeChangedEvent;
import com.example.chatorchestrator.model.*;
import com.example.chatorchestrator.participant.ParticipantRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Canonical mode and lifecycle fields of each resident session.
 * <p>
 * The mode is never set by callers after creation: {@link #recompute} derives it from the
 * current participants and applies the result only when it differs from the stored mode.
 */
@Component
public class SessionStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(SessionStateMachine.class);

    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();
    private final ParticipantRegistry registry;
    private final ChatEventBus eventBus;
    private final List<SessionModeListener> listeners;

    public SessionStateMachine(ParticipantRegistry registry, ChatEventBus eventBus, List<SessionModeListener> listeners) {
        this.registry = registry;
        this.eventBus = eventBus;
        this.listeners = List.copyOf(listeners);
    }

    /**
     * Shared iff more than one participant is not an agent.
     */
    public static SessionMode deriveMode(Collection<Participant> participants) {
        long humans = participants.stream()
                .filter(p -> p.getRole() != ParticipantRole.AGENT)
                .count();
        return humans > 1 ? SessionMode.SHARED : SessionMode.DIRECT;
    }

    /**
     * Registers a new session. The initial mode follows whether initial participants were
     * supplied; the linked session id is captured from the metadata once.
     */
    public ChatSession create(String sessionId, String name, String hostUserId, String agentId,
                              SessionMetadata metadata, boolean hasInitialParticipants) {
        Instant now = Instant.now();
        SessionMetadata meta = metadata != null ? metadata.toBuilder().build() : SessionMetadata.builder().build();
        ChatSession session = ChatSession.builder()
                .id(sessionId)
                .name(name)
                .mode(hasInitialParticipants ? SessionMode.SHARED : SessionMode.DIRECT)
                .hostUserId(hostUserId)
                .agentId(agentId)
                .createdAt(now)
                .lastActivity(now)
                .metadata(meta)
                .linkedSessionId(meta.getLinkedSessionId())
                .build();
        if (sessions.putIfAbsent(sessionId, session) != null) {
            throw new IllegalStateException("Session already resident: " + sessionId);
        }
        logger.info("Created session {} for host {} in {} mode", sessionId, hostUserId, session.getMode().getValue());
        broadcast(sessionId, session.getMode(), session.getDeliveryMode());
        return copy(session);
    }

    /**
     * Re-derives the mode from the registry. On a change the stored mode is updated,
     * {@code sessionModeChanged} is published and the listeners are notified.
     *
     * @return the new mode, or empty when it did not change
     */
    public Optional<SessionMode> recompute(String sessionId) {
        ChatSession session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        SessionMode computed = deriveMode(registry.list(sessionId));
        SessionMode previous;
        DeliveryMode deliveryMode;
        synchronized (session) {
            previous = session.getMode();
            if (previous == computed) {
                return Optional.empty();
            }
            session.setMode(computed);
            deliveryMode = session.getDeliveryMode();
        }
        logger.info("Session {} switched from {} to {}", sessionId, previous.getValue(), computed.getValue());
        eventBus.publish(new SessionModeChangedEvent(sessionId, previous, computed));
        broadcast(sessionId, computed, deliveryMode);
        return Optional.of(computed);
    }

    public Optional<ChatSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(SessionStateMachine::copy);
    }

    public boolean isResident(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public void touchActivity(String sessionId, Instant at) {
        ChatSession session = sessions.get(sessionId);
        if (session != null) {
            synchronized (session) {
                if (session.getLastActivity() == null || at.isAfter(session.getLastActivity())) {
                    session.setLastActivity(at);
                }
            }
        }
    }

    public void recordMessage(String sessionId, String messageId, Instant timestamp) {
        ChatSession session = sessions.get(sessionId);
        if (session != null) {
            synchronized (session) {
                session.setLastMessageId(messageId);
                session.setLastMessageTimestamp(timestamp);
            }
            touchActivity(sessionId, timestamp);
        }
    }

    /**
     * Makes a session read back from the store resident again. The stored mode is kept as is;
     * callers recompute afterwards.
     */
    public ChatSession restore(ChatSession stored) {
        ChatSession session = stored.toBuilder()
                .participants(new ArrayList<>())
                .metadata(stored.getMetadata() != null ? stored.getMetadata().toBuilder().build() : SessionMetadata.builder().build())
                .build();
        if (session.getLinkedSessionId() == null) {
            session.setLinkedSessionId(session.getMetadata().getLinkedSessionId());
        }
        if (session.getMode() == null) {
            session.setMode(SessionMode.DIRECT);
        }
        ChatSession existing = sessions.putIfAbsent(session.getId(), session);
        if (existing != null) {
            return copy(existing);
        }
        logger.info("Restored session {} from store", session.getId());
        broadcast(session.getId(), session.getMode(), session.getDeliveryMode());
        return copy(session);
    }

    /**
     * Ids of resident sessions whose last activity is before {@code cutoff}.
     */
    public List<String> idleSince(Instant cutoff) {
        return sessions.values().stream()
                .filter(s -> s.getLastActivity() == null || s.getLastActivity().isBefore(cutoff))
                .map(ChatSession::getId)
                .collect(Collectors.toList());
    }

    public List<String> residentIds() {
        return new ArrayList<>(sessions.keySet());
    }

    public void evict(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            logger.info("Evicted session {}", sessionId);
        }
    }

    public int residentCount() {
        return sessions.size();
    }

    private void broadcast(String sessionId, SessionMode mode, DeliveryMode deliveryMode) {
        for (SessionModeListener listener : listeners) {
            try {
                listener.onSessionModeChanged(sessionId, mode, deliveryMode);
            } catch (RuntimeException e) {
                logger.warn("Mode broadcast to {} failed for session {}", listener.getClass().getSimpleName(), sessionId, e);
            }
        }
    }

    private static ChatSession copy(ChatSession session) {
        synchronized (session) {
            return session.toBuilder()
                    .participants(new ArrayList<>())
                    .metadata(session.getMetadata() != null ? session.getMetadata().toBuilder().build() : null)
                    .build();
        }
    }
}
