package com.example.chatorchestrator.participant;

import com.example.chatorchestrator.config.ChatProperties;
import com.example.chatorchestrator.event.ChatEventBus;
import com.example.chatorchestrator.event.ParticipantJoinedEvent;
import com.example.chatorchestrator.event.ParticipantLeftEvent;
import com.example.chatorchestrator.event.ParticipantUpdatedEvent;
import com.example.chatorchestrator.exception.CapacityExceededException;
import com.example.chatorchestrator.model.Participant;
import com.example.chatorchestrator.model.ParticipantRole;
import com.example.chatorchestrator.model.Permission;
import com.example.chatorchestrator.model.PresenceRecord;
import com.example.chatorchestrator.presence.PresenceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Membership, roles and permissions per session. One participant per (session, user),
 * kept in join order.
 * <p>
 * Mutations are expected to run under the session's serializer; reads may come from
 * any thread and always return copies.
 */
@Component
public class ParticipantRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ParticipantRegistry.class);

    private final Map<String, Map<String, Participant>> sessions = new ConcurrentHashMap<>();
    private final PresenceTracker presenceTracker;
    private final IdentityResolver identityResolver;
    private final ChatEventBus eventBus;
    private final ChatProperties properties;

    public ParticipantRegistry(PresenceTracker presenceTracker, IdentityResolver identityResolver,
                               ChatEventBus eventBus, ChatProperties properties) {
        this.presenceTracker = presenceTracker;
        this.identityResolver = identityResolver;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    /**
     * Adds the candidate, or updates role and permissions of an existing participant.
     * <p>
     * A {@code null} or empty permission set means "role defaults" for a new participant
     * and "keep the current set" for an existing one, unless the role changes.
     * <p>
     * For an existing participant {@code participantUpdated} is published synchronously when
     * the role or the permission set changes, a permission-only change included; an
     * unchanged re-add publishes nothing.
     *
     * @throws CapacityExceededException if the user is new and the session is full
     */
    public AddOutcome add(String sessionId, Participant candidate) {
        Objects.requireNonNull(candidate.getUserId(), "userId");
        ParticipantRole role = candidate.getRole() != null ? candidate.getRole() : ParticipantRole.PARTICIPANT;
        Set<Permission> requested = candidate.getPermissions() == null || candidate.getPermissions().isEmpty()
                ? null : EnumSet.copyOf(candidate.getPermissions());
        Map<String, Participant> members = members(sessionId);

        synchronized (members) {
            Participant existing = members.get(candidate.getUserId());
            if (existing != null) {
                return update(sessionId, members, existing, role, requested);
            }
            checkCapacity(sessionId, members);
        }

        // profile lookup may block, so it runs outside the monitor
        Participant resolved = withProfile(candidate);
        Participant joined;
        synchronized (members) {
            Participant existing = members.get(candidate.getUserId());
            if (existing != null) {
                return update(sessionId, members, existing, role, requested);
            }
            checkCapacity(sessionId, members);
            Instant now = Instant.now();
            joined = resolved.toBuilder()
                    .role(role)
                    .permissions(requested != null ? requested : EnumSet.copyOf(Permission.defaultsFor(role)))
                    .joinedAt(candidate.getJoinedAt() != null ? candidate.getJoinedAt() : now)
                    .lastSeen(now)
                    .online(false)
                    .typing(false)
                    .build();
            members.put(joined.getUserId(), joined);
        }
        logger.debug("{} joined session {} as {}", joined.getUserId(), sessionId, role);
        Participant snapshot = snapshot(sessionId, joined);
        eventBus.publish(new ParticipantJoinedEvent(sessionId, snapshot));
        return new AddOutcome(AddOutcome.Kind.JOINED, snapshot);
    }

    /**
     * Removes the participant and forgets its presence and typing state.
     *
     * @return {@code false} if the user was not a participant
     */
    public boolean remove(String sessionId, String userId) {
        Map<String, Participant> members = sessions.get(sessionId);
        if (members == null) {
            return false;
        }
        Participant removed;
        synchronized (members) {
            removed = members.remove(userId);
        }
        if (removed == null) {
            return false;
        }
        presenceTracker.clear(sessionId, userId);
        logger.debug("{} left session {}", userId, sessionId);
        eventBus.publish(new ParticipantLeftEvent(sessionId, userId));
        return true;
    }

    public Optional<Participant> get(String sessionId, String userId) {
        Map<String, Participant> members = sessions.get(sessionId);
        if (members == null) {
            return Optional.empty();
        }
        Participant participant;
        synchronized (members) {
            participant = members.get(userId);
        }
        return Optional.ofNullable(participant).map(p -> snapshot(sessionId, p));
    }

    public List<Participant> list(String sessionId) {
        Map<String, Participant> members = sessions.get(sessionId);
        if (members == null) {
            return new ArrayList<>();
        }
        List<Participant> current;
        synchronized (members) {
            current = new ArrayList<>(members.values());
        }
        return current.stream().map(p -> snapshot(sessionId, p)).collect(Collectors.toList());
    }

    public int count(String sessionId) {
        Map<String, Participant> members = sessions.get(sessionId);
        if (members == null) {
            return 0;
        }
        synchronized (members) {
            return members.size();
        }
    }

    public boolean contains(String sessionId, String userId) {
        return get(sessionId, userId).isPresent();
    }

    public boolean hasPermission(String sessionId, String userId, Permission permission) {
        return get(sessionId, userId)
                .map(p -> p.getPermissions() != null && p.getPermissions().contains(permission))
                .orElse(false);
    }

    /**
     * @return {@code false} if the permission was already granted or the user is not a participant
     */
    public boolean grant(String sessionId, String userId, Permission permission) {
        return changePermission(sessionId, userId, permission, true);
    }

    /**
     * @return {@code false} if the permission was not granted or the user is not a participant
     */
    public boolean revoke(String sessionId, String userId, Permission permission) {
        return changePermission(sessionId, userId, permission, false);
    }

    /**
     * Loads participants read back from the store. Emits nothing.
     */
    public void restore(String sessionId, Collection<Participant> participants) {
        Map<String, Participant> members = members(sessionId);
        synchronized (members) {
            members.clear();
            for (Participant p : participants) {
                Set<Permission> permissions = p.getPermissions() == null || p.getPermissions().isEmpty()
                        ? EnumSet.copyOf(Permission.defaultsFor(p.getRole()))
                        : EnumSet.copyOf(p.getPermissions());
                members.put(p.getUserId(), p.toBuilder().permissions(permissions).online(false).typing(false).build());
            }
        }
    }

    public void evict(String sessionId) {
        sessions.remove(sessionId);
    }

    private void checkCapacity(String sessionId, Map<String, Participant> members) {
        if (members.size() >= properties.getMaxParticipants()) {
            throw new CapacityExceededException(sessionId, properties.getMaxParticipants());
        }
    }

    private AddOutcome update(String sessionId, Map<String, Participant> members, Participant existing,
                              ParticipantRole role, Set<Permission> requested) {
        Set<Permission> permissions;
        if (requested != null) {
            permissions = requested;
        } else if (role != existing.getRole()) {
            permissions = EnumSet.copyOf(Permission.defaultsFor(role));
        } else {
            permissions = existing.getPermissions();
        }
        if (role == existing.getRole() && Objects.equals(permissions, existing.getPermissions())) {
            return new AddOutcome(AddOutcome.Kind.UNCHANGED, snapshot(sessionId, existing));
        }
        Participant updated = existing.toBuilder().role(role).permissions(permissions).build();
        members.put(updated.getUserId(), updated);
        logger.debug("{} updated in session {}: role {} -> {}", updated.getUserId(), sessionId, existing.getRole(), role);
        Participant snapshot = snapshot(sessionId, updated);
        eventBus.publish(new ParticipantUpdatedEvent(sessionId, snapshot, existing.getRole()));
        return new AddOutcome(AddOutcome.Kind.UPDATED, snapshot);
    }

    private boolean changePermission(String sessionId, String userId, Permission permission, boolean granted) {
        Map<String, Participant> members = sessions.get(sessionId);
        if (members == null) {
            return false;
        }
        Participant updated;
        synchronized (members) {
            Participant existing = members.get(userId);
            if (existing == null) {
                return false;
            }
            Set<Permission> permissions = copyOf(existing.getPermissions());
            boolean changed = granted ? permissions.add(permission) : permissions.remove(permission);
            if (!changed) {
                return false;
            }
            updated = existing.toBuilder().permissions(permissions).build();
            members.put(userId, updated);
        }
        eventBus.publish(new ParticipantUpdatedEvent(sessionId, snapshot(sessionId, updated), updated.getRole()));
        return true;
    }

    private Participant withProfile(Participant candidate) {
        String placeholder = candidate.getName() != null ? candidate.getName() : candidate.getUserId();
        Participant.ParticipantBuilder builder = candidate.toBuilder()
                .name(placeholder)
                .displayName(candidate.getDisplayName() != null ? candidate.getDisplayName() : placeholder);
        try {
            Optional<UserProfile> profile = identityResolver.resolveProfile(candidate.getUserId());
            profile.ifPresent(p -> {
                if (p.getDisplayName() != null) {
                    builder.displayName(p.getDisplayName());
                }
                if (p.getAvatarUrl() != null) {
                    builder.avatarUrl(p.getAvatarUrl());
                }
            });
        } catch (RuntimeException e) {
            logger.warn("Profile lookup failed for {}, using placeholder name", candidate.getUserId(), e);
        }
        return builder.build();
    }

    // fills the liveness fields from the presence tracker
    private Participant snapshot(String sessionId, Participant p) {
        Optional<PresenceRecord> presence = presenceTracker.getPresence(sessionId, p.getUserId());
        return p.toBuilder()
                .permissions(Collections.unmodifiableSet(copyOf(p.getPermissions())))
                .online(presence.map(PresenceRecord::isOnline).orElse(false))
                .typing(presenceTracker.isTyping(sessionId, p.getUserId()))
                .lastSeen(presence.map(PresenceRecord::getLastActivity).orElse(p.getLastSeen()))
                .build();
    }

    private static Set<Permission> copyOf(Set<Permission> permissions) {
        return permissions == null || permissions.isEmpty() ? EnumSet.noneOf(Permission.class) : EnumSet.copyOf(permissions);
    }

    private Map<String, Participant> members(String sessionId) {
        return sessions.computeIfAbsent(sessionId, id -> new LinkedHashMap<>());
    }
}
