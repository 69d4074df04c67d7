package com.example.chatorchestrator.routing;

import com.example.chatorchestrator.config.ChatProperties;
import com.example.chatorchestrator.event.ChatEventBus;
import com.example.chatorchestrator.event.MessageDeliveredEvent;
import com.example.chatorchestrator.event.MessageReadEvent;
import com.example.chatorchestrator.event.ParticipantLeftEvent;
import com.example.chatorchestrator.event.PresenceChangedEvent;
import com.example.chatorchestrator.exception.NotFoundException;
import com.example.chatorchestrator.model.*;
import com.example.chatorchestrator.participant.ParticipantRegistry;
import com.example.chatorchestrator.presence.PresenceTracker;
import com.example.chatorchestrator.session.SessionModeListener;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

/**
 * Resolves the recipients of a message and delivers it through the channel that matches
 * the session's delivery mode.
 * <p>
 * Each recipient is delivered independently and bounded by the delivery timeout. Offline
 * participants are recorded as failures and queued; the queue of a user is flushed when the
 * user comes back online in that session. A user target outside the session is recorded as
 * failed and never queued.
 * <p>
 * Only the most recently used messages stay indexed in memory, plus those still waiting in
 * a queue. Anything else is read back from the store by the caller.
 */
@Component
public class MessageRouter implements SessionModeListener {

    private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);

    static final String OFFLINE = "Recipient offline, queued for delivery";
    static final String NOT_A_PARTICIPANT = "Recipient is not a participant of the session";

    private final ParticipantRegistry registry;
    private final PresenceTracker presenceTracker;
    private final ChatEventBus eventBus;
    private final ChatProperties properties;
    private final Map<DeliveryMode.Kind, DeliveryChannel> channels = new EnumMap<>(DeliveryMode.Kind.class);
    private final Map<String, DeliveryMode> deliveryModes = new ConcurrentHashMap<>();
    private final Map<String, ChatMessage> messages;
    private final Map<String, ChatMessage> awaiting = new ConcurrentHashMap<>();
    private final Map<SessionUserKey, Set<String>> pending = new ConcurrentHashMap<>();
    private final List<Disposable> subscriptions = new ArrayList<>();

    public MessageRouter(ParticipantRegistry registry, PresenceTracker presenceTracker, ChatEventBus eventBus,
                         ChatProperties properties, List<DeliveryChannel> deliveryChannels) {
        this.registry = registry;
        this.presenceTracker = presenceTracker;
        this.eventBus = eventBus;
        this.properties = properties;
        this.messages = Collections.synchronizedMap(new LinkedHashMap<String, ChatMessage>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ChatMessage> eldest) {
                return size() > properties.getMessageIndexSize();
            }
        });
        for (DeliveryChannel channel : deliveryChannels) {
            channels.put(channel.kind(), channel);
        }
        subscriptions.add(eventBus.subscribe(PresenceChangedEvent.class, event -> {
            if (event.isOnline()) {
                flushPending(event.getSessionId(), event.getUserId());
            }
        }));
        subscriptions.add(eventBus.subscribe(ParticipantLeftEvent.class, event -> {
            Set<String> dropped = pending.remove(SessionUserKey.of(event.getSessionId(), event.getUserId()));
            if (dropped != null) {
                releaseAwaiting(snapshot(dropped));
            }
        }));
    }

    /**
     * Delivers the message to its recipients. Partial failure is reported in the result,
     * never thrown. The recipient set is resolved on the first call and kept afterwards.
     */
    public DeliveryResult route(ChatMessage message, ChatSession session) {
        String sessionId = session.getId();
        if (!message.hasResolvedRecipients()) {
            message.resolveRecipients(resolveRecipients(message, sessionId));
        }
        messages.put(message.getId(), message);
        DeliveryMode mode = deliveryModes.computeIfAbsent(sessionId, id -> session.getDeliveryMode());

        List<String> delivered = new ArrayList<>();
        List<FailedDelivery> failures = new ArrayList<>();
        Map<String, CompletableFuture<Void>> inFlight = new LinkedHashMap<>();
        for (String recipient : message.getRecipients()) {
            if (message.isDeliveredTo(recipient)) {
                delivered.add(recipient);
            } else if (!isReachable(sessionId, recipient, message.getTarget())) {
                if (registry.contains(sessionId, recipient)) {
                    message.recordFailure(recipient, OFFLINE);
                    failures.add(new FailedDelivery(recipient, OFFLINE));
                    enqueue(sessionId, recipient, message);
                } else {
                    message.recordFailure(recipient, NOT_A_PARTICIPANT);
                    failures.add(new FailedDelivery(recipient, NOT_A_PARTICIPANT));
                }
            } else {
                inFlight.put(recipient, dispatch(mode, message, recipient));
            }
        }

        long deadline = System.nanoTime() + properties.getDeliveryTimeout().toNanos();
        inFlight.forEach((recipient, future) -> {
            String error = await(future, deadline);
            if (error == null) {
                message.recordDelivery(recipient);
                delivered.add(recipient);
            } else {
                logger.warn("Delivery of {} to {} failed: {}", message.getId(), recipient, error);
                message.recordFailure(recipient, error);
                failures.add(new FailedDelivery(recipient, error));
            }
        });
        message.settleDeliveredFlag();

        DeliveryResult result = new DeliveryResult(message.getId(), delivered, failures);
        message.putMetadata("deliveryStatus", result.getStatus().name());
        message.putMetadata("failedRecipients", failures.stream().map(FailedDelivery::getUserId).collect(Collectors.toList()));
        logger.debug("Routed {} in {} mode: {} delivered, {} failed",
                message.getId(), mode.getKind(), delivered.size(), failures.size());
        eventBus.publish(new MessageDeliveredEvent(sessionId, message.getId(), result));
        return result;
    }

    /**
     * Adds the reader to the message's read ledger.
     *
     * @return {@code false} if the user had already read the message
     */
    public boolean markAsRead(String messageId, String userId) {
        ChatMessage message = find(messageId).orElseThrow(() -> new NotFoundException("Message", messageId));
        boolean added = message.recordRead(userId);
        if (added) {
            eventBus.publish(new MessageReadEvent(message.getSessionId(), messageId, userId));
        }
        return added;
    }

    /**
     * Re-dispatches queued messages to a user who came online. Only moves recipients
     * forward in the ledger; failures are queued again.
     */
    public void flushPending(String sessionId, String userId) {
        SessionUserKey key = SessionUserKey.of(sessionId, userId);
        Set<String> queued = pending.remove(key);
        if (queued == null || queued.isEmpty()) {
            return;
        }
        DeliveryMode mode = deliveryModes.getOrDefault(sessionId, DeliveryMode.direct());
        logger.debug("Flushing {} queued messages to {} in session {}", queued.size(), userId, sessionId);
        long deadline = System.nanoTime() + properties.getDeliveryTimeout().toNanos();
        for (String messageId : snapshot(queued)) {
            ChatMessage message = awaiting.get(messageId);
            if (message == null || message.isDeliveredTo(userId)) {
                continue;
            }
            String error = await(dispatch(mode, message, userId), deadline);
            if (error == null) {
                message.recordDelivery(userId);
                message.putMetadata("failedRecipients", new ArrayList<>(message.getFailedRecipients().keySet()));
                message.putMetadata("deliveryStatus", message.isDelivered()
                        ? DeliveryResult.Status.DELIVERED.name() : DeliveryResult.Status.PARTIAL_FAILURE.name());
                eventBus.publish(new MessageDeliveredEvent(sessionId, messageId,
                        new DeliveryResult(messageId, List.of(userId), List.of())));
            } else {
                logger.warn("Late delivery of {} to {} failed: {}", messageId, userId, error);
                message.recordFailure(userId, error);
                enqueue(sessionId, userId, message);
            }
        }
        releaseAwaiting(snapshot(queued));
    }

    public Optional<ChatMessage> find(String messageId) {
        ChatMessage queued = awaiting.get(messageId);
        return queued != null ? Optional.of(queued) : Optional.ofNullable(messages.get(messageId));
    }

    /**
     * Makes a message read back from the store known to the router. A resident instance wins.
     */
    public ChatMessage index(ChatMessage message) {
        ChatMessage queued = awaiting.get(message.getId());
        if (queued != null) {
            return queued;
        }
        ChatMessage existing = messages.putIfAbsent(message.getId(), message);
        return existing != null ? existing : message;
    }

    public int indexedCount() {
        return messages.size();
    }

    public List<String> pendingFor(String sessionId, String userId) {
        Set<String> queued = pending.get(SessionUserKey.of(sessionId, userId));
        return queued == null ? List.of() : snapshot(queued);
    }

    public Optional<DeliveryMode> deliveryMode(String sessionId) {
        return Optional.ofNullable(deliveryModes.get(sessionId));
    }

    @Override
    public void onSessionModeChanged(String sessionId, SessionMode mode, DeliveryMode deliveryMode) {
        deliveryModes.put(sessionId, deliveryMode);
    }

    public void evict(String sessionId) {
        deliveryModes.remove(sessionId);
        synchronized (messages) {
            messages.values().removeIf(m -> sessionId.equals(m.getSessionId()));
        }
        awaiting.values().removeIf(m -> sessionId.equals(m.getSessionId()));
        pending.keySet().removeIf(key -> key.getSessionId().equals(sessionId));
    }

    @PreDestroy
    public void shutdown() {
        subscriptions.forEach(Disposable::dispose);
    }

    /**
     * Recipients of the message, first matching rule wins: everyone but the sender, the
     * named user or agent, or every holder of the named role but the sender.
     *
     * @throws IllegalArgumentException for a user or agent target without an id, or an unknown role
     */
    public List<String> resolveRecipients(ChatMessage message, String sessionId) {
        MessageTarget target = message.getTarget();
        String senderId = message.getSenderId();
        if (target == null || target.getType() == null || target.getType() == TargetType.ALL) {
            return registry.list(sessionId).stream()
                    .map(Participant::getUserId)
                    .filter(id -> !id.equals(senderId))
                    .collect(Collectors.toList());
        }
        switch (target.getType()) {
            case USER:
            case AGENT:
                if (target.getId() == null || target.getId().isBlank()) {
                    throw new IllegalArgumentException("Target " + target.getType().getValue() + " requires an id");
                }
                return List.of(target.getId());
            case ROLE:
                ParticipantRole role = ParticipantRole.fromValue(target.getId());
                return registry.list(sessionId).stream()
                        .filter(p -> p.getRole() == role)
                        .map(Participant::getUserId)
                        .filter(id -> !id.equals(senderId))
                        .collect(Collectors.toList());
            default:
                throw new IllegalArgumentException("Unsupported target type: " + target.getType());
        }
    }

    // agents are service endpoints and always reachable
    private boolean isReachable(String sessionId, String userId, MessageTarget target) {
        if (target != null && target.getType() == TargetType.AGENT && userId.equals(target.getId())) {
            return true;
        }
        boolean agent = registry.get(sessionId, userId).map(Participant::isAgent).orElse(false);
        return agent || presenceTracker.isOnline(sessionId, userId);
    }

    private CompletableFuture<Void> dispatch(DeliveryMode mode, ChatMessage message, String recipient) {
        DeliveryChannel channel = channels.get(mode.getKind());
        if (channel == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No delivery channel for " + mode.getKind()));
        }
        try {
            return channel.deliver(mode, message, recipient);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * @return {@code null} on success, otherwise the failure description
     */
    private static String await(CompletableFuture<Void> future, long deadlineNanos) {
        try {
            future.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
            return null;
        } catch (TimeoutException e) {
            future.cancel(true);
            return "Delivery timed out";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause == null) {
                return "Delivery failed";
            }
            return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "Delivery interrupted";
        }
    }

    private void enqueue(String sessionId, String userId, ChatMessage message) {
        awaiting.put(message.getId(), message);
        Set<String> queued = pending.computeIfAbsent(SessionUserKey.of(sessionId, userId),
                k -> Collections.synchronizedSet(new LinkedHashSet<>()));
        queued.add(message.getId());
    }

    // a message leaves the awaiting set once no queue references it
    private void releaseAwaiting(Collection<String> messageIds) {
        for (String messageId : messageIds) {
            boolean stillQueued = pending.values().stream().anyMatch(queue -> queue.contains(messageId));
            if (!stillQueued) {
                awaiting.remove(messageId);
            }
        }
    }

    private static List<String> snapshot(Set<String> queued) {
        synchronized (queued) {
            return new ArrayList<>(queued);
        }
    }
}
