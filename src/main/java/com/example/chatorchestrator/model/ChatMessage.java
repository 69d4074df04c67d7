package com.example.chatorchestrator.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.*;

/**
 * A chat message together with its per-recipient delivery and read ledger.
 * <p>
 * The recipient set is fixed the first time it is resolved. The ledger only moves
 * forward: {@code undelivered -> delivered} and {@code unread -> read}.
 */
@Getter
@ToString
public class ChatMessage {

    private final String id;
    private final String sessionId;
    private final String senderId;
    private final String senderName;
    private final String content;
    private final MessageTarget target;
    private final List<String> attachments;
    private final Instant timestamp;
    private final Map<String, Object> metadata;

    @Getter(lombok.AccessLevel.NONE)
    private List<String> recipients;
    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> deliveredTo = new LinkedHashSet<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> readBy = new LinkedHashSet<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, String> failedRecipients = new LinkedHashMap<>();
    private boolean delivered;
    private boolean read;

    @Builder
    private ChatMessage(String id, String sessionId, String senderId, String senderName, String content,
                        MessageTarget target, List<String> attachments, Instant timestamp,
                        Map<String, Object> metadata, List<String> recipients,
                        Collection<String> deliveredTo, Collection<String> readBy,
                        boolean delivered, boolean read) {
        this.id = id;
        this.sessionId = sessionId;
        this.senderId = senderId;
        this.senderName = senderName;
        this.content = content;
        this.target = target;
        this.attachments = attachments == null ? List.of() : List.copyOf(attachments);
        this.timestamp = timestamp;
        this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
        this.recipients = recipients == null ? null : List.copyOf(recipients);
        if (deliveredTo != null) {
            this.deliveredTo.addAll(deliveredTo);
        }
        if (readBy != null) {
            this.readBy.addAll(readBy);
        }
        this.delivered = delivered;
        this.read = read || !this.readBy.isEmpty();
    }

    public synchronized boolean hasResolvedRecipients() {
        return recipients != null;
    }

    public synchronized List<String> getRecipients() {
        return recipients == null ? List.of() : recipients;
    }

    /**
     * Fixes the recipient set. Resolving a second time is a programming error.
     */
    public synchronized void resolveRecipients(Collection<String> resolved) {
        if (recipients != null) {
            throw new IllegalStateException("Recipients of message " + id + " are already resolved");
        }
        recipients = List.copyOf(new LinkedHashSet<>(resolved));
    }

    public synchronized List<String> getDeliveredTo() {
        return List.copyOf(deliveredTo);
    }

    public synchronized List<String> getReadBy() {
        return List.copyOf(readBy);
    }

    public synchronized Map<String, String> getFailedRecipients() {
        return Map.copyOf(failedRecipients);
    }

    public synchronized boolean isDelivered() {
        return delivered;
    }

    public synchronized boolean isRead() {
        return read;
    }

    public synchronized Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public synchronized void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    public synchronized boolean isDeliveredTo(String userId) {
        return deliveredTo.contains(userId);
    }

    /**
     * @return {@code true} if the recipient was not yet in the delivery ledger
     */
    public synchronized boolean recordDelivery(String userId) {
        failedRecipients.remove(userId);
        boolean added = deliveredTo.add(userId);
        settleDeliveredFlag();
        return added;
    }

    public synchronized void recordFailure(String userId, String error) {
        if (!deliveredTo.contains(userId)) {
            failedRecipients.put(userId, error);
        }
    }

    /**
     * @return {@code true} if the reader was not yet in the read ledger
     */
    public synchronized boolean recordRead(String userId) {
        boolean added = readBy.add(userId);
        if (added) {
            read = true;
        }
        return added;
    }

    /**
     * Sets {@code delivered} once no recipient is left failing. Never clears it.
     */
    public synchronized void settleDeliveredFlag() {
        if (!delivered && recipients != null && failedRecipients.isEmpty()) {
            delivered = true;
        }
    }
}
