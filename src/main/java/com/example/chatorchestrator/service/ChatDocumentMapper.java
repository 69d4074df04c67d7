package com.example.chatorchestrator.service;

import com.example.chatorchestrator.model.*;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Maps the chat model to store documents and back. Timestamps are stored as {@link Date}.
 */
final class ChatDocumentMapper {

    private ChatDocumentMapper() {
    }

    static String participantKey(String sessionId, String userId) {
        return sessionId + "_" + userId;
    }

    static String userSessionKey(String userId, String sessionId) {
        return userId + "_" + sessionId;
    }

    static Map<String, Object> toSessionDocument(ChatSession session, List<String> participantIds, List<String> activeIds) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("id", session.getId());
        doc.put("name", session.getName());
        doc.put("mode", session.getMode().getValue());
        doc.put("hostUserId", session.getHostUserId());
        doc.put("agentId", session.getAgentId());
        doc.put("participantIds", participantIds);
        doc.put("participantCount", participantIds.size());
        doc.put("activeParticipants", activeIds);
        doc.put("createdAt", toDate(session.getCreatedAt()));
        doc.put("lastActivity", toDate(session.getLastActivity()));
        doc.put("metadata", toMetadataDocument(session.getMetadata()));
        doc.put("lastMessageId", session.getLastMessageId());
        doc.put("lastMessageTimestamp", toDate(session.getLastMessageTimestamp()));
        return doc;
    }

    static ChatSession toSession(Map<String, Object> doc) {
        SessionMetadata metadata = toMetadata(doc.get("metadata"));
        return ChatSession.builder()
                .id(string(doc.getOrDefault("id", doc.get("_id"))))
                .name(string(doc.get("name")))
                .mode(doc.get("mode") == null ? SessionMode.DIRECT : SessionMode.fromValue(string(doc.get("mode"))))
                .hostUserId(string(doc.get("hostUserId")))
                .agentId(string(doc.get("agentId")))
                .createdAt(toInstant(doc.get("createdAt")))
                .lastActivity(toInstant(doc.get("lastActivity")))
                .metadata(metadata)
                .lastMessageId(string(doc.get("lastMessageId")))
                .lastMessageTimestamp(toInstant(doc.get("lastMessageTimestamp")))
                .linkedSessionId(metadata.getLinkedSessionId())
                .build();
    }

    static Map<String, Object> toParticipantDocument(String sessionId, Participant p) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("sessionId", sessionId);
        doc.put("userId", p.getUserId());
        doc.put("name", p.getName());
        doc.put("displayName", p.getDisplayName());
        doc.put("avatar", p.getAvatarUrl());
        doc.put("role", p.getRole().getValue());
        doc.put("joinedAt", toDate(p.getJoinedAt()));
        doc.put("lastSeen", toDate(p.getLastSeen()));
        doc.put("isOnline", p.isOnline());
        doc.put("permissions", p.getPermissions() == null ? List.of()
                : p.getPermissions().stream().map(Permission::getValue).sorted().collect(Collectors.toList()));
        return doc;
    }

    static Participant toParticipant(Map<String, Object> doc) {
        Set<Permission> permissions = EnumSet.noneOf(Permission.class);
        for (String value : strings(doc.get("permissions"))) {
            permissions.add(Permission.fromValue(value));
        }
        return Participant.builder()
                .userId(string(doc.get("userId")))
                .name(string(doc.get("name")))
                .displayName(string(doc.get("displayName")))
                .avatarUrl(string(doc.get("avatar")))
                .role(doc.get("role") == null ? ParticipantRole.PARTICIPANT : ParticipantRole.fromValue(string(doc.get("role"))))
                .permissions(permissions)
                .joinedAt(toInstant(doc.get("joinedAt")))
                .lastSeen(toInstant(doc.get("lastSeen")))
                .build();
    }

    static Map<String, Object> toMessageDocument(ChatMessage m) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("id", m.getId());
        doc.put("sessionId", m.getSessionId());
        doc.put("senderId", m.getSenderId());
        doc.put("senderName", m.getSenderName());
        doc.put("content", m.getContent());
        doc.put("target", toTargetDocument(m.getTarget()));
        doc.put("attachments", m.getAttachments());
        doc.put("timestamp", toDate(m.getTimestamp()));
        doc.put("metadata", m.getMetadata());
        doc.putAll(toLedgerDocument(m));
        return doc;
    }

    static Map<String, Object> toLedgerDocument(ChatMessage m) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("recipients", m.hasResolvedRecipients() ? m.getRecipients() : null);
        doc.put("deliveredTo", m.getDeliveredTo());
        doc.put("readBy", m.getReadBy());
        doc.put("delivered", m.isDelivered());
        doc.put("read", m.isRead());
        doc.put("failedRecipients", new ArrayList<>(m.getFailedRecipients().keySet()));
        return doc;
    }

    @SuppressWarnings("unchecked")
    static ChatMessage toMessage(Map<String, Object> doc) {
        Object recipients = doc.get("recipients");
        Object metadata = doc.get("metadata");
        return ChatMessage.builder()
                .id(string(doc.getOrDefault("id", doc.get("_id"))))
                .sessionId(string(doc.get("sessionId")))
                .senderId(string(doc.get("senderId")))
                .senderName(string(doc.get("senderName")))
                .content(string(doc.get("content")))
                .target(toTarget(doc.get("target")))
                .attachments(strings(doc.get("attachments")))
                .timestamp(toInstant(doc.get("timestamp")))
                .metadata(metadata instanceof Map ? (Map<String, Object>) metadata : null)
                .recipients(recipients == null ? null : strings(recipients))
                .deliveredTo(strings(doc.get("deliveredTo")))
                .readBy(strings(doc.get("readBy")))
                .delivered(Boolean.TRUE.equals(doc.get("delivered")))
                .read(Boolean.TRUE.equals(doc.get("read")))
                .build();
    }

    static Map<String, Object> toThreadDocument(ChatThread thread) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("id", thread.getId());
        doc.put("sessionId", thread.getSessionId());
        doc.put("parentMessageId", thread.getParentMessageId());
        doc.put("title", thread.getTitle());
        doc.put("description", thread.getDescription());
        doc.put("createdBy", thread.getCreatedBy());
        doc.put("createdAt", toDate(thread.getCreatedAt()));
        doc.put("lastActivityAt", toDate(thread.getLastActivityAt()));
        doc.put("status", thread.getStatus().getValue());
        doc.put("participants", thread.getParticipants());
        doc.put("tags", thread.getTags());
        doc.put("messageCount", thread.getMessageCount());
        return doc;
    }

    static ChatThread toThread(Map<String, Object> doc) {
        Object count = doc.get("messageCount");
        return ChatThread.builder()
                .id(string(doc.getOrDefault("id", doc.get("_id"))))
                .sessionId(string(doc.get("sessionId")))
                .parentMessageId(string(doc.get("parentMessageId")))
                .title(string(doc.get("title")))
                .description(string(doc.get("description")))
                .createdBy(string(doc.get("createdBy")))
                .createdAt(toInstant(doc.get("createdAt")))
                .lastActivityAt(toInstant(doc.get("lastActivityAt")))
                .status(doc.get("status") == null ? ThreadStatus.ACTIVE : ThreadStatus.fromValue(string(doc.get("status"))))
                .participants(strings(doc.get("participants")))
                .tags(strings(doc.get("tags")))
                .messageCount(count instanceof Number ? ((Number) count).intValue() : 0)
                .build();
    }

    static Map<String, Object> toThreadMessageDocument(ThreadMessage m) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("id", m.getId());
        doc.put("threadId", m.getThreadId());
        doc.put("sessionId", m.getSessionId());
        doc.put("senderId", m.getSenderId());
        doc.put("senderName", m.getSenderName());
        doc.put("content", m.getContent());
        doc.put("attachments", m.getAttachments());
        doc.put("timestamp", toDate(m.getTimestamp()));
        return doc;
    }

    static ThreadMessage toThreadMessage(Map<String, Object> doc) {
        return ThreadMessage.builder()
                .id(string(doc.getOrDefault("id", doc.get("_id"))))
                .threadId(string(doc.get("threadId")))
                .sessionId(string(doc.get("sessionId")))
                .senderId(string(doc.get("senderId")))
                .senderName(string(doc.get("senderName")))
                .content(string(doc.get("content")))
                .attachments(strings(doc.get("attachments")))
                .timestamp(toInstant(doc.get("timestamp")))
                .build();
    }

    static Map<String, Object> toActivityDocument(ThreadActivity activity) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("id", activity.getId());
        doc.put("threadId", activity.getThreadId());
        doc.put("sessionId", activity.getSessionId());
        doc.put("userId", activity.getUserId());
        doc.put("type", activity.getType().getValue());
        doc.put("details", activity.getDetails());
        doc.put("timestamp", toDate(activity.getTimestamp()));
        return doc;
    }

    static ThreadActivity toActivity(Map<String, Object> doc) {
        return ThreadActivity.builder()
                .id(string(doc.getOrDefault("id", doc.get("_id"))))
                .threadId(string(doc.get("threadId")))
                .sessionId(string(doc.get("sessionId")))
                .userId(string(doc.get("userId")))
                .type(ThreadActivityType.fromValue(string(doc.get("type"))))
                .details(string(doc.get("details")))
                .timestamp(toInstant(doc.get("timestamp")))
                .build();
    }

    static Date toDate(Instant instant) {
        return instant == null ? null : Date.from(instant);
    }

    static Instant toInstant(Object value) {
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        if (value instanceof String) {
            return Instant.parse((String) value);
        }
        return null;
    }

    private static Map<String, Object> toMetadataDocument(SessionMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("isPrivate", metadata.isPrivate());
        doc.put("allowInvites", metadata.isAllowInvites());
        doc.put("linkedSessionId", metadata.getLinkedSessionId());
        return doc;
    }

    private static SessionMetadata toMetadata(Object value) {
        if (!(value instanceof Map)) {
            return SessionMetadata.builder().build();
        }
        Map<?, ?> doc = (Map<?, ?>) value;
        return SessionMetadata.builder()
                .isPrivate(Boolean.TRUE.equals(doc.get("isPrivate")))
                .allowInvites(!Boolean.FALSE.equals(doc.get("allowInvites")))
                .linkedSessionId(string(doc.get("linkedSessionId")))
                .build();
    }

    private static Map<String, Object> toTargetDocument(MessageTarget target) {
        if (target == null) {
            return null;
        }
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("type", target.getType() == null ? null : target.getType().getValue());
        doc.put("id", target.getId());
        doc.put("name", target.getName());
        return doc;
    }

    private static MessageTarget toTarget(Object value) {
        if (!(value instanceof Map)) {
            return null;
        }
        Map<?, ?> doc = (Map<?, ?>) value;
        return MessageTarget.builder()
                .type(doc.get("type") == null ? null : TargetType.fromValue(string(doc.get("type"))))
                .id(string(doc.get("id")))
                .name(string(doc.get("name")))
                .build();
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }

    private static List<String> strings(Object value) {
        if (!(value instanceof Collection)) {
            return new ArrayList<>();
        }
        List<String> out = new ArrayList<>();
        for (Object item : (Collection<?>) value) {
            if (item != null) {
                out.add(item.toString());
            }
        }
        return out;
    }
}
