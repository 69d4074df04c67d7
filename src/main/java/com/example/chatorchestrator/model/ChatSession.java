package com.example.chatorchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ChatSession {
    private String id;
    private String name;
    private SessionMode mode;
    private String hostUserId;
    private String agentId;
    private Instant createdAt;
    private Instant lastActivity;
    private SessionMetadata metadata;
    @Builder.Default
    private List<Participant> participants = new ArrayList<>();
    private String lastMessageId;
    private Instant lastMessageTimestamp;

    // captured from metadata at creation, later metadata edits do not re-link
    private String linkedSessionId;

    @JsonIgnore
    public DeliveryMode getDeliveryMode() {
        return DeliveryMode.resolve(mode, linkedSessionId);
    }
}
