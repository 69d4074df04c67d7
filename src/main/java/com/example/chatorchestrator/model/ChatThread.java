package com.example.chatorchestrator.model;

import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A side conversation hanging off one message of a session.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ChatThread {
    private String id;
    private String sessionId;
    private String parentMessageId;
    private String title;
    private String description;
    private String createdBy;
    private Instant createdAt;
    private Instant lastActivityAt;
    @Builder.Default
    private ThreadStatus status = ThreadStatus.ACTIVE;
    @Builder.Default
    private List<String> participants = new ArrayList<>();
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    private int messageCount;

    public ChatThread copy() {
        return toBuilder()
                .participants(new ArrayList<>(participants))
                .tags(new ArrayList<>(tags))
                .build();
    }
}
