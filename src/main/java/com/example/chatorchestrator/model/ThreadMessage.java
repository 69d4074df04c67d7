package com.example.chatorchestrator.model;

import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ThreadMessage {
    private String id;
    private String threadId;
    private String sessionId;
    private String senderId;
    private String senderName;
    private String content;
    @Builder.Default
    private List<String> attachments = new ArrayList<>();
    private Instant timestamp;
}
