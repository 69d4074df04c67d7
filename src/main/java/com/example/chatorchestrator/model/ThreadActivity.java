package com.example.chatorchestrator.model;

import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ThreadActivity {
    private String id;
    private String threadId;
    private String sessionId;
    private String userId;
    private ThreadActivityType type;
    private String details;
    private Instant timestamp;
}
