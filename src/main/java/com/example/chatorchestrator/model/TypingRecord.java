package com.example.chatorchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TypingRecord {
    String sessionId;
    String userId;
    boolean isTyping;
    Instant lastActivity;
    Instant expiresAt;
}
