package com.example.chatorchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PresenceRecord {
    String sessionId;
    String userId;
    boolean online;
    Instant lastActivity;
    Instant expiresAt;
    SessionMode sessionMode;
}
