package com.example.chatorchestrator.model;

import lombok.Value;

/**
 * Composite key of per-user state inside one session.
 */
@Value(staticConstructor = "of")
public class SessionUserKey {
    String sessionId;
    String userId;
}
