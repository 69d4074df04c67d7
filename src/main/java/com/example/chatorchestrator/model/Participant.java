package com.example.chatorchestrator.model;

import lombok.*;

import java.time.Instant;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Participant {
    private String userId;
    private String name;
    private String displayName;
    private String avatarUrl;
    private ParticipantRole role;
    private Set<Permission> permissions;
    private Instant joinedAt;
    private Instant lastSeen;
    private boolean online;
    private boolean typing;

    public boolean isAgent() {
        return role == ParticipantRole.AGENT;
    }
}
