package com.example.chatorchestrator.model;

import lombok.*;

/**
 * Addressing rule of a message. A {@code null} target means "everyone".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageTarget {
    private TargetType type;
    private String id;
    private String name;

    public static MessageTarget all() {
        return MessageTarget.builder().type(TargetType.ALL).build();
    }

    public static MessageTarget user(String userId) {
        return MessageTarget.builder().type(TargetType.USER).id(userId).build();
    }

    public static MessageTarget agent(String agentId) {
        return MessageTarget.builder().type(TargetType.AGENT).id(agentId).build();
    }

    public static MessageTarget role(ParticipantRole role) {
        return MessageTarget.builder().type(TargetType.ROLE).id(role.getValue()).build();
    }
}
