package com.example.chatorchestrator.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SessionMetadata {
    private boolean isPrivate;
    @Builder.Default
    private boolean allowInvites = true;
    // pairs a shared session with its direct counterpart for hybrid delivery
    private String linkedSessionId;
}
