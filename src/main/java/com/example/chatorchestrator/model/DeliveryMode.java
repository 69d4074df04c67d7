package com.example.chatorchestrator.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * How messages of a session reach their recipients: a single-thread direct path,
 * a shared fan-out write, or a fan-out write mirrored into a linked direct session.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DeliveryMode {

    public enum Kind { DIRECT, SHARED, HYBRID }

    private static final DeliveryMode DIRECT = new DeliveryMode(Kind.DIRECT, null);
    private static final DeliveryMode SHARED = new DeliveryMode(Kind.SHARED, null);

    private final Kind kind;
    private final String linkedSessionId;

    private DeliveryMode(Kind kind, String linkedSessionId) {
        this.kind = kind;
        this.linkedSessionId = linkedSessionId;
    }

    public static DeliveryMode direct() {
        return DIRECT;
    }

    public static DeliveryMode shared() {
        return SHARED;
    }

    public static DeliveryMode hybridLinkedTo(String linkedSessionId) {
        if (linkedSessionId == null || linkedSessionId.isBlank()) {
            throw new IllegalArgumentException("Hybrid delivery requires a linked session id");
        }
        return new DeliveryMode(Kind.HYBRID, linkedSessionId);
    }

    /**
     * Resolves the delivery variant for a session mode. The linked session id is fixed
     * when the session is created, so only the mode varies over the session's life.
     */
    public static DeliveryMode resolve(SessionMode mode, String linkedSessionId) {
        if (mode == SessionMode.DIRECT) {
            return DIRECT;
        }
        return linkedSessionId != null && !linkedSessionId.isBlank() ? hybridLinkedTo(linkedSessionId) : SHARED;
    }
}
