package com.example.chatorchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum Permission {
    READ("read"),
    WRITE("write"),
    INVITE("invite"),
    MODERATE("moderate");

    /** Granted to the host of every session. */
    public static final Set<Permission> FULL = Collections.unmodifiableSet(EnumSet.allOf(Permission.class));

    /** Granted to participants and agents added without an explicit permission set. */
    public static final Set<Permission> DEFAULT = Collections.unmodifiableSet(EnumSet.of(READ, WRITE));

    private final String value;

    Permission(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Permission fromValue(String value) {
        return Arrays.stream(values())
                .filter(p -> p.value.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown permission: " + value));
    }

    public static Set<Permission> defaultsFor(ParticipantRole role) {
        switch (role) {
            case HOST:
                return FULL;
            case OBSERVER:
                return Collections.unmodifiableSet(EnumSet.of(READ));
            default:
                return DEFAULT;
        }
    }
}
