package com.example.chatorchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ParticipantRole {
    HOST("host"),
    PARTICIPANT("participant"),
    AGENT("agent"),
    OBSERVER("observer");

    private final String value;

    ParticipantRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ParticipantRole fromValue(String value) {
        return Arrays.stream(values())
                .filter(r -> r.value.equalsIgnoreCase(value) || r.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown participant role: " + value));
    }
}
