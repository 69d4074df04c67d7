package com.example.chatorchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum SessionMode {
    DIRECT("direct"),
    SHARED("shared");

    private final String value;

    SessionMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SessionMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(m -> m.value.equalsIgnoreCase(value) || m.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown session mode: " + value));
    }
}
