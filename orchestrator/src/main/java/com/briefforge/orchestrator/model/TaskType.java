package com.briefforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which synthesizer group a task is routed to.
 *
 * There is no "both": a task belongs to exactly one group.
 */
public enum TaskType {
    FRONTEND,
    BACKEND;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /** Lenient parse: anything other than "frontend" is a backend task. */
    @JsonCreator
    public static TaskType fromWire(String value) {
        return "frontend".equalsIgnoreCase(value == null ? "" : value.strip()) ? FRONTEND : BACKEND;
    }
}
