package com.briefforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /** Unknown or missing values default to MEDIUM. */
    @JsonCreator
    public static TaskPriority fromWire(String value) {
        if (value == null) return MEDIUM;
        return switch (value.strip().toLowerCase()) {
            case "low"  -> LOW;
            case "high" -> HIGH;
            default     -> MEDIUM;
        };
    }
}
