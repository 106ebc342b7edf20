package com.briefforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category attached to every generated artifact.
 */
public enum FileType {
    API,
    SCHEMA,
    CONFIG,
    COMPONENT,
    OTHER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
