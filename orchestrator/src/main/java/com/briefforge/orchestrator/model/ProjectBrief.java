package com.briefforge.orchestrator.model;

import java.util.List;

/**
 * Free-text project brief submitted by a user.
 *
 * Created once per request and never persisted. Null lists are normalised
 * to empty lists so downstream code never has to null-check them.
 */
public record ProjectBrief(String description,
                           List<String> requirements,
                           List<String> constraints,
                           String timeline) {

    public ProjectBrief {
        description  = description == null ? "" : description;
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        constraints  = constraints == null ? List.of() : List.copyOf(constraints);
    }

    public static ProjectBrief of(String description) {
        return new ProjectBrief(description, List.of(), List.of(), null);
    }
}
