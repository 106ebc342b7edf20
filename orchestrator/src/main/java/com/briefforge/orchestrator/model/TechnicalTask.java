package com.briefforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One unit of work produced by decomposition.
 *
 * Read-only for every synthesizer: the same task always yields the same
 * artifacts. estimatedHours is null when the source did not provide one.
 */
public record TechnicalTask(
        String        id,
        String        title,
        String        description,
        TaskType      type,
        TaskPriority  priority,
        @JsonProperty("acceptance_criteria") List<String> acceptanceCriteria,
        @JsonProperty("estimated_hours")     Integer      estimatedHours,
        List<String>  dependencies
) {
    public TechnicalTask {
        acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
        dependencies       = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static TechnicalTask of(String id, String title, String description,
                                   TaskType type, TaskPriority priority,
                                   List<String> acceptanceCriteria, Integer estimatedHours) {
        return new TechnicalTask(id, title, description, type, priority,
                acceptanceCriteria, estimatedHours, List.of());
    }
}
