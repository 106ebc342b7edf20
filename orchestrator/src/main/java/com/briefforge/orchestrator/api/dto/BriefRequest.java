package com.briefforge.orchestrator.api.dto;

import com.briefforge.orchestrator.model.ProjectBrief;

import java.util.List;

/**
 * Request body for POST /briefs/decompose and POST /briefs/execute.
 *
 * Required: description
 * Optional: requirements, constraints (default to empty), timeline
 */
public record BriefRequest(String description,
                           List<String> requirements,
                           List<String> constraints,
                           String timeline) {

    public ProjectBrief toBrief() {
        return new ProjectBrief(description, requirements, constraints, timeline);
    }
}
