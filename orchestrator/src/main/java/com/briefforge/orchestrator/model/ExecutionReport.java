package com.briefforge.orchestrator.model;

import java.util.List;

/**
 * Result of {@code BriefCoordinator.execute}.
 *
 * results holds exactly one entry per task, in task order. artifacts is the
 * merged file set of all successful tasks with unique paths.
 */
public record ExecutionReport(List<AgentResponse> results,
                              String summary,
                              String insights,
                              String analysis,
                              DecompositionSource source,
                              List<GeneratedFile> artifacts) {

    public ExecutionReport {
        results   = List.copyOf(results);
        artifacts = List.copyOf(artifacts);
    }
}
