package com.briefforge.orchestrator.model;

import java.util.List;

/**
 * Result of {@code BriefCoordinator.decompose}: the task list plus the
 * human-readable plan and analysis built from it.
 */
public record DecompositionResult(List<TechnicalTask> tasks,
                                  String plan,
                                  String analysis,
                                  DecompositionSource source) {

    public DecompositionResult {
        tasks = List.copyOf(tasks);
    }

    public boolean usedFallback() {
        return source == DecompositionSource.FALLBACK;
    }
}
