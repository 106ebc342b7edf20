package com.briefforge.orchestrator.decomposition;

import com.briefforge.orchestrator.model.DecompositionSource;
import com.briefforge.orchestrator.model.ProjectBrief;
import com.briefforge.orchestrator.model.TechnicalTask;

import java.util.List;

/**
 * Turns a brief into an ordered list of technical tasks.
 */
public interface TaskDecomposer {

    /**
     * @throws com.briefforge.orchestrator.reasoning.ReasoningException when a
     *         remote decomposer cannot produce tasks; the rule-based one never throws
     */
    List<TechnicalTask> decompose(ProjectBrief brief);

    /** Which path this decomposer represents in results and metrics. */
    DecompositionSource source();
}
