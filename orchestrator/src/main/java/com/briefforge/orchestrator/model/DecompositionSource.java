package com.briefforge.orchestrator.model;

/**
 * Where the task list of a brief came from.
 *
 * A brief is never mixed: once the reasoning service fails, every task
 * of that brief comes from the rule-based decomposer.
 */
public enum DecompositionSource {
    REASONING_SERVICE,  // Tasks parsed from the external reasoning service reply
    FALLBACK            // Tasks produced by the keyword rules, no I/O
}
