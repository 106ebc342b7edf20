package com.briefforge.orchestrator.synthesis;

import com.briefforge.orchestrator.model.TaskType;

/**
 * Static metadata describing a synthesizer.
 *
 * @param name        unique identifier, e.g. "schema"
 * @param group       task type this synthesizer serves
 * @param order       position within its group; lower runs first
 * @param description one-line summary, used in logs
 */
public record SynthesizerManifest(String name, TaskType group, int order, String description) {}
