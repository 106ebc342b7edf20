package com.briefforge.orchestrator.model;

import java.util.List;

/**
 * Outcome of running one task through its synthesizer group.
 *
 * error is null on success; files is empty (never null) on failure.
 */
public record AgentResponse(String taskId,
                            boolean success,
                            String output,
                            List<GeneratedFile> files,
                            String error) {

    public AgentResponse {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static AgentResponse succeeded(String taskId, String output, List<GeneratedFile> files) {
        return new AgentResponse(taskId, true, output, files, null);
    }

    public static AgentResponse failed(String taskId, String error) {
        return new AgentResponse(taskId, false, "", List.of(), error);
    }
}
