package com.briefforge.orchestrator.service;

/**
 * A task is missing a field required for routing (title, description or type).
 *
 * Never escapes the coordinator: it becomes a failed response for that task.
 */
public class TaskValidationException extends RuntimeException {

    private final String taskId;

    public TaskValidationException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public String taskId() { return taskId; }
}
