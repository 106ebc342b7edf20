package com.briefforge.orchestrator.synthesis.logic;

import java.util.List;

/**
 * The workflow families the business-logic synthesizer can emit, in output
 * order. Each family is one service artifact.
 */
public enum WorkflowFamily {
    TASK_LIFECYCLE("src/services/taskService.ts",         List.of("task", "todo", "item")),
    SHARING       ("src/services/sharingService.ts",      List.of("share", "collab", "team")),
    NOTIFICATION  ("src/services/notificationService.ts", List.of("notif", "alert", "reminder")),
    COMMENTS      ("src/services/commentService.ts",      List.of("comment", "discuss", "feedback")),
    ATTACHMENTS   ("src/services/fileService.ts",         List.of("file", "attachment", "upload"));

    private final String       path;
    private final List<String> keywords;

    WorkflowFamily(String path, List<String> keywords) {
        this.path     = path;
        this.keywords = keywords;
    }

    public String path()           { return path; }
    public List<String> keywords() { return keywords; }

    /** Families whose artifacts this family's artifact imports. */
    public List<WorkflowFamily> requires() {
        return switch (this) {
            case TASK_LIFECYCLE, SHARING -> List.of(NOTIFICATION);
            case NOTIFICATION            -> List.of();
            case COMMENTS                -> List.of(SHARING, NOTIFICATION);
            case ATTACHMENTS             -> List.of(SHARING);
        };
    }

    String source() {
        return switch (this) {
            case TASK_LIFECYCLE -> TaskServiceTemplate.SOURCE;
            case SHARING        -> SharingServiceTemplate.SOURCE;
            case NOTIFICATION   -> NotificationServiceTemplate.SOURCE;
            case COMMENTS       -> CommentServiceTemplate.SOURCE;
            case ATTACHMENTS    -> FileServiceTemplate.SOURCE;
        };
    }
}
