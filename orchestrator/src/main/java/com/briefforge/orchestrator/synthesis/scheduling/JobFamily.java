package com.briefforge.orchestrator.synthesis.scheduling;

import java.util.List;

/**
 * Groups of recurring jobs. A family is emitted when any of its keywords
 * occurs in the task text and scheduling was triggered at all.
 */
public enum JobFamily {
    NOTIFICATION("notificationJobs", "NotificationJobs", List.of("email", "notification", "reminder")),
    CLEANUP     ("cleanupJobs",      "CleanupJobs",      List.of("cleanup", "delete", "archive")),
    REPORT      ("reportJobs",       "ReportJobs",       List.of("report", "analytics", "summary")),
    BACKUP      ("backupJobs",       "BackupJobs",       List.of("backup", "export"));

    private final String       module;
    private final String       typeName;
    private final List<String> keywords;

    JobFamily(String module, String typeName, List<String> keywords) {
        this.module   = module;
        this.typeName = typeName;
        this.keywords = keywords;
    }

    /** Module and handler-object name, e.g. "notificationJobs". */
    public String module()         { return module; }
    /** Exported TypeScript interface of the handler object. */
    public String typeName()       { return typeName; }
    public List<String> keywords() { return keywords; }

    public String path() {
        return "src/jobs/" + module + ".ts";
    }
}
