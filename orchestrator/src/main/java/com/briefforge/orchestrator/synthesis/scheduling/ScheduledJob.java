package com.briefforge.orchestrator.synthesis.scheduling;

import java.util.List;

/**
 * A recurring job registered by the generated scheduler.
 *
 * @param name             unique job name, also the manual-trigger key
 * @param cronExpression   five-field cron cadence
 * @param description      human-readable purpose
 * @param handlerReference "module.method" of the handler, e.g. "notificationJobs.sendDailyReminders"
 * @param family           family whose artifact defines the handler
 */
public record ScheduledJob(String name,
                           String cronExpression,
                           String description,
                           String handlerReference,
                           JobFamily family) {

    public static final List<ScheduledJob> CATALOG = List.of(
            new ScheduledJob("daily-reminders",          "0 9 * * *",   "Send daily task reminders",
                    "notificationJobs.sendDailyReminders",   JobFamily.NOTIFICATION),
            new ScheduledJob("overdue-alerts",           "0 */4 * * *", "Send overdue task alerts",
                    "notificationJobs.sendOverdueAlerts",    JobFamily.NOTIFICATION),
            new ScheduledJob("cleanup-completed-tasks",  "0 0 * * 0",   "Clean up old completed tasks",
                    "cleanupJobs.cleanupCompletedTasks",     JobFamily.CLEANUP),
            new ScheduledJob("cleanup-expired-sessions", "0 */6 * * *", "Clean up expired user sessions",
                    "cleanupJobs.cleanupExpiredSessions",    JobFamily.CLEANUP),
            new ScheduledJob("weekly-reports",           "0 8 * * 1",   "Generate weekly productivity reports",
                    "reportJobs.generateWeeklyReports",      JobFamily.REPORT),
            new ScheduledJob("monthly-analytics",        "0 9 1 * *",   "Generate monthly analytics",
                    "reportJobs.generateMonthlyAnalytics",   JobFamily.REPORT),
            new ScheduledJob("daily-backup",             "0 2 * * *",   "Perform daily database backup",
                    "backupJobs.performDailyBackup",         JobFamily.BACKUP)
    );

    public ScheduledJob {
        if (!handlerReference.startsWith(family.module() + ".")) {
            throw new IllegalArgumentException(
                    "Handler '" + handlerReference + "' does not belong to " + family.module());
        }
        if (cronExpression.strip().split("\\s+").length != 5) {
            throw new IllegalArgumentException("Expected a five-field cron expression: " + cronExpression);
        }
    }

    /** Method part of the handler reference. */
    public String handlerMethod() {
        return handlerReference.substring(handlerReference.indexOf('.') + 1);
    }
}
