package com.briefforge.orchestrator.synthesis.scheduling;

/**
 * Static job-family, queue and type artifacts. The scheduler itself is
 * rendered by {@link SchedulingSynthesizer} because its contents depend on
 * which families matched.
 */
final class JobTemplates {

    private JobTemplates() {}

    static String familySource(JobFamily family) {
        return switch (family) {
            case NOTIFICATION -> NOTIFICATION_JOBS;
            case CLEANUP      -> CLEANUP_JOBS;
            case REPORT       -> REPORT_JOBS;
            case BACKUP       -> BACKUP_JOBS;
        };
    }

    // ------------------------------------------------------------------
    // Family handlers
    // ------------------------------------------------------------------

    static final String NOTIFICATION_JOBS = """
            import { EmailJob } from '../types/jobs';

            /** Reminder and overdue-alert jobs. */

            export interface DueTask {
              id: string;
              title: string;
              userId: string;
              dueDate: Date;
            }

            export interface NotificationJobDeps {
              findTasksDueBetween(from: Date, to: Date): Promise<DueTask[]>;
              findOverdueTasks(now: Date): Promise<DueTask[]>;
              findUsers(ids: string[]): Promise<Array<{ id: string; name: string; email: string }>>;
              enqueueEmail(job: EmailJob): Promise<void>;
            }

            export interface NotificationJobs {
              sendDailyReminders(): Promise<void>;
              sendOverdueAlerts(): Promise<void>;
            }

            function groupByUser(tasks: DueTask[]): Map<string, DueTask[]> {
              const byUser = new Map<string, DueTask[]>();
              for (const task of tasks) {
                const list = byUser.get(task.userId) ?? [];
                list.push(task);
                byUser.set(task.userId, list);
              }
              return byUser;
            }

            function renderTaskList(tasks: DueTask[]): string {
              return tasks
                .map(t => `<li><strong>${t.title}</strong> (due ${new Date(t.dueDate).toLocaleDateString()})</li>`)
                .join('');
            }

            export function createNotificationJobs(deps: NotificationJobDeps): NotificationJobs {
              async function emailEachUser(tasks: DueTask[], subject: (count: number) => string, intro: string): Promise<number> {
                const byUser = groupByUser(tasks);
                const users = await deps.findUsers(Array.from(byUser.keys()));
                let sent = 0;
                for (const user of users) {
                  const userTasks = byUser.get(user.id) ?? [];
                  if (userTasks.length === 0) continue;
                  await deps.enqueueEmail({
                    to: user.email,
                    subject: subject(userTasks.length),
                    html: `<p>Hi ${user.name},</p><p>${intro}</p><ul>${renderTaskList(userTasks)}</ul>`,
                    priority: 'normal'
                  });
                  sent++;
                }
                return sent;
              }

              return {
                async sendDailyReminders(): Promise<void> {
                  const from = new Date();
                  from.setDate(from.getDate() + 1);
                  from.setHours(0, 0, 0, 0);
                  const to = new Date(from);
                  to.setDate(to.getDate() + 1);

                  const due = await deps.findTasksDueBetween(from, to);
                  if (due.length === 0) return;
                  const sent = await emailEachUser(due, n => `You have ${n} task(s) due tomorrow`, 'These tasks are due tomorrow:');
                  console.log(`Sent ${sent} reminder email(s)`);
                },

                async sendOverdueAlerts(): Promise<void> {
                  const overdue = await deps.findOverdueTasks(new Date());
                  if (overdue.length === 0) return;
                  const sent = await emailEachUser(overdue, n => `${n} task(s) are overdue`, 'These tasks are past their due date:');
                  console.log(`Sent ${sent} overdue alert(s)`);
                }
              };
            }
            """;

    static final String CLEANUP_JOBS = """
            import { JobResult } from '../types/jobs';

            /** Retention jobs for completed tasks and expired sessions. */

            export const COMPLETED_TASK_RETENTION_DAYS = 90;

            export interface CleanupJobDeps {
              archiveCompletedTasksBefore(cutoff: Date): Promise<number>;
              deleteSessionsExpiredBefore(now: Date): Promise<number>;
            }

            export interface CleanupJobs {
              cleanupCompletedTasks(): Promise<void>;
              cleanupExpiredSessions(): Promise<void>;
            }

            export function createCleanupJobs(deps: CleanupJobDeps, retentionDays: number = COMPLETED_TASK_RETENTION_DAYS): CleanupJobs {
              function report(job: string, result: JobResult): void {
                console.log(`[cleanup] ${job}: ${result.processedCount ?? 0} row(s) in ${result.duration ?? 0}ms`);
              }

              return {
                async cleanupCompletedTasks(): Promise<void> {
                  const started = Date.now();
                  const cutoff = new Date();
                  cutoff.setDate(cutoff.getDate() - retentionDays);
                  const archived = await deps.archiveCompletedTasksBefore(cutoff);
                  report('completed-tasks', { success: true, processedCount: archived, duration: Date.now() - started });
                },

                async cleanupExpiredSessions(): Promise<void> {
                  const started = Date.now();
                  const deleted = await deps.deleteSessionsExpiredBefore(new Date());
                  report('expired-sessions', { success: true, processedCount: deleted, duration: Date.now() - started });
                }
              };
            }
            """;

    static final String REPORT_JOBS = """
            import { EmailJob, ReportJob } from '../types/jobs';

            /** Weekly productivity reports and monthly analytics. */

            export interface ProductivityStats {
              userId: string;
              email: string;
              name: string;
              completed: number;
              created: number;
              overdue: number;
              avgHoursPerTask: number;
            }

            export interface ReportJobDeps {
              collectStats(request: ReportJob): Promise<ProductivityStats[]>;
              activeUserIds(): Promise<string[]>;
              enqueueEmail(job: EmailJob): Promise<void>;
            }

            export interface ReportJobs {
              generateWeeklyReports(): Promise<void>;
              generateMonthlyAnalytics(): Promise<void>;
            }

            export function completionRate(stats: ProductivityStats): number {
              return stats.created === 0 ? 0 : Math.round((stats.completed / stats.created) * 100);
            }

            function renderReport(title: string, stats: ProductivityStats): string {
              return `<h2>${title}</h2>
            <p>Hi ${stats.name},</p>
            <ul>
              <li>Tasks completed: ${stats.completed}</li>
              <li>Tasks created: ${stats.created}</li>
              <li>Overdue: ${stats.overdue}</li>
              <li>Completion rate: ${completionRate(stats)}%</li>
              <li>Average time per task: ${stats.avgHoursPerTask.toFixed(1)}h</li>
            </ul>`;
            }

            export function createReportJobs(deps: ReportJobDeps): ReportJobs {
              async function run(reportType: ReportJob['reportType'], startDate: Date, title: string): Promise<void> {
                const endDate = new Date();
                for (const userId of await deps.activeUserIds()) {
                  const [stats] = await deps.collectStats({ userId, reportType, startDate, endDate });
                  if (!stats) continue;
                  await deps.enqueueEmail({ to: stats.email, subject: title, html: renderReport(title, stats), priority: 'low' });
                }
              }

              return {
                async generateWeeklyReports(): Promise<void> {
                  const start = new Date();
                  start.setDate(start.getDate() - 7);
                  await run('weekly', start, 'Your weekly productivity report');
                },

                async generateMonthlyAnalytics(): Promise<void> {
                  const start = new Date();
                  start.setMonth(start.getMonth() - 1);
                  await run('monthly', start, 'Your monthly analytics');
                }
              };
            }
            """;

    static final String BACKUP_JOBS = """
            import { exec } from 'child_process';
            import { promisify } from 'util';
            import path from 'path';
            import fs from 'fs/promises';
            import { BackupJob } from '../types/jobs';

            const execAsync = promisify(exec);

            /** Nightly pg_dump backup with rolling retention. */

            export interface BackupJobDeps {
              dbHost: string;
              dbPort: number;
              dbUser: string;
              dbName: string;
              dbPassword: string;
              backupDir?: string;
              retentionDays?: number;
            }

            export interface BackupJobs {
              performDailyBackup(): Promise<void>;
            }

            export function createBackupJobs(deps: BackupJobDeps): BackupJobs {
              const backupDir = deps.backupDir ?? path.join(process.cwd(), 'backups');
              const retentionDays = deps.retentionDays ?? 7;

              async function pruneOldBackups(): Promise<number> {
                const maxAgeMs = retentionDays * 24 * 60 * 60 * 1000;
                const now = Date.now();
                let deleted = 0;
                for (const file of await fs.readdir(backupDir)) {
                  if (!file.startsWith('backup-')) continue;
                  const filePath = path.join(backupDir, file);
                  const stats = await fs.stat(filePath);
                  if (now - stats.mtimeMs > maxAgeMs) {
                    await fs.unlink(filePath);
                    deleted++;
                  }
                }
                return deleted;
              }

              return {
                async performDailyBackup(): Promise<void> {
                  const timestamp = new Date().toISOString().replace(/[:.]/g, '-');
                  const job: BackupJob = {
                    type: 'full',
                    targetPath: path.join(backupDir, `backup-${timestamp}.dump`),
                    timestamp: new Date()
                  };

                  await fs.mkdir(backupDir, { recursive: true });
                  await execAsync(
                    `pg_dump -h ${deps.dbHost} -p ${deps.dbPort} -U ${deps.dbUser} -d ${deps.dbName} -F c -f ${job.targetPath}`,
                    { env: { ...process.env, PGPASSWORD: deps.dbPassword } }
                  );

                  const stats = await fs.stat(job.targetPath);
                  console.log(`Backup written: ${job.targetPath} (${(stats.size / (1024 * 1024)).toFixed(2)} MB)`);

                  const pruned = await pruneOldBackups();
                  if (pruned > 0) {
                    console.log(`Pruned ${pruned} old backup(s)`);
                  }
                }
              };
            }
            """;

    // ------------------------------------------------------------------
    // Shared artifacts
    // ------------------------------------------------------------------

    static final String QUEUE_PROCESSOR = """
            import Queue from 'bull';
            import { EmailJob, FileProcessingJob, NotificationJob } from '../types/jobs';

            /**
             * Background queues (Bull on Redis) for work that must not block a request.
             * Processors are registered by the application at startup.
             */

            const redis = {
              host: process.env.REDIS_HOST || 'localhost',
              port: parseInt(process.env.REDIS_PORT || '6379', 10)
            };

            export const emailQueue = new Queue<EmailJob>('email', { redis });
            export const fileQueue = new Queue<FileProcessingJob>('file-processing', { redis });
            export const notificationQueue = new Queue<NotificationJob>('notifications', { redis });

            export interface QueueProcessors {
              sendEmail(job: EmailJob): Promise<void>;
              processFile(job: FileProcessingJob): Promise<void>;
              deliverNotification(job: NotificationJob): Promise<void>;
            }

            export function registerProcessors(processors: QueueProcessors): void {
              emailQueue.process(async job => {
                await processors.sendEmail(job.data);
                return { success: true, recipient: job.data.to };
              });
              fileQueue.process(async job => {
                await processors.processFile(job.data);
                return { success: true, fileId: job.data.fileId };
              });
              notificationQueue.process(async job => {
                await processors.deliverNotification(job.data);
                return { success: true, userId: job.data.userId };
              });

              for (const queue of [emailQueue, fileQueue, notificationQueue]) {
                queue.on('failed', (job, error) => {
                  console.error(`[${queue.name}] job ${job?.id} failed`, error);
                });
              }
            }

            export const QueueHelpers = {
              async addEmailJob(data: EmailJob): Promise<void> {
                await emailQueue.add(data, { attempts: 3, backoff: { type: 'exponential', delay: 2000 } });
              },

              async addFileProcessingJob(data: FileProcessingJob): Promise<void> {
                await fileQueue.add(data, { attempts: 2, timeout: 300000 });
              },

              async addNotificationJob(data: NotificationJob): Promise<void> {
                await notificationQueue.add(data, { attempts: 3 });
              }
            };

            export async function closeQueues(): Promise<void> {
              await Promise.all([emailQueue.close(), fileQueue.close(), notificationQueue.close()]);
            }
            """;

    static final String JOB_TYPES = """
            /**
             * Type definitions for scheduled jobs and background processing.
             */

            export type JobPriority = 'high' | 'normal' | 'low';

            export interface EmailJob {
              to: string;
              subject: string;
              html: string;
              priority?: JobPriority;
            }

            export interface FileProcessingJob {
              fileId: string;
              filePath: string;
              userId: string;
            }

            export interface NotificationJob {
              userId: string;
              type: string;
              message: string;
              referenceId?: string;
              priority?: JobPriority;
            }

            export interface BackupJob {
              type: 'full' | 'incremental';
              targetPath: string;
              timestamp: Date;
            }

            export interface ReportJob {
              userId: string;
              reportType: 'weekly' | 'monthly' | 'quarterly';
              startDate: Date;
              endDate: Date;
            }

            export interface CleanupJob {
              type: 'completed_tasks' | 'expired_sessions' | 'orphaned_files';
              daysOld: number;
            }

            export interface JobResult {
              success: boolean;
              processedCount?: number;
              failedCount?: number;
              duration?: number;
              error?: string;
            }

            export type JobHandler = () => Promise<void>;

            export interface ScheduledJobDefinition<Name extends string = string> {
              name: Name;
              cronExpression: string;
              description: string;
              handler: string;
            }

            export interface JobStatus {
              name: string;
              cronExpression: string;
              running: boolean;
              lastRun?: Date;
              lastError?: string;
            }
            """;
}
