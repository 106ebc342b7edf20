package com.briefforge.orchestrator.synthesis.scheduling;

import com.briefforge.orchestrator.model.FileType;
import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.synthesis.KeywordClassifier;
import com.briefforge.orchestrator.synthesis.Synthesizer;
import com.briefforge.orchestrator.synthesis.SynthesizerManifest;
import com.briefforge.orchestrator.synthesis.TaskText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Maps task text to recurring-job artifacts.
 *
 * <p>When any trigger keyword occurs, the output is, in order:
 * <ol>
 *   <li>{@code src/jobs/scheduler.ts}, registering only the jobs of matched families</li>
 *   <li>one handler artifact per matched {@link JobFamily}</li>
 *   <li>{@code src/jobs/queueProcessor.ts}</li>
 *   <li>{@code src/types/jobs.ts}</li>
 * </ol>
 * Otherwise the output is empty.
 */
@Component
public class SchedulingSynthesizer implements Synthesizer {

    private static final SynthesizerManifest MANIFEST = new SynthesizerManifest(
            "scheduling", TaskType.BACKEND, 30,
            "Cron scheduler, job handlers and background queues");

    static final List<String> TRIGGER_KEYWORDS = List.of(
            "schedule", "cron", "daily", "weekly", "monthly",
            "reminder", "notification", "alert", "email",
            "cleanup", "archive", "delete old",
            "report", "summary", "analytics",
            "backup", "export", "sync",
            "recurring", "periodic", "automated");

    static final String SCHEDULER_PATH       = "src/jobs/scheduler.ts";
    static final String QUEUE_PROCESSOR_PATH = "src/jobs/queueProcessor.ts";
    static final String JOB_TYPES_PATH       = "src/types/jobs.ts";

    private final KeywordClassifier classifier;

    public SchedulingSynthesizer(KeywordClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public SynthesizerManifest manifest() {
        return MANIFEST;
    }

    @Override
    public List<GeneratedFile> synthesize(TechnicalTask task) {
        String combined = TaskText.combined(task);
        if (!classifier.matchesAny(combined, TRIGGER_KEYWORDS)) {
            return List.of();
        }

        Set<JobFamily> families = EnumSet.noneOf(JobFamily.class);
        for (JobFamily family : JobFamily.values()) {
            if (classifier.matchesAny(combined, family.keywords())) {
                families.add(family);
            }
        }

        List<GeneratedFile> files = new ArrayList<>();
        files.add(new GeneratedFile(SCHEDULER_PATH, renderScheduler(jobsFor(families), families), FileType.OTHER));
        for (JobFamily family : families) {
            files.add(new GeneratedFile(family.path(), JobTemplates.familySource(family), FileType.OTHER));
        }
        files.add(new GeneratedFile(QUEUE_PROCESSOR_PATH, JobTemplates.QUEUE_PROCESSOR, FileType.OTHER));
        files.add(new GeneratedFile(JOB_TYPES_PATH, JobTemplates.JOB_TYPES, FileType.OTHER));
        return files;
    }

    /** Catalog jobs belonging to the given families, in catalog order. */
    public static List<ScheduledJob> jobsFor(Set<JobFamily> families) {
        return ScheduledJob.CATALOG.stream()
                .filter(job -> families.contains(job.family()))
                .toList();
    }

    // ------------------------------------------------------------------
    // Scheduler rendering
    // ------------------------------------------------------------------

    /**
     * Render the scheduler. Imports, the handler bundle, the job name union
     * and the dispatch switch are all derived from the same job list, so the
     * artifact never references a handler module that was not emitted.
     */
    static String renderScheduler(List<ScheduledJob> jobs, Set<JobFamily> families) {
        StringBuilder ts = new StringBuilder();

        ts.append("import cron from 'node-cron';\n");
        ts.append("import { JobHandler, JobStatus, ScheduledJobDefinition } from '../types/jobs';\n");
        for (JobFamily family : families) {
            ts.append("import type { %s } from './%s';\n".formatted(family.typeName(), family.module()));
        }

        ts.append("""

                /**
                 * Registers recurring jobs with node-cron.
                 *
                 * Each job runs inside its own try/catch: a failing job is logged and
                 * keeps its schedule, and never affects the other jobs.
                 */

                """);

        // Handler bundle
        ts.append("export interface JobHandlers {\n");
        for (JobFamily family : families) {
            ts.append("  %s: %s;\n".formatted(family.module(), family.typeName()));
        }
        ts.append("}\n\n");

        // Job name union
        if (jobs.isEmpty()) {
            ts.append("export type ScheduledJobName = never;\n\n");
        } else {
            ts.append("export type ScheduledJobName =\n");
            for (int i = 0; i < jobs.size(); i++) {
                ts.append("  | '").append(jobs.get(i).name()).append('\'')
                        .append(i == jobs.size() - 1 ? ";\n\n" : "\n");
            }
        }

        // Job table
        ts.append("export const SCHEDULED_JOBS: readonly ScheduledJobDefinition<ScheduledJobName>[] = [\n");
        for (int i = 0; i < jobs.size(); i++) {
            ScheduledJob job = jobs.get(i);
            ts.append("  { name: '%s', cronExpression: '%s', description: '%s', handler: '%s' }%s\n".formatted(
                    job.name(), job.cronExpression(), job.description(), job.handlerReference(),
                    i == jobs.size() - 1 ? "" : ","));
        }
        ts.append("];\n\n");

        ts.append("""
                function assertNever(value: never): never {
                  throw new Error(`Unknown job: ${String(value)}`);
                }

                export class JobScheduler {
                  private readonly tasks = new Map<ScheduledJobName, cron.ScheduledTask>();
                  private readonly status = new Map<ScheduledJobName, JobStatus>();

                  constructor(private readonly handlers: JobHandlers) {}

                  /** Resolves a job name to its handler. Exhaustive over ScheduledJobName. */
                  private handlerFor(name: ScheduledJobName): JobHandler {
                    switch (name) {
                """);
        for (ScheduledJob job : jobs) {
            ts.append("      case '%s':\n".formatted(job.name()));
            ts.append("        return () => this.handlers.%s();\n".formatted(job.handlerReference()));
        }
        ts.append("""
                      default:
                        return assertNever(name);
                    }
                  }

                  start(): void {
                    if (this.tasks.size > 0) {
                      console.warn('Scheduler is already running');
                      return;
                    }
                    for (const job of SCHEDULED_JOBS) {
                      this.register(job);
                    }
                    console.log(`Scheduler started with ${this.tasks.size} job(s)`);
                  }

                  stop(): void {
                    for (const task of this.tasks.values()) {
                      task.stop();
                    }
                    this.tasks.clear();
                  }

                  getStatus(): JobStatus[] {
                    return Array.from(this.status.values());
                  }

                  /** Runs one job immediately, outside its schedule. Errors propagate to the caller. */
                  async runJobManually(name: ScheduledJobName): Promise<void> {
                    await this.handlerFor(name)();
                    this.recordRun(name, undefined);
                  }

                  private register(job: ScheduledJobDefinition<ScheduledJobName>): void {
                    const handler = this.handlerFor(job.name);
                    this.status.set(job.name, { name: job.name, cronExpression: job.cronExpression, running: true });

                    const task = cron.schedule(job.cronExpression, async () => {
                      const started = Date.now();
                      try {
                        await handler();
                        this.recordRun(job.name, undefined);
                        console.log(`[cron] ${job.name} completed in ${Date.now() - started}ms`);
                      } catch (error) {
                        const message = error instanceof Error ? error.message : String(error);
                        this.recordRun(job.name, message);
                        console.error(`[cron] ${job.name} failed`, error);
                      }
                    });
                    this.tasks.set(job.name, task);
                  }

                  private recordRun(name: ScheduledJobName, error: string | undefined): void {
                    const current = this.status.get(name);
                    if (current) {
                      this.status.set(name, { ...current, lastRun: new Date(), lastError: error });
                    }
                  }
                }
                """);
        return ts.toString();
    }
}
