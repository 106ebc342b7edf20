package com.briefforge.orchestrator.service;

import com.briefforge.orchestrator.assembly.ArtifactAssembler;
import com.briefforge.orchestrator.decomposition.FallbackTaskDecomposer;
import com.briefforge.orchestrator.decomposition.TaskDecomposer;
import com.briefforge.orchestrator.model.AgentResponse;
import com.briefforge.orchestrator.model.DecompositionResult;
import com.briefforge.orchestrator.model.DecompositionSource;
import com.briefforge.orchestrator.model.ExecutionReport;
import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.ProjectBrief;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.reasoning.ReasoningException;
import com.briefforge.orchestrator.synthesis.SynthesisException;
import com.briefforge.orchestrator.synthesis.SynthesizerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Drives a brief through the pipeline.
 *
 * <pre>
 *   brief -> primary decomposer --(ReasoningException)--> rule-based decomposer
 *         -> for each task, in order: validate -> synthesizer group for task.type
 *         -> ArtifactAssembler -> ExecutionReport
 * </pre>
 *
 * A brief's tasks all come from one path. A failing task never stops the
 * batch: its error lands in its own {@link AgentResponse}.
 */
@Service
public class BriefCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BriefCoordinator.class);

    static final String INVALID_TASK = "Invalid task provided";

    private final TaskDecomposer         primary;
    private final FallbackTaskDecomposer fallback;
    private final SynthesizerRegistry    synthesizers;
    private final ArtifactAssembler      assembler;
    private final ProjectReportWriter    reports;
    private final MeterRegistry          meterRegistry;

    public BriefCoordinator(TaskDecomposer primary,
                            FallbackTaskDecomposer fallback,
                            SynthesizerRegistry synthesizers,
                            ArtifactAssembler assembler,
                            ProjectReportWriter reports,
                            MeterRegistry meterRegistry) {
        this.primary       = primary;
        this.fallback      = fallback;
        this.synthesizers  = synthesizers;
        this.assembler     = assembler;
        this.reports       = reports;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Decomposition
    // ------------------------------------------------------------------

    public DecompositionResult decompose(ProjectBrief brief) {
        MDC.put("briefId", newBriefId());
        try {
            return decomposeInBrief(brief);
        } finally {
            MDC.remove("briefId");
        }
    }

    private DecompositionResult decomposeInBrief(ProjectBrief brief) {
        List<TechnicalTask> tasks;
        DecompositionSource source;
        try {
            tasks  = primary.decompose(brief);
            source = primary.source();
            if (tasks.isEmpty()) {
                throw new ReasoningException(ReasoningException.Kind.MALFORMED_RESPONSE,
                        "Reasoning service returned zero tasks");
            }
        } catch (ReasoningException e) {
            log.warn("Reasoning service failed [{}], using rule-based decomposition: {}",
                    e.getKind(), e.getMessage());
            tasks  = fallback.decompose(brief);
            source = DecompositionSource.FALLBACK;
        }

        meterRegistry.counter("briefforge.decomposition",
                "source", source.name().toLowerCase()).increment();
        log.info("Decomposed brief into {} task(s) via {}", tasks.size(), source);

        String plan     = reports.executionPlan(tasks, brief);
        String analysis = source == DecompositionSource.FALLBACK
                ? reports.fallbackAnalysis()
                : reports.analysis(brief, tasks);
        return new DecompositionResult(tasks, plan, analysis, source);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /** Decompose, synthesize every task, and assemble the artifacts. */
    public ExecutionReport execute(ProjectBrief brief) {
        MDC.put("briefId", newBriefId());
        try {
            DecompositionResult decomposition = decomposeInBrief(brief);
            List<TechnicalTask> tasks   = decomposition.tasks();
            List<AgentResponse> results = executeTasks(tasks);

            List<List<GeneratedFile>> produced = new ArrayList<>();
            for (AgentResponse result : results) {
                if (result.success()) {
                    produced.add(result.files());
                }
            }
            List<GeneratedFile> artifacts = assembler.assemble(produced);

            log.info("Brief finished: {}/{} task(s) succeeded, {} artifact(s)",
                    results.stream().filter(AgentResponse::success).count(), results.size(), artifacts.size());

            return new ExecutionReport(
                    results,
                    reports.summary(results),
                    reports.insights(results, tasks),
                    decomposition.analysis(),
                    decomposition.source(),
                    artifacts);
        } finally {
            MDC.remove("briefId");
        }
    }

    /** Runs tasks strictly in order; one response per task, same order. */
    public List<AgentResponse> executeTasks(List<TechnicalTask> tasks) {
        List<AgentResponse> results = new ArrayList<>(tasks.size());
        for (TechnicalTask task : tasks) {
            results.add(executeTask(task));
        }
        return results;
    }

    /** Never throws for a bad task or a failing synthesizer. */
    public AgentResponse executeTask(TechnicalTask task) {
        String taskId = task == null ? null : task.id();
        MDC.put("taskId", taskId == null ? "" : taskId);
        try {
            validate(task);
            log.info("Processing task: {} [{}]", task.title(), task.type());

            List<GeneratedFile> files = synthesizers.synthesizeGroup(task.type(), task);
            return AgentResponse.succeeded(taskId, describe(task, files), files);

        } catch (TaskValidationException e) {
            log.warn("Rejected task {}: {}", taskId, e.getMessage());
            return AgentResponse.failed(taskId, INVALID_TASK);
        } catch (SynthesisException e) {
            log.error("Synthesis failed for task {}", taskId, e);
            return AgentResponse.failed(taskId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing task {}", taskId, e);
            return AgentResponse.failed(taskId, "Unexpected error: " + e);
        } finally {
            MDC.remove("taskId");
        }
    }

    // ------------------------------------------------------------------

    private static void validate(TechnicalTask task) {
        if (task == null) {
            throw new TaskValidationException(null, "Task is null");
        }
        if (task.title() == null || task.title().isBlank()) {
            throw new TaskValidationException(task.id(), "Task has no title");
        }
        if (task.description() == null || task.description().isBlank()) {
            throw new TaskValidationException(task.id(), "Task has no description");
        }
        if (task.type() == null) {
            throw new TaskValidationException(task.id(), "Task has no type");
        }
    }

    private static String describe(TechnicalTask task, List<GeneratedFile> files) {
        StringBuilder out = new StringBuilder();
        out.append("Generated ").append(files.size()).append(" file(s) for ").append(task.title()).append(":\n");
        for (GeneratedFile file : files) {
            out.append("- ").append(file.path()).append(" (").append(file.type().name().toLowerCase()).append(")\n");
        }
        return out.toString();
    }

    private static String newBriefId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
