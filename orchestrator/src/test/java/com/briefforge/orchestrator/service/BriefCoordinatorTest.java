package com.briefforge.orchestrator.service;

import com.briefforge.orchestrator.assembly.ArtifactAssembler;
import com.briefforge.orchestrator.decomposition.FallbackTaskDecomposer;
import com.briefforge.orchestrator.decomposition.TaskDecomposer;
import com.briefforge.orchestrator.model.AgentResponse;
import com.briefforge.orchestrator.model.DecompositionResult;
import com.briefforge.orchestrator.model.DecompositionSource;
import com.briefforge.orchestrator.model.ExecutionReport;
import com.briefforge.orchestrator.model.FileType;
import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.ProjectBrief;
import com.briefforge.orchestrator.model.TaskPriority;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.reasoning.ReasoningException;
import com.briefforge.orchestrator.synthesis.SynthesisException;
import com.briefforge.orchestrator.synthesis.Synthesizer;
import com.briefforge.orchestrator.synthesis.SynthesizerManifest;
import com.briefforge.orchestrator.synthesis.SynthesizerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BriefCoordinator.
 *
 * Decomposers and the synthesizer registry are mocked; the assembler and
 * report writer are real since they are pure. No Spring context.
 */
@ExtendWith(MockitoExtension.class)
class BriefCoordinatorTest {

    @Mock TaskDecomposer         primary;
    @Mock FallbackTaskDecomposer fallback;
    @Mock SynthesizerRegistry    synthesizers;

    SimpleMeterRegistry meters;
    BriefCoordinator    coordinator;

    ProjectBrief brief = ProjectBrief.of("Build a todo app with user authentication");

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        coordinator = new BriefCoordinator(primary, fallback, synthesizers,
                new ArtifactAssembler(), new ProjectReportWriter(), meters);
    }

    // ------------------------------------------------------------------
    // decompose()
    // ------------------------------------------------------------------

    @Test
    void decompose_reasoningServiceSucceeds_buildsPlanAndAnalysis() {
        when(primary.decompose(brief)).thenReturn(List.of(task("ai-task-1", TaskType.BACKEND)));
        when(primary.source()).thenReturn(DecompositionSource.REASONING_SERVICE);

        DecompositionResult result = coordinator.decompose(brief);

        assertThat(result.source()).isEqualTo(DecompositionSource.REASONING_SERVICE);
        assertThat(result.plan()).startsWith("Execution Plan");
        assertThat(result.analysis()).contains("Project Complexity: Simple");
        verifyNoInteractions(fallback);
        assertThat(meters.get("briefforge.decomposition").tags("source", "reasoning_service")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void decompose_reasoningServiceFails_switchesWholeBriefToFallback() {
        when(primary.decompose(brief)).thenThrow(
                new ReasoningException(ReasoningException.Kind.SERVICE_UNAVAILABLE, "no model"));
        when(fallback.decompose(brief)).thenReturn(List.of(
                task("fallback-1", TaskType.BACKEND), task("fallback-2", TaskType.FRONTEND)));

        DecompositionResult result = coordinator.decompose(brief);

        assertThat(result.source()).isEqualTo(DecompositionSource.FALLBACK);
        assertThat(result.usedFallback()).isTrue();
        assertThat(result.analysis()).isEqualTo(ProjectReportWriter.FALLBACK_ANALYSIS);
        assertThat(result.tasks()).extracting(TechnicalTask::id).containsExactly("fallback-1", "fallback-2");
        assertThat(meters.get("briefforge.decomposition").tags("source", "fallback")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void decompose_reasoningServiceReturnsNoTasks_usesFallback() {
        when(primary.decompose(brief)).thenReturn(List.of());
        when(primary.source()).thenReturn(DecompositionSource.REASONING_SERVICE);
        when(fallback.decompose(brief)).thenReturn(List.of(task("fallback-1", TaskType.BACKEND)));

        DecompositionResult result = coordinator.decompose(brief);

        assertThat(result.source()).isEqualTo(DecompositionSource.FALLBACK);
        assertThat(result.tasks()).hasSize(1);
    }

    // ------------------------------------------------------------------
    // execute() / executeTasks()
    // ------------------------------------------------------------------

    @Test
    void execute_oneTaskFails_otherTasksStillSucceed() {
        TechnicalTask first  = task("t-1", TaskType.BACKEND);
        TechnicalTask second = task("t-2", TaskType.FRONTEND);
        TechnicalTask third  = task("t-3", TaskType.BACKEND);
        when(primary.decompose(brief)).thenReturn(List.of(first, second, third));
        when(primary.source()).thenReturn(DecompositionSource.REASONING_SERVICE);
        when(synthesizers.synthesizeGroup(TaskType.BACKEND, first))
                .thenReturn(List.of(file("src/config/database.ts", "db"), file("src/a.ts", "a")));
        when(synthesizers.synthesizeGroup(TaskType.FRONTEND, second))
                .thenThrow(new SynthesisException(SynthesisException.Kind.GENERATION_ERROR, "template missing"));
        when(synthesizers.synthesizeGroup(TaskType.BACKEND, third))
                .thenReturn(List.of(file("src/config/database.ts", "db"), file("src/b.ts", "b")));

        ExecutionReport report = coordinator.execute(brief);

        assertThat(report.results()).extracting(AgentResponse::taskId).containsExactly("t-1", "t-2", "t-3");
        assertThat(report.results()).extracting(AgentResponse::success).containsExactly(true, false, true);
        assertThat(report.results().get(1).error()).contains("template missing");
        assertThat(report.results().get(1).files()).isEmpty();
        assertThat(report.artifacts()).extracting(GeneratedFile::path)
                .containsExactly("src/config/database.ts", "src/a.ts", "src/b.ts");
        assertThat(report.summary()).contains("Failed: 1").contains("- Task 2 (t-2):");
        assertThat(report.source()).isEqualTo(DecompositionSource.REASONING_SERVICE);
    }

    @Test
    void executeTasks_invalidTasks_reportInvalidTaskWithoutSynthesizing() {
        TechnicalTask noTitle = new TechnicalTask("t-1", " ", "desc", TaskType.BACKEND,
                TaskPriority.LOW, List.of(), null, List.of());
        TechnicalTask noType  = new TechnicalTask("t-2", "Title", "desc", null,
                TaskPriority.LOW, List.of(), null, List.of());

        List<AgentResponse> results = coordinator.executeTasks(Arrays.asList(noTitle, noType, null));

        assertThat(results).hasSize(3);
        assertThat(results).allSatisfy(r -> {
            assertThat(r.success()).isFalse();
            assertThat(r.error()).isEqualTo(BriefCoordinator.INVALID_TASK);
        });
        assertThat(results.get(2).taskId()).isNull();
        verifyNoInteractions(synthesizers);
    }

    @Test
    void executeTasks_synthesizerReturnsNull_onlyThatTaskFails() {
        Synthesizer nullForBad = new Synthesizer() {
            final SynthesizerManifest manifest =
                    new SynthesizerManifest("null-for-bad", TaskType.BACKEND, 1, "test");

            @Override public SynthesizerManifest manifest() { return manifest; }

            @Override
            public List<GeneratedFile> synthesize(TechnicalTask task) {
                return task.title().equals("Bad") ? null : List.of(file("src/" + task.id() + ".ts", "x"));
            }
        };
        BriefCoordinator real = new BriefCoordinator(primary, fallback,
                new SynthesizerRegistry(List.of(nullForBad), meters),
                new ArtifactAssembler(), new ProjectReportWriter(), meters);

        List<AgentResponse> results = real.executeTasks(List.of(
                titled("t-1", "Good"), titled("t-2", "Bad"), titled("t-3", "Good2")));

        assertThat(results).extracting(AgentResponse::taskId).containsExactly("t-1", "t-2", "t-3");
        assertThat(results).extracting(AgentResponse::success).containsExactly(true, false, true);
        assertThat(results.get(1).error()).contains("GENERATION_ERROR");
    }

    @Test
    void executeTasks_unexpectedRuntimeException_isolatedToItsTask() {
        TechnicalTask first  = task("t-1", TaskType.BACKEND);
        TechnicalTask second = task("t-2", TaskType.BACKEND);
        when(synthesizers.synthesizeGroup(TaskType.BACKEND, first)).thenThrow(new NullPointerException("npe"));
        when(synthesizers.synthesizeGroup(TaskType.BACKEND, second)).thenReturn(List.of(file("src/b.ts", "b")));

        List<AgentResponse> results = coordinator.executeTasks(List.of(first, second));

        assertThat(results).extracting(AgentResponse::success).containsExactly(false, true);
        assertThat(results.get(0).error()).contains("npe");
    }

    @Test
    void executeTask_success_describesGeneratedFiles() {
        TechnicalTask task = task("t-1", TaskType.FRONTEND);
        when(synthesizers.synthesizeGroup(TaskType.FRONTEND, task))
                .thenReturn(List.of(new GeneratedFile("src/components/tasks/TaskList.tsx", "x", FileType.COMPONENT)));

        AgentResponse response = coordinator.executeTask(task);

        assertThat(response.success()).isTrue();
        assertThat(response.output()).contains("Generated 1 file(s) for Task t-1")
                .contains("- src/components/tasks/TaskList.tsx (component)");
    }

    @Test
    void executeTask_emptyOutput_isStillSuccess() {
        TechnicalTask task = task("t-1", TaskType.FRONTEND);
        when(synthesizers.synthesizeGroup(any(), any())).thenReturn(List.of());

        assertThat(coordinator.executeTask(task).success()).isTrue();
    }

    // ------------------------------------------------------------------

    private static TechnicalTask task(String id, TaskType type) {
        return TechnicalTask.of(id, "Task " + id, "Description of " + id, type, TaskPriority.MEDIUM,
                List.of("Works"), 4);
    }

    private static TechnicalTask titled(String id, String title) {
        return TechnicalTask.of(id, title, "Description of " + id, TaskType.BACKEND, TaskPriority.MEDIUM,
                List.of("Works"), 4);
    }

    private static GeneratedFile file(String path, String content) {
        return new GeneratedFile(path, content, FileType.OTHER);
    }
}
