package com.briefforge.orchestrator.decomposition;

import com.briefforge.orchestrator.model.DecompositionSource;
import com.briefforge.orchestrator.model.ProjectBrief;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.synthesis.SubstringKeywordClassifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the keyword-rule decomposer. No I/O, no mocks.
 */
class FallbackTaskDecomposerTest {

    private final FallbackTaskDecomposer decomposer = new FallbackTaskDecomposer(new SubstringKeywordClassifier());

    @Test
    void decompose_todoAppWithAuth_emitsAuthThenTaskFamilies() {
        List<TechnicalTask> tasks = decomposer.decompose(
                ProjectBrief.of("Build a todo app with user authentication"));

        assertThat(tasks).extracting(TechnicalTask::title).containsExactly(
                "Implement Advanced Authentication System",
                "Build Modern Authentication UI Components",
                "Develop Comprehensive Task Management API",
                "Create Interactive Task Management Dashboard");
        assertThat(tasks).extracting(TechnicalTask::type).containsExactly(
                TaskType.BACKEND, TaskType.FRONTEND, TaskType.BACKEND, TaskType.FRONTEND);
        assertThat(tasks).extracting(TechnicalTask::id).containsExactly(
                "fallback-1", "fallback-2", "fallback-3", "fallback-4");
        assertThat(tasks).anySatisfy(task -> assertThat(task.acceptanceCriteria()).hasSizeGreaterThanOrEqualTo(4));
        assertThat(tasks).allSatisfy(task -> assertThat(task.acceptanceCriteria()).hasSize(10));
    }

    @Test
    void decompose_familyWithoutApiTask_appendsApiInfrastructure() {
        List<TechnicalTask> tasks = decomposer.decompose(ProjectBrief.of("A login page"));

        assertThat(tasks).hasSize(3);
        assertThat(tasks.get(2).title()).isEqualTo(FallbackTaskDecomposer.API_INFRASTRUCTURE.title());
        assertThat(tasks.get(2).id()).isEqualTo("fallback-3");
    }

    @Test
    void decompose_noFamilyMatched_returnsBaseline() {
        List<TechnicalTask> tasks = decomposer.decompose(ProjectBrief.of("A weather dashboard"));

        assertThat(tasks).hasSize(FallbackTaskDecomposer.BASELINE.size());
        assertThat(tasks.get(0).title()).isEqualTo("Design Database Schema and Backend Architecture");
    }

    @Test
    void decompose_blankDescription_isNeverEmpty() {
        assertThat(decomposer.decompose(ProjectBrief.of(""))).isNotEmpty();
        assertThat(decomposer.decompose(new ProjectBrief(null, null, null, null))).isNotEmpty();
    }

    @Test
    void decompose_everyTaskIsComplete() {
        List<TechnicalTask> tasks = decomposer.decompose(ProjectBrief.of("Team shop with shared carts"));

        assertThat(tasks).allSatisfy(task -> {
            assertThat(task.title()).isNotBlank();
            assertThat(task.description()).isNotBlank();
            assertThat(task.type()).isNotNull();
            assertThat(task.priority()).isNotNull();
            assertThat(task.acceptanceCriteria()).isNotEmpty();
            assertThat(task.estimatedHours()).isPositive();
        });
    }

    @Test
    void decompose_isDeterministic() {
        ProjectBrief brief = ProjectBrief.of("Collaborative task tracker for teams");

        assertThat(decomposer.decompose(brief)).isEqualTo(decomposer.decompose(brief));
    }

    @Test
    void source_isFallback() {
        assertThat(decomposer.source()).isEqualTo(DecompositionSource.FALLBACK);
    }
}
