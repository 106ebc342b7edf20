package com.briefforge.orchestrator.service;

import com.briefforge.orchestrator.model.AgentResponse;
import com.briefforge.orchestrator.model.FileType;
import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.ProjectBrief;
import com.briefforge.orchestrator.model.TaskPriority;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProjectReportWriterTest {

    private final ProjectReportWriter writer = new ProjectReportWriter();

    private final List<TechnicalTask> tasks = List.of(
            TechnicalTask.of("1", "Auth API", "d", TaskType.BACKEND, TaskPriority.HIGH, List.of(), 8),
            TechnicalTask.of("2", "Login form", "d", TaskType.FRONTEND, TaskPriority.LOW, List.of(), null),
            TechnicalTask.of("3", "Database schema", "d", TaskType.BACKEND, TaskPriority.MEDIUM, List.of(), 4));

    // ------------------------------------------------------------------
    // Plan
    // ------------------------------------------------------------------

    @Test
    void executionPlan_groupsByPhaseAndTotalsHours() {
        ProjectBrief brief = new ProjectBrief("Todo app", List.of("Login"), List.of(), null);

        String plan = writer.executionPlan(tasks, brief);

        assertThat(plan).contains("Project Overview:\nTodo app");
        assertThat(plan).contains("Key Requirements:\n- Login");
        assertThat(plan).contains("Phase 1 - Backend Development (2 tasks):\n"
                + "  1. Auth API [high priority]\n"
                + "     Estimated: 8 hours\n"
                + "  2. Database schema [medium priority]\n");
        assertThat(plan).contains("Phase 2 - Frontend Development (1 tasks):\n  1. Login form [low priority]\n");
        assertThat(plan).contains("Total Estimated Time: 12 hours");
        assertThat(plan).endsWith("Total Tasks: 3");
    }

    @Test
    void executionPlan_noHoursAndNoRequirements_omitsThoseSections() {
        TechnicalTask task = TechnicalTask.of("1", "X", "d", TaskType.FRONTEND, TaskPriority.LOW, List.of(), null);

        String plan = writer.executionPlan(List.of(task), ProjectBrief.of("Small"));

        assertThat(plan).doesNotContain("Key Requirements").doesNotContain("Total Estimated Time");
    }

    // ------------------------------------------------------------------
    // Analysis
    // ------------------------------------------------------------------

    @Test
    void analysis_fullStackWithAuth() {
        String analysis = writer.analysis(new ProjectBrief("x", List.of(), List.of(), "3 weeks"), tasks);

        assertThat(analysis).contains("Project Complexity: Simple");
        assertThat(analysis).contains("Architecture Pattern: Full-Stack MVC");
        assertThat(analysis).contains("Technology Stack: React+TypeScript, Node.js+Express, Database, JWT Auth");
        assertThat(analysis).contains("Risk Factors: Tight timeline, No testing strategy");
    }

    @Test
    void complexity_thresholds() {
        TechnicalTask high = TechnicalTask.of("h", "t", "d", TaskType.BACKEND, TaskPriority.HIGH, List.of(), null);
        TechnicalTask low  = TechnicalTask.of("l", "t", "d", TaskType.BACKEND, TaskPriority.LOW, List.of(), null);

        assertThat(ProjectReportWriter.complexity(List.of(high, high, high, high))).isEqualTo("Moderate");
        assertThat(ProjectReportWriter.complexity(List.of(high, high, high, high, high, high, high)))
                .isEqualTo("High");
        assertThat(ProjectReportWriter.complexity(List.of(high, low, low, low, low, low, low)))
                .isEqualTo("Complex");
    }

    @Test
    void architecture_backendOnly_isApiFirst() {
        assertThat(ProjectReportWriter.architecture(List.of(tasks.get(2)))).isEqualTo("API-First");
        assertThat(ProjectReportWriter.architecture(List.of(tasks.get(1)))).isEqualTo("Component-Based");
    }

    // ------------------------------------------------------------------
    // Summary and insights
    // ------------------------------------------------------------------

    @Test
    void summary_listsFailedTasksWithPosition() {
        List<AgentResponse> results = List.of(
                AgentResponse.succeeded("1", "ok", List.of(new GeneratedFile("src/a.ts", "a", FileType.OTHER))),
                AgentResponse.failed("2", "Invalid task provided"));

        String summary = writer.summary(results);

        assertThat(summary).contains("Total tasks: 2", "Successful: 1", "Failed: 1", "Files generated: 1");
        assertThat(summary).contains("- Task 2 (2): Invalid task provided");
    }

    @Test
    void insights_successRateAndImprovements() {
        List<AgentResponse> results = List.of(
                AgentResponse.succeeded("1", "ok", List.of()),
                AgentResponse.succeeded("2", "ok", List.of()),
                AgentResponse.failed("3", "boom"));

        String insights = writer.insights(results, tasks);

        assertThat(insights).contains("Success Rate: 67%", "Task Completion: 2/3");
        assertThat(insights).contains("Areas for Improvement:\n- Database schema: boom");
        assertThat(insights).contains("Review failed tasks");
    }

    @Test
    void insights_noResults_isZeroPercent() {
        assertThat(writer.insights(List.of(), List.of())).contains("Success Rate: 0%");
    }
}
