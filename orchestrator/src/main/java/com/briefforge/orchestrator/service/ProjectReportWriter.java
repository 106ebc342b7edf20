package com.briefforge.orchestrator.service;

import com.briefforge.orchestrator.model.AgentResponse;
import com.briefforge.orchestrator.model.ProjectBrief;
import com.briefforge.orchestrator.model.TaskPriority;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text reports for a brief: execution plan, analysis, summary and insights.
 *
 * Every method is a pure function of its arguments.
 */
@Component
public class ProjectReportWriter {

    static final String FALLBACK_ANALYSIS = "Used fallback analysis due to AI service error.";

    // ------------------------------------------------------------------
    // Execution plan
    // ------------------------------------------------------------------

    public String executionPlan(List<TechnicalTask> tasks, ProjectBrief brief) {
        StringBuilder plan = new StringBuilder();
        plan.append("Execution Plan\n");
        plan.append("==============\n\n");

        plan.append("Project Overview:\n").append(brief.description()).append("\n\n");

        if (!brief.requirements().isEmpty()) {
            plan.append("Key Requirements:\n");
            brief.requirements().forEach(r -> plan.append("- ").append(r).append('\n'));
            plan.append('\n');
        }

        List<TechnicalTask> backend  = ofType(tasks, TaskType.BACKEND);
        List<TechnicalTask> frontend = ofType(tasks, TaskType.FRONTEND);

        plan.append("Phase 1 - Backend Development (").append(backend.size()).append(" tasks):\n");
        appendPhase(plan, backend);
        plan.append("\nPhase 2 - Frontend Development (").append(frontend.size()).append(" tasks):\n");
        appendPhase(plan, frontend);

        int totalHours = tasks.stream()
                .mapToInt(t -> t.estimatedHours() == null ? 0 : t.estimatedHours())
                .sum();
        if (totalHours > 0) {
            plan.append("\nTotal Estimated Time: ").append(totalHours).append(" hours\n");
        }
        plan.append("\nTotal Tasks: ").append(tasks.size());
        return plan.toString();
    }

    private static void appendPhase(StringBuilder plan, List<TechnicalTask> tasks) {
        for (int i = 0; i < tasks.size(); i++) {
            TechnicalTask task = tasks.get(i);
            plan.append("  ").append(i + 1).append(". ").append(task.title())
                .append(" [").append(task.priority() == null ? "medium" : task.priority().wireName()).append(" priority]\n");
            if (task.estimatedHours() != null && task.estimatedHours() > 0) {
                plan.append("     Estimated: ").append(task.estimatedHours()).append(" hours\n");
            }
        }
    }

    // ------------------------------------------------------------------
    // Analysis
    // ------------------------------------------------------------------

    public String analysis(ProjectBrief brief, List<TechnicalTask> tasks) {
        return "Project Analysis\n"
                + "================\n\n"
                + "Project Complexity: " + complexity(tasks) + "\n"
                + "Architecture Pattern: " + architecture(tasks) + "\n"
                + "Technology Stack: " + techStack(tasks) + "\n"
                + "Risk Factors: " + risks(brief, tasks) + "\n"
                + "Recommendations: " + recommendations(tasks) + "\n";
    }

    public String fallbackAnalysis() {
        return FALLBACK_ANALYSIS;
    }

    static String complexity(List<TechnicalTask> tasks) {
        int total = tasks.size();
        long high = countHigh(tasks);
        if (total <= 3) return "Simple";
        if (total <= 6) return "Moderate";
        if (high > total * 0.6) return "High";
        return "Complex";
    }

    static String architecture(List<TechnicalTask> tasks) {
        boolean auth     = anyTitleContains(tasks, "auth");
        boolean backend  = !ofType(tasks, TaskType.BACKEND).isEmpty();
        boolean frontend = !ofType(tasks, TaskType.FRONTEND).isEmpty();
        if (auth && backend && frontend) return "Full-Stack MVC";
        if (backend && frontend)         return "Client-Server";
        if (backend)                     return "API-First";
        return "Component-Based";
    }

    static String techStack(List<TechnicalTask> tasks) {
        List<String> stack = new ArrayList<>();
        if (!ofType(tasks, TaskType.FRONTEND).isEmpty()) stack.add("React+TypeScript");
        if (!ofType(tasks, TaskType.BACKEND).isEmpty())  stack.add("Node.js+Express");
        if (anyTitleContains(tasks, "database"))         stack.add("Database");
        if (anyTitleContains(tasks, "auth"))             stack.add("JWT Auth");
        return stack.isEmpty() ? "To be determined" : String.join(", ", stack);
    }

    static String risks(ProjectBrief brief, List<TechnicalTask> tasks) {
        List<String> risks = new ArrayList<>();
        if (tasks.size() > 8)      risks.add("Scope complexity");
        if (countHigh(tasks) > 4)  risks.add("High priority overload");
        if (brief.timeline() != null && brief.timeline().contains("week")) risks.add("Tight timeline");
        if (!anyTitleContains(tasks, "test")) risks.add("No testing strategy");
        return risks.isEmpty() ? "Low risk project" : String.join(", ", risks);
    }

    static String recommendations(List<TechnicalTask> tasks) {
        List<String> recs = new ArrayList<>();
        if (!anyTitleContains(tasks, "test"))   recs.add("Add testing tasks");
        if (!anyTitleContains(tasks, "deploy")) recs.add("Consider deployment strategy");
        if (tasks.size() > 6)                   recs.add("Consider MVP approach for initial release");
        recs.add("Implement CI/CD pipeline");
        recs.add("Add error monitoring and logging");
        return String.join(", ", recs);
    }

    // ------------------------------------------------------------------
    // Summary and insights
    // ------------------------------------------------------------------

    public String summary(List<AgentResponse> results) {
        long successful = results.stream().filter(AgentResponse::success).count();
        long failed     = results.size() - successful;

        StringBuilder summary = new StringBuilder();
        summary.append("Project Execution Summary\n");
        summary.append("=========================\n");
        summary.append("Total tasks: ").append(results.size()).append('\n');
        summary.append("Successful: ").append(successful).append('\n');
        summary.append("Failed: ").append(failed).append('\n');
        summary.append("Files generated: ").append(totalFiles(results)).append('\n');

        if (failed > 0) {
            summary.append("\nFailed tasks:\n");
            for (int i = 0; i < results.size(); i++) {
                AgentResponse r = results.get(i);
                if (!r.success()) {
                    summary.append("- Task ").append(i + 1).append(" (").append(r.taskId()).append("): ")
                           .append(r.error()).append('\n');
                }
            }
        }
        return summary.toString();
    }

    /** results and tasks are index-aligned. */
    public String insights(List<AgentResponse> results, List<TechnicalTask> tasks) {
        long successful = results.stream().filter(AgentResponse::success).count();
        long rate = results.isEmpty() ? 0 : Math.round(successful * 100.0 / results.size());

        StringBuilder insights = new StringBuilder();
        insights.append("Execution Insights\n");
        insights.append("==================\n\n");
        insights.append("Success Rate: ").append(rate).append("%\n");
        insights.append("Files Generated: ").append(totalFiles(results)).append('\n');
        insights.append("Task Completion: ").append(successful).append('/').append(results.size()).append("\n\n");

        if (successful < results.size()) {
            insights.append("Areas for Improvement:\n");
            for (int i = 0; i < results.size(); i++) {
                AgentResponse r = results.get(i);
                if (!r.success()) {
                    String title = i < tasks.size() ? tasks.get(i).title() : r.taskId();
                    insights.append("- ").append(title).append(": ").append(r.error()).append('\n');
                }
            }
            insights.append('\n');
        }

        insights.append("Recommendations:\n");
        if (successful == results.size()) {
            insights.append("- All tasks completed successfully.\n");
            insights.append("- Add automated tests for the generated code.\n");
            insights.append("- Review code quality before production deployment.\n");
        } else {
            insights.append("- Review failed tasks and retry with more specific requirements.\n");
            insights.append("- Break complex tasks into smaller ones.\n");
        }
        return insights.toString();
    }

    // ------------------------------------------------------------------

    private static List<TechnicalTask> ofType(List<TechnicalTask> tasks, TaskType type) {
        return tasks.stream().filter(t -> t.type() == type).toList();
    }

    private static long countHigh(List<TechnicalTask> tasks) {
        return tasks.stream().filter(t -> t.priority() == TaskPriority.HIGH).count();
    }

    private static boolean anyTitleContains(List<TechnicalTask> tasks, String keyword) {
        return tasks.stream().anyMatch(t -> t.title() != null && t.title().toLowerCase().contains(keyword));
    }

    private static int totalFiles(List<AgentResponse> results) {
        return results.stream().mapToInt(r -> r.files().size()).sum();
    }
}
