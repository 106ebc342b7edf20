package com.briefforge.orchestrator.reasoning;

import com.briefforge.orchestrator.model.ProjectBrief;
import com.briefforge.orchestrator.model.TaskPriority;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.reasoning.GeminiClient.GeminiApiException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ReasoningServiceAdapter.
 *
 * GeminiClient is mocked; prompts are matched by content so ping calls
 * and analyze calls can be told apart.
 */
@ExtendWith(MockitoExtension.class)
class ReasoningServiceAdapterTest {

    static final String REPLY = """
            Sure! Here are the tasks:
            [
              {"title": "Build API", "description": "Express routes", "type": "backend",
               "priority": "high", "acceptance_criteria": ["Routes respond"], "estimated_hours": 6},
              {"title": "Build UI", "type": "frontend", "priority": "urgent",
               "acceptance_criteria": [], "estimated_hours": "six"}
            ]
            """;

    @Mock GeminiClient client;

    ReasoningServiceAdapter adapter;
    ProjectBrief brief = new ProjectBrief("Todo app", List.of("Login"), List.of(), "2 weeks");

    @BeforeEach
    void setUp() {
        adapter = new ReasoningServiceAdapter(client, new ObjectMapper(), List.of("model-a", "model-b"));
    }

    // ------------------------------------------------------------------
    // Model negotiation
    // ------------------------------------------------------------------

    @Test
    void analyze_negotiatesModelOnceAcrossCalls() {
        when(client.generate("model-a", ReasoningServiceAdapter.PING_PROMPT)).thenReturn("Hi");
        when(client.generate(eq("model-a"), contains("PROJECT DESCRIPTION")))
                .thenReturn(REPLY);

        adapter.analyze(brief);
        adapter.analyze(brief);

        verify(client, times(1)).generate("model-a", ReasoningServiceAdapter.PING_PROMPT);
        verify(client, never()).generate(eq("model-b"), anyString());
    }

    @Test
    void negotiateModel_firstCandidateFails_usesSecond() {
        when(client.generate("model-a", ReasoningServiceAdapter.PING_PROMPT))
                .thenThrow(new GeminiApiException(404, "not found"));
        when(client.generate("model-b", ReasoningServiceAdapter.PING_PROMPT)).thenReturn("Hi");

        assertThat(adapter.negotiateModel()).isEqualTo("model-b");
    }

    @Test
    void negotiateModel_allCandidatesFail_throwsServiceUnavailable() {
        when(client.generate(anyString(), eq(ReasoningServiceAdapter.PING_PROMPT)))
                .thenThrow(new GeminiApiException(503, "overloaded"));

        assertThatThrownBy(() -> adapter.analyze(brief))
                .isInstanceOf(ReasoningException.class)
                .satisfies(e -> assertThat(((ReasoningException) e).getKind())
                        .isEqualTo(ReasoningException.Kind.SERVICE_UNAVAILABLE));
    }

    @Test
    void analyze_generateFails_throwsServiceUnavailable() {
        when(client.generate("model-a", ReasoningServiceAdapter.PING_PROMPT)).thenReturn("Hi");
        when(client.generate(eq("model-a"), contains("PROJECT DESCRIPTION")))
                .thenThrow(new GeminiApiException(500, "internal"));

        assertThatThrownBy(() -> adapter.analyze(brief))
                .isInstanceOf(ReasoningException.class)
                .hasMessageContaining("SERVICE_UNAVAILABLE")
                .hasMessageContaining("status 500");
    }

    @Test
    void constructor_noCandidates_throws() {
        assertThatThrownBy(() -> new ReasoningServiceAdapter(client, new ObjectMapper(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    @Test
    void parseTasks_appliesDefaultsForMissingAndInvalidFields() {
        List<TechnicalTask> tasks = adapter.parseTasks(REPLY);

        assertThat(tasks).hasSize(2);

        TechnicalTask api = tasks.get(0);
        assertThat(api.id()).isEqualTo("ai-task-1");
        assertThat(api.type()).isEqualTo(TaskType.BACKEND);
        assertThat(api.priority()).isEqualTo(TaskPriority.HIGH);
        assertThat(api.estimatedHours()).isEqualTo(6);

        TechnicalTask ui = tasks.get(1);
        assertThat(ui.id()).isEqualTo("ai-task-2");
        assertThat(ui.description()).isEqualTo(ReasoningServiceAdapter.DEFAULT_DESCRIPTION);
        assertThat(ui.priority()).isEqualTo(TaskPriority.MEDIUM);
        assertThat(ui.acceptanceCriteria()).containsExactly(ReasoningServiceAdapter.DEFAULT_CRITERION);
        assertThat(ui.estimatedHours()).isNull();
    }

    @Test
    void parseTasks_fractionalNegativeZeroOrOversizedHours_becomeUnknown() {
        List<TechnicalTask> tasks = adapter.parseTasks("""
                [{"estimated_hours": 6.5}, {"estimated_hours": -3}, {"estimated_hours": 0},
                 {"estimated_hours": 99999999999}, {"estimated_hours": 12}]
                """);

        assertThat(tasks).extracting(TechnicalTask::estimatedHours)
                .containsExactly(null, null, null, null, 12);
    }

    @Test
    void parseTasks_missingTitle_usesNumberedTitle() {
        List<TechnicalTask> tasks = adapter.parseTasks("[{}, {}]");

        assertThat(tasks).extracting(TechnicalTask::title)
                .containsExactly("AI Generated Task 1", "AI Generated Task 2");
    }

    @Test
    void parseTasks_noArray_throwsMalformed() {
        assertThatThrownBy(() -> adapter.parseTasks("No tasks today"))
                .isInstanceOf(ReasoningException.class)
                .hasMessageContaining("MALFORMED_RESPONSE");
    }

    @Test
    void parseTasks_invalidJson_throwsMalformed() {
        assertThatThrownBy(() -> adapter.parseTasks("[{\"title\": }]"))
                .isInstanceOf(ReasoningException.class)
                .hasMessageContaining("MALFORMED_RESPONSE");
    }

    @Test
    void parseTasks_emptyArray_throwsMalformed() {
        assertThatThrownBy(() -> adapter.parseTasks("[]"))
                .isInstanceOf(ReasoningException.class)
                .hasMessageContaining("no tasks");
    }

    // ------------------------------------------------------------------
    // Prompt
    // ------------------------------------------------------------------

    @Test
    void buildPrompt_fillsEveryPlaceholder() {
        String prompt = ReasoningServiceAdapter.buildPrompt(brief);

        assertThat(prompt).contains("Todo app", "- Login", "None specified", "2 weeks");
        assertThat(prompt).doesNotContain("{{");
    }

    @Test
    void buildPrompt_missingTimeline_saysNotSpecified() {
        assertThat(ReasoningServiceAdapter.buildPrompt(ProjectBrief.of("x"))).contains("Not specified");
    }
}
