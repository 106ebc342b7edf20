package com.briefforge.orchestrator.reasoning;

import com.briefforge.orchestrator.decomposition.TaskDecomposer;
import com.briefforge.orchestrator.model.DecompositionSource;
import com.briefforge.orchestrator.model.ProjectBrief;
import com.briefforge.orchestrator.model.TaskPriority;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.reasoning.GeminiClient.GeminiApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decomposes a brief by asking a Gemini model for a JSON task array.
 *
 * <p>The first candidate model that answers a short ping is remembered for
 * the lifetime of this instance. Negotiation runs under the instance lock,
 * so concurrent briefs ping at most once.
 *
 * <p>Not a Spring component: {@code TaskDecomposerFactory} creates it only
 * when an API key is configured.
 */
public class ReasoningServiceAdapter implements TaskDecomposer {

    private static final Logger log = LoggerFactory.getLogger(ReasoningServiceAdapter.class);

    static final String PING_PROMPT = "Hello";

    static final String DEFAULT_DESCRIPTION = "AI generated task description";
    static final String DEFAULT_CRITERION   = "Task completion criteria to be defined";

    private static final String ANALYZE_PROMPT = """
            You are a senior software architect. Break the following project brief into
            concrete technical tasks for a small full-stack team.

            PROJECT DESCRIPTION:
            {{DESCRIPTION}}

            REQUIREMENTS:
            {{REQUIREMENTS}}

            CONSTRAINTS:
            {{CONSTRAINTS}}

            TIMELINE:
            {{TIMELINE}}

            Create between 4 and 8 tasks. Each task is either "frontend" (React + TypeScript)
            or "backend" (Node.js + Express + TypeScript, PostgreSQL).

            Respond with ONLY a JSON array, no prose, in this shape:
            [
              {
                "title": "Short imperative title",
                "description": "What has to be built and why",
                "type": "frontend" | "backend",
                "priority": "low" | "medium" | "high",
                "acceptance_criteria": ["Verifiable criterion", "..."],
                "estimated_hours": 8
              }
            ]
            "estimated_hours" is optional.
            """;

    private final GeminiClient  client;
    private final ObjectMapper  json;
    private final List<String>  candidateModels;

    private String negotiatedModel;   // guarded by this

    public ReasoningServiceAdapter(GeminiClient client, ObjectMapper json, List<String> candidateModels) {
        if (candidateModels == null || candidateModels.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate model is required");
        }
        this.client          = client;
        this.json            = json;
        this.candidateModels = List.copyOf(candidateModels);
    }

    @Override
    public List<TechnicalTask> decompose(ProjectBrief brief) {
        return analyze(brief);
    }

    @Override
    public DecompositionSource source() {
        return DecompositionSource.REASONING_SERVICE;
    }

    /**
     * @throws ReasoningException SERVICE_UNAVAILABLE when no model answers or the
     *         call fails; MALFORMED_RESPONSE when the reply has no usable task array
     */
    public List<TechnicalTask> analyze(ProjectBrief brief) {
        String model = negotiateModel();

        String reply;
        try {
            reply = client.generate(model, buildPrompt(brief));
        } catch (GeminiApiException e) {
            throw new ReasoningException(ReasoningException.Kind.SERVICE_UNAVAILABLE,
                    "Analyze call to " + model + " failed (status " + e.statusCode() + ")", e);
        }

        List<TechnicalTask> tasks = parseTasks(reply);
        log.info("Reasoning service ({}) returned {} task(s)", model, tasks.size());
        return tasks;
    }

    // ------------------------------------------------------------------
    // Model negotiation
    // ------------------------------------------------------------------

    /** Returns the cached model, probing candidates in order on first use. */
    synchronized String negotiateModel() {
        if (negotiatedModel != null) {
            return negotiatedModel;
        }
        for (String candidate : candidateModels) {
            try {
                client.generate(candidate, PING_PROMPT);
                negotiatedModel = candidate;
                log.info("Negotiated reasoning model: {}", candidate);
                return candidate;
            } catch (GeminiApiException e) {
                log.warn("Model {} unavailable (status {}): {}", candidate, e.statusCode(), e.getMessage());
            }
        }
        throw new ReasoningException(ReasoningException.Kind.SERVICE_UNAVAILABLE,
                "None of the candidate models answered: " + candidateModels);
    }

    // ------------------------------------------------------------------
    // Prompt and parsing
    // ------------------------------------------------------------------

    static String buildPrompt(ProjectBrief brief) {
        return ANALYZE_PROMPT
                .replace("{{DESCRIPTION}}", brief.description())
                .replace("{{REQUIREMENTS}}", bulletsOrDefault(brief.requirements()))
                .replace("{{CONSTRAINTS}}", bulletsOrDefault(brief.constraints()))
                .replace("{{TIMELINE}}", brief.timeline() == null || brief.timeline().isBlank()
                        ? "Not specified" : brief.timeline());
    }

    private static String bulletsOrDefault(List<String> items) {
        if (items.isEmpty()) {
            return "None specified";
        }
        StringBuilder sb = new StringBuilder();
        for (String item : items) {
            sb.append("- ").append(item).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    List<TechnicalTask> parseTasks(String reply) {
        String array = ResponseParser.extractTaskArray(reply)
                .orElseThrow(() -> new ReasoningException(ReasoningException.Kind.MALFORMED_RESPONSE,
                        "Reply contains no JSON array"));

        JsonNode root;
        try {
            root = json.readTree(array);
        } catch (JsonProcessingException e) {
            throw new ReasoningException(ReasoningException.Kind.MALFORMED_RESPONSE,
                    "Task array is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!root.isArray() || root.isEmpty()) {
            throw new ReasoningException(ReasoningException.Kind.MALFORMED_RESPONSE,
                    "Reply contains no tasks");
        }

        List<TechnicalTask> tasks = new ArrayList<>();
        int n = 1;
        for (JsonNode node : root) {
            tasks.add(toTask(node, n++));
        }
        return tasks;
    }

    /** Missing or invalid fields fall back to fixed defaults rather than failing the batch. */
    private static TechnicalTask toTask(JsonNode node, int n) {
        String title       = textOr(node.path("title"), "AI Generated Task " + n);
        String description = textOr(node.path("description"), DEFAULT_DESCRIPTION);
        TaskType type      = TaskType.fromWire(node.path("type").asText(""));
        TaskPriority prio  = TaskPriority.fromWire(node.path("priority").asText(""));

        List<String> criteria = new ArrayList<>();
        for (JsonNode c : node.path("acceptance_criteria")) {
            if (c.isTextual() && !c.asText().isBlank()) {
                criteria.add(c.asText());
            }
        }
        if (criteria.isEmpty()) {
            criteria.add(DEFAULT_CRITERION);
        }

        // Whole, positive and within int range; anything else is treated as unknown.
        JsonNode hours = node.path("estimated_hours");
        Integer estimatedHours = hours.isIntegralNumber() && hours.canConvertToInt() && hours.intValue() > 0
                ? hours.intValue() : null;

        return TechnicalTask.of("ai-task-" + n, title, description, type, prio, criteria, estimatedHours);
    }

    private static String textOr(JsonNode node, String fallback) {
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : fallback;
    }
}
