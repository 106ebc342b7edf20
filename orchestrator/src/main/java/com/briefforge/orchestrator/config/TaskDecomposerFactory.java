package com.briefforge.orchestrator.config;

import com.briefforge.orchestrator.decomposition.FallbackTaskDecomposer;
import com.briefforge.orchestrator.decomposition.TaskDecomposer;
import com.briefforge.orchestrator.reasoning.GeminiClient;
import com.briefforge.orchestrator.reasoning.ReasoningServiceAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.Arrays;
import java.util.List;

/**
 * Chooses the primary {@link TaskDecomposer} once, at startup.
 *
 * A configured API key selects the reasoning service; a blank key makes the
 * rule-based decomposer primary, so every brief reports the fallback path.
 */
@Configuration
public class TaskDecomposerFactory {

    private static final Logger log = LoggerFactory.getLogger(TaskDecomposerFactory.class);

    @Bean
    @Primary
    public TaskDecomposer primaryTaskDecomposer(
            @Value("${briefforge.reasoning.api-key:}") String apiKey,
            @Value("${briefforge.reasoning.candidate-models:gemini-2.5-flash,gemini-2.0-flash,gemini-2.5-pro,gemini-1.5-flash,gemini-1.5-pro}")
            String candidateModels,
            GeminiClient geminiClient,
            ObjectMapper objectMapper,
            FallbackTaskDecomposer fallback) {

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("briefforge.reasoning.api-key is not set; briefs will be decomposed by keyword rules only");
            return fallback;
        }

        List<String> models = parseModels(candidateModels);
        log.info("Reasoning service enabled, candidate models: {}", models);
        return new ReasoningServiceAdapter(geminiClient, objectMapper, models);
    }

    static List<String> parseModels(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
