package com.briefforge.orchestrator.reasoning;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Gemini {@code generateContent} endpoint.
 *
 * One prompt in, one text reply out. Model selection is the caller's job.
 */
@Component
public class GeminiClient {

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** The subset of the response we read: candidates[0].content.parts[0].text. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GenerateContentResponse(List<Candidate> candidates) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Candidate(Content content) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Content(List<Part> parts) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Part(String text) {}

        public String firstText() {
            if (candidates == null || candidates.isEmpty()) {
                throw new IllegalStateException("No candidates in response");
            }
            Content content = candidates.get(0).content();
            if (content == null || content.parts() == null || content.parts().isEmpty()) {
                throw new IllegalStateException("No content parts in first candidate");
            }
            return content.parts().get(0).text();
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiVersion;
    private final String       apiKey;
    private final Duration     requestTimeout;

    public GeminiClient(@Value("${briefforge.reasoning.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
                        @Value("${briefforge.reasoning.api-version:v1beta}") String apiVersion,
                        @Value("${briefforge.reasoning.api-key:}") String apiKey,
                        @Value("${briefforge.reasoning.request-timeout-seconds:60}") long requestTimeoutSeconds,
                        ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiVersion     = apiVersion;
        this.apiKey         = apiKey;
        this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send one prompt to the given model and return the text of the first candidate.
     *
     * @param model e.g. "gemini-2.5-flash"
     * @throws GeminiApiException on a non-200 reply (with its status) or on any
     *         transport or decoding failure (status -1)
     */
    public String generate(String model, String prompt) {
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt))))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create("%s/%s/models/%s:generateContent".formatted(baseUrl, apiVersion, model)))
                    .timeout(requestTimeout)
                    .header("content-type",   "application/json")
                    .header("x-goog-api-key", apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new GeminiApiException(response.statusCode(), response.body());
            }

            return json.readValue(response.body(), GenerateContentResponse.class).firstText();

        } catch (GeminiApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeminiApiException("Gemini call interrupted", e);
        } catch (IOException | RuntimeException e) {
            throw new GeminiApiException("Gemini call failed: " + e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class GeminiApiException extends RuntimeException {
        private final int statusCode;

        public GeminiApiException(int statusCode, String body) {
            super("Gemini API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }

        /** Transport-level failure; no HTTP status available. */
        public GeminiApiException(String message, Throwable cause) {
            super(message, cause);
            this.statusCode = -1;
        }

        public int statusCode() { return statusCode; }
    }
}
