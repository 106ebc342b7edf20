package com.briefforge.orchestrator.reasoning;

import java.util.Optional;

/**
 * Pulls the JSON task array out of a free-text model reply.
 *
 * Models often wrap the array in prose or a markdown fence, so the parser
 * takes everything from the first '[' to the last ']'.
 */
public class ResponseParser {

    private ResponseParser() {}

    /**
     * @return the candidate array text, or empty when the reply has no
     *         '[' ... ']' span
     */
    public static Optional<String> extractTaskArray(String response) {
        if (response == null) {
            return Optional.empty();
        }
        int start = response.indexOf('[');
        int end   = response.lastIndexOf(']');
        return start >= 0 && end > start
                ? Optional.of(response.substring(start, end + 1))
                : Optional.empty();
    }
}
