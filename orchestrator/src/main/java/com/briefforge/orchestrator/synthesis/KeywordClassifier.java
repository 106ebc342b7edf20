package com.briefforge.orchestrator.synthesis;

import java.util.List;

/**
 * Decides which keywords of a family occur in a piece of task text.
 *
 * Every synthesizer routes through this interface instead of calling
 * {@code String.contains} directly, so a smarter matcher can replace the
 * default substring rules without touching the synthesizers.
 */
public interface KeywordClassifier {

    /**
     * @param text     text to scan; may be null or blank
     * @param keywords lower-case keywords of one family
     * @return the keywords found, in the order they were given; empty if none
     */
    List<String> matchedKeywords(String text, List<String> keywords);

    default boolean matchesAny(String text, List<String> keywords) {
        return !matchedKeywords(text, keywords).isEmpty();
    }
}
