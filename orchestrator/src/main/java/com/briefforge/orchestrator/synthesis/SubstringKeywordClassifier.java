package com.briefforge.orchestrator.synthesis;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Default classifier: case-insensitive substring containment.
 *
 * Imprecise on purpose. "user" matches "username", "log" matches "catalog".
 * Callers rely on these exact semantics for reproducible output.
 */
@Component
public class SubstringKeywordClassifier implements KeywordClassifier {

    @Override
    public List<String> matchedKeywords(String text, List<String> keywords) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lowerText = text.toLowerCase();
        var matched = new ArrayList<String>();
        for (String keyword : keywords) {
            if (lowerText.contains(keyword.toLowerCase())) {
                matched.add(keyword);
            }
        }
        return matched;
    }
}
