package com.briefforge.orchestrator.synthesis;

import com.briefforge.orchestrator.model.TaskPriority;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TaskText and the default substring classifier. Both are pure helpers.
 */
class TaskTextTest {

    private final KeywordClassifier classifier = new SubstringKeywordClassifier();

    @Test
    void combined_joinsTitleDescriptionAndCriteriaLowerCased() {
        TechnicalTask task = TechnicalTask.of("1", "Build API", "With Auth", TaskType.BACKEND,
                TaskPriority.HIGH, List.of("Uses JWT"), null);

        assertThat(TaskText.combined(task)).isEqualTo("build api with auth uses jwt");
    }

    @Test
    void slug_collapsesSeparatorsAndNeverEmpty() {
        assertThat(TaskText.slug("Build User Auth!")).isEqualTo("build-user-auth");
        assertThat(TaskText.slug("  --  ")).isEqualTo("task");
        assertThat(TaskText.slug("x".repeat(80))).hasSize(50);
    }

    @Test
    void pascalCase_joinsWords() {
        assertThat(TaskText.pascalCase("build user auth")).isEqualTo("BuildUserAuth");
        assertThat(TaskText.pascalCase("!!")).isEqualTo("Generated");
    }

    @Test
    void matchedKeywords_isCaseInsensitiveSubstringInKeywordOrder() {
        assertThat(classifier.matchedKeywords("Product CATALOG for Username", List.of("user", "log", "cart")))
                .containsExactly("user", "log");
        assertThat(classifier.matchesAny(null, List.of("user"))).isFalse();
        assertThat(classifier.matchesAny("   ", List.of("user"))).isFalse();
    }
}
