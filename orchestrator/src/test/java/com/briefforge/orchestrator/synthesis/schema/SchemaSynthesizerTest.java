package com.briefforge.orchestrator.synthesis.schema;

import com.briefforge.orchestrator.model.FileType;
import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.TaskPriority;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.synthesis.SubstringKeywordClassifier;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaSynthesizerTest {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-02T03:04:05Z"), ZoneOffset.UTC);

    static SchemaSynthesizer synthesizer(String dialect) {
        return new SchemaSynthesizer(
                new SchemaInferenceEngine(new SubstringKeywordClassifier(), CLOCK), dialect, CLOCK);
    }

    @Test
    void synthesize_writesTimestampedMigrationNamedAfterTitle() {
        TechnicalTask task = TechnicalTask.of("t-1", "Build User Auth!", "Login and register",
                TaskType.BACKEND, TaskPriority.HIGH, List.of(), 6);

        List<GeneratedFile> files = synthesizer("postgresql").synthesize(task);

        assertThat(files).hasSize(1);
        GeneratedFile migration = files.get(0);
        assertThat(migration.path()).isEqualTo("src/migrations/20250102030405_build-user-auth.sql");
        assertThat(migration.type()).isEqualTo(FileType.SCHEMA);
        assertThat(migration.content()).contains("CREATE TABLE IF NOT EXISTS users (");
    }

    @Test
    void synthesize_mysqlDialect_rendersMysqlTypes() {
        TechnicalTask task = TechnicalTask.of("t-1", "Account settings", "Profile page",
                TaskType.BACKEND, TaskPriority.LOW, List.of(), null);

        String sql = synthesizer("MySQL").synthesize(task).get(0).content();

        assertThat(sql).contains("-- Dialect: MYSQL").contains("TINYINT(1)");
    }

    @Test
    void constructor_unknownDialect_throws() {
        assertThatThrownBy(() -> synthesizer("oracle"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("oracle");
    }

    @Test
    void manifest_isBackendSchema() {
        assertThat(synthesizer("pg").manifest().name()).isEqualTo("schema");
        assertThat(synthesizer("pg").manifest().group()).isEqualTo(TaskType.BACKEND);
    }
}
