package com.briefforge.orchestrator.synthesis.schema;

import com.briefforge.orchestrator.model.FileType;
import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.synthesis.Synthesizer;
import com.briefforge.orchestrator.synthesis.SynthesizerManifest;
import com.briefforge.orchestrator.synthesis.TaskText;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Emits one SQL migration per backend task.
 *
 * Every backend task gets a migration: when no family matches, the generic
 * entity table is used, so the output is never empty.
 */
@Component
public class SchemaSynthesizer implements Synthesizer {

    private static final SynthesizerManifest MANIFEST = new SynthesizerManifest(
            "schema", TaskType.BACKEND, 10,
            "Relational schema migration inferred from task keywords");

    private static final DateTimeFormatter MIGRATION_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final SchemaInferenceEngine engine;
    private final SqlDialect            dialect;
    private final Clock                 clock;

    public SchemaSynthesizer(SchemaInferenceEngine engine,
                             @Value("${briefforge.schema.dialect:postgresql}") String dialect,
                             Clock clock) {
        this.engine  = engine;
        this.dialect = SqlDialect.fromConfig(dialect);
        this.clock   = clock;
    }

    @Override
    public SynthesizerManifest manifest() {
        return MANIFEST;
    }

    @Override
    public List<GeneratedFile> synthesize(TechnicalTask task) {
        List<DatabaseTable> tables = engine.inferSchema(task);
        String path = "src/migrations/%s_%s.sql".formatted(
                MIGRATION_STAMP.format(clock.instant()), TaskText.slug(task.title()));
        return List.of(new GeneratedFile(path, engine.emitSql(tables, dialect), FileType.SCHEMA));
    }
}
