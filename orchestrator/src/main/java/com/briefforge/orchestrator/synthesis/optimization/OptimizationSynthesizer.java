package com.briefforge.orchestrator.synthesis.optimization;

import com.briefforge.orchestrator.model.FileType;
import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.synthesis.Synthesizer;
import com.briefforge.orchestrator.synthesis.SynthesizerManifest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Emits the same four database artifacts for every backend task: a pooled
 * connection with a base repository, query builders, a TTL cache and
 * maintenance helpers. Repeats across tasks are collapsed at assembly.
 */
@Component
public class OptimizationSynthesizer implements Synthesizer {

    private static final SynthesizerManifest MANIFEST = new SynthesizerManifest(
            "optimization", TaskType.BACKEND, 40,
            "Connection pooling, query builders, caching and database maintenance helpers");

    static final String DATABASE_PATH           = "src/config/database.ts";
    static final String QUERY_OPTIMIZATION_PATH = "src/utils/queryOptimization.ts";
    static final String CACHE_PATH              = "src/utils/cache.ts";
    static final String DATABASE_HELPERS_PATH   = "src/utils/databaseHelpers.ts";

    @Override
    public SynthesizerManifest manifest() {
        return MANIFEST;
    }

    /** Output does not depend on the task. */
    @Override
    public List<GeneratedFile> synthesize(TechnicalTask task) {
        return synthesize();
    }

    public List<GeneratedFile> synthesize() {
        return List.of(
                new GeneratedFile(DATABASE_PATH,           OptimizationTemplates.DATABASE,           FileType.CONFIG),
                new GeneratedFile(QUERY_OPTIMIZATION_PATH, OptimizationTemplates.QUERY_OPTIMIZATION, FileType.OTHER),
                new GeneratedFile(CACHE_PATH,              OptimizationTemplates.CACHE,              FileType.OTHER),
                new GeneratedFile(DATABASE_HELPERS_PATH,   OptimizationTemplates.DATABASE_HELPERS,   FileType.OTHER));
    }
}
