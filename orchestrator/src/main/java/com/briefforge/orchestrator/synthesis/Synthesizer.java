package com.briefforge.orchestrator.synthesis;

import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.TechnicalTask;

import java.util.List;

/**
 * A deterministic producer of source artifacts for one task.
 *
 * <p>Implementations must be pure functions of the task: no I/O, no mutable
 * state, same input gives the same files. A task that matches none of the
 * synthesizer's keyword families yields an empty list, never an exception.
 *
 * <p>Implementations are registered as Spring {@code @Component}s and are
 * discovered automatically by {@link SynthesizerRegistry}.
 */
public interface Synthesizer {

    /** Static metadata: name, group and run order. */
    SynthesizerManifest manifest();

    List<GeneratedFile> synthesize(TechnicalTask task);
}
