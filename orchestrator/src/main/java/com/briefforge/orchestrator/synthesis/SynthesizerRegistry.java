package com.briefforge.orchestrator.synthesis;

import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process synthesizer registry.
 *
 * All {@link Synthesizer} beans are collected at startup via constructor
 * injection and grouped by the task type they serve.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Lookup by name ({@link #get}) and by group ({@link #forGroup}).</li>
 *   <li>Metrics-instrumented execution ({@link #synthesize}): every call is
 *       timed and counted, with no per-synthesizer boilerplate.</li>
 *   <li>Group routing ({@link #synthesizeGroup}): runs every synthesizer of a
 *       group in manifest order and concatenates their output.</li>
 * </ol>
 */
@Component
public class SynthesizerRegistry {

    private static final Logger log = LoggerFactory.getLogger(SynthesizerRegistry.class);

    private final Map<String, Synthesizer> synthesizers = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public SynthesizerRegistry(List<Synthesizer> allSynthesizers, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (Synthesizer synthesizer : allSynthesizers) {
            SynthesizerManifest m = synthesizer.manifest();
            if (synthesizers.putIfAbsent(m.name(), synthesizer) != null) {
                throw new IllegalStateException("Duplicate synthesizer name: " + m.name());
            }
            log.info("Registered synthesizer '{}' [{}#{}] - {}",
                    m.name(), m.group(), m.order(), m.description());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Synthesizer get(String name) {
        Synthesizer synthesizer = synthesizers.get(name);
        if (synthesizer == null) {
            throw new SynthesizerNotFoundException(name);
        }
        return synthesizer;
    }

    /** Synthesizers serving the given task type, in run order. */
    public List<Synthesizer> forGroup(TaskType group) {
        return synthesizers.values().stream()
                .filter(s -> s.manifest().group() == group)
                .sorted(Comparator.comparingInt((Synthesizer s) -> s.manifest().order())
                        .thenComparing(s -> s.manifest().name()))
                .toList();
    }

    /** Returns all registered synthesizer names (sorted). */
    public List<String> synthesizerNames() {
        return synthesizers.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Run a named synthesizer with full observability.
     *
     * <pre>
     *   briefforge.synthesizer.calls{synthesizer, status="success|invalid_input|generation_error"}
     *   briefforge.synthesizer.duration{synthesizer, group="backend|frontend"}
     * </pre>
     *
     * Any unexpected exception, and any output that breaks the
     * {@link Synthesizer} contract, is reported as a GENERATION_ERROR so the
     * caller only has to handle {@link SynthesisException}.
     */
    public List<GeneratedFile> synthesize(String name, TechnicalTask task) {
        Synthesizer synthesizer = get(name);
        String groupTag = synthesizer.manifest().group().name().toLowerCase();

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return checkOutput(name, synthesizer.synthesize(task));
        } catch (SynthesisException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (Exception e) {
            status = "generation_error";
            throw new SynthesisException(SynthesisException.Kind.GENERATION_ERROR,
                    "Unexpected error in synthesizer '" + name + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("briefforge.synthesizer.duration",
                    "synthesizer", name, "group", groupTag));
            meterRegistry.counter("briefforge.synthesizer.calls",
                    "synthesizer", name, "status", status).increment();
        }
    }

    /** A null list, a null file, or a file without path, content or type breaks the contract. */
    private static List<GeneratedFile> checkOutput(String name, List<GeneratedFile> files) {
        if (files == null) {
            throw new SynthesisException(SynthesisException.Kind.GENERATION_ERROR,
                    "Synthesizer '" + name + "' returned no file list");
        }
        for (GeneratedFile file : files) {
            if (file == null || file.path() == null || file.content() == null || file.type() == null) {
                throw new SynthesisException(SynthesisException.Kind.GENERATION_ERROR,
                        "Synthesizer '" + name + "' returned an incomplete file: " + file);
            }
        }
        return files;
    }

    /**
     * Run every synthesizer of the task's group and concatenate the files.
     * The first failure aborts the group; the coordinator decides what to do.
     */
    public List<GeneratedFile> synthesizeGroup(TaskType group, TechnicalTask task) {
        List<GeneratedFile> files = new ArrayList<>();
        for (Synthesizer synthesizer : forGroup(group)) {
            List<GeneratedFile> produced = synthesize(synthesizer.manifest().name(), task);
            log.debug("Synthesizer '{}' produced {} file(s)", synthesizer.manifest().name(), produced.size());
            files.addAll(produced);
        }
        return files;
    }
}
