package com.briefforge.orchestrator.synthesis;

import com.briefforge.orchestrator.model.FileType;
import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.TaskPriority;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for SynthesizerRegistry.
 * No Spring context; the synthesizers are stubs defined below.
 */
class SynthesizerRegistryTest {

    SimpleMeterRegistry meters;
    SynthesizerRegistry registry;

    TechnicalTask task = TechnicalTask.of("t-1", "Title", "Description",
            TaskType.BACKEND, TaskPriority.MEDIUM, List.of(), null);

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        registry = new SynthesizerRegistry(List.of(
                new Fixed("late", TaskType.BACKEND, 30, "src/late.ts"),
                new Fixed("early", TaskType.BACKEND, 10, "src/early.ts"),
                new Fixed("ui", TaskType.FRONTEND, 10, "src/App.tsx"),
                new Failing("broken", TaskType.FRONTEND, 20, new IllegalStateException("boom")),
                new Failing("rejecting", TaskType.FRONTEND, 30,
                        new SynthesisException(SynthesisException.Kind.INVALID_INPUT, "bad task"))),
                meters);
    }

    // ------------------------------------------------------------------
    // Registration and lookup
    // ------------------------------------------------------------------

    @Test
    void constructor_duplicateName_throws() {
        assertThatThrownBy(() -> new SynthesizerRegistry(List.of(
                new Fixed("same", TaskType.BACKEND, 1, "a"),
                new Fixed("same", TaskType.FRONTEND, 2, "b")), meters))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("same");
    }

    @Test
    void get_unknownName_throwsNotFound() {
        assertThatThrownBy(() -> registry.get("nope"))
                .isInstanceOf(SynthesizerNotFoundException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void forGroup_sortsByManifestOrder() {
        assertThat(registry.forGroup(TaskType.BACKEND))
                .extracting(s -> s.manifest().name())
                .containsExactly("early", "late");
        assertThat(registry.synthesizerNames()).containsExactly("broken", "early", "late", "rejecting", "ui");
    }

    // ------------------------------------------------------------------
    // Execution and metrics
    // ------------------------------------------------------------------

    @Test
    void synthesizeGroup_concatenatesInOrder() {
        assertThat(registry.synthesizeGroup(TaskType.BACKEND, task))
                .extracting(GeneratedFile::path)
                .containsExactly("src/early.ts", "src/late.ts");
    }

    @Test
    void synthesize_success_recordsTimerAndCounter() {
        registry.synthesize("early", task);

        assertThat(meters.get("briefforge.synthesizer.calls")
                .tags("synthesizer", "early", "status", "success").counter().count()).isEqualTo(1.0);
        assertThat(meters.get("briefforge.synthesizer.duration")
                .tags("synthesizer", "early", "group", "backend").timer().count()).isEqualTo(1);
    }

    @Test
    void synthesize_unexpectedException_wrappedAsGenerationError() {
        assertThatThrownBy(() -> registry.synthesize("broken", task))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("[GENERATION_ERROR]")
                .hasMessageContaining("boom")
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(meters.get("briefforge.synthesizer.calls")
                .tags("synthesizer", "broken", "status", "generation_error").counter().count()).isEqualTo(1.0);
    }

    @Test
    void synthesize_synthesisException_propagatesWithItsKind() {
        assertThatThrownBy(() -> registry.synthesize("rejecting", task))
                .isInstanceOf(SynthesisException.class)
                .satisfies(e -> assertThat(((SynthesisException) e).getKind())
                        .isEqualTo(SynthesisException.Kind.INVALID_INPUT));

        assertThat(meters.get("briefforge.synthesizer.calls")
                .tags("synthesizer", "rejecting", "status", "invalid_input").counter().count()).isEqualTo(1.0);
    }

    @Test
    void synthesize_nullFileList_reportedAsGenerationError() {
        SynthesizerRegistry registry = new SynthesizerRegistry(
                List.of(new Returning("silent", null)), meters);

        assertThatThrownBy(() -> registry.synthesize("silent", task))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("[GENERATION_ERROR]")
                .hasMessageContaining("silent");
        assertThat(meters.get("briefforge.synthesizer.calls")
                .tags("synthesizer", "silent", "status", "generation_error").counter().count()).isEqualTo(1.0);
    }

    @Test
    void synthesize_fileWithoutType_reportedAsGenerationError() {
        SynthesizerRegistry registry = new SynthesizerRegistry(List.of(new Returning("untyped",
                List.of(new GeneratedFile("src/a.ts", "a", null)))), meters);

        assertThatThrownBy(() -> registry.synthesize("untyped", task))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("incomplete file");
    }

    @Test
    void synthesizeGroup_firstFailureAbortsGroup() {
        assertThatThrownBy(() -> registry.synthesizeGroup(TaskType.FRONTEND, task))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("boom");
        assertThat(meters.find("briefforge.synthesizer.calls").tags("synthesizer", "rejecting").counter()).isNull();
    }

    // ------------------------------------------------------------------

    private static class Fixed implements Synthesizer {
        private final SynthesizerManifest manifest;
        private final String path;

        Fixed(String name, TaskType group, int order, String path) {
            this.manifest = new SynthesizerManifest(name, group, order, "test");
            this.path = path;
        }

        @Override public SynthesizerManifest manifest() { return manifest; }

        @Override
        public List<GeneratedFile> synthesize(TechnicalTask task) {
            return List.of(new GeneratedFile(path, "// " + task.title(), FileType.OTHER));
        }
    }

    private static class Returning implements Synthesizer {
        private final SynthesizerManifest manifest;
        private final List<GeneratedFile> files;

        Returning(String name, List<GeneratedFile> files) {
            this.manifest = new SynthesizerManifest(name, TaskType.BACKEND, 1, "test");
            this.files = files;
        }

        @Override public SynthesizerManifest manifest() { return manifest; }

        @Override
        public List<GeneratedFile> synthesize(TechnicalTask task) {
            return files;
        }
    }

    private static class Failing implements Synthesizer {
        private final SynthesizerManifest manifest;
        private final RuntimeException error;

        Failing(String name, TaskType group, int order, RuntimeException error) {
            this.manifest = new SynthesizerManifest(name, group, order, "test");
            this.error = error;
        }

        @Override public SynthesizerManifest manifest() { return manifest; }

        @Override
        public List<GeneratedFile> synthesize(TechnicalTask task) {
            throw error;
        }
    }
}
