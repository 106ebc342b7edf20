package com.briefforge.orchestrator.assembly;

import com.briefforge.orchestrator.model.FileType;
import com.briefforge.orchestrator.model.GeneratedFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ArtifactAssembler: path uniqueness, collision handling
 * and placement of files that are not already under src/.
 */
class ArtifactAssemblerTest {

    private final ArtifactAssembler assembler = new ArtifactAssembler();

    // ------------------------------------------------------------------
    // assemble
    // ------------------------------------------------------------------

    @Test
    void assemble_identicalContent_keepsSingleCopy() {
        GeneratedFile cache = new GeneratedFile("src/utils/cache.ts", "export {}", FileType.OTHER);

        List<GeneratedFile> result = assembler.assemble(List.of(List.of(cache), List.of(cache)));

        assertThat(result).containsExactly(cache);
    }

    @Test
    void assemble_differentContent_renamesLaterCopies() {
        List<GeneratedFile> result = assembler.assemble(List.of(
                List.of(new GeneratedFile("src/utils/cache.ts", "v1", FileType.OTHER)),
                List.of(new GeneratedFile("src/utils/cache.ts", "v2", FileType.OTHER)),
                List.of(new GeneratedFile("src/utils/cache.ts", "v3", FileType.OTHER))));

        assertThat(result).extracting(GeneratedFile::path).containsExactly(
                "src/utils/cache.ts", "src/utils/cache-2.ts", "src/utils/cache-3.ts");
        assertThat(result).extracting(GeneratedFile::content).containsExactly("v1", "v2", "v3");
    }

    @Test
    void assemble_copyMatchingRenamedVersion_isDropped() {
        List<GeneratedFile> result = assembler.assemble(List.of(
                List.of(new GeneratedFile("src/jobs/scheduler.ts", "A", FileType.OTHER)),
                List.of(new GeneratedFile("src/jobs/scheduler.ts", "B", FileType.OTHER)),
                List.of(new GeneratedFile("src/jobs/scheduler.ts", "B", FileType.OTHER)),
                List.of(new GeneratedFile("src/jobs/scheduler.ts", "A", FileType.OTHER))));

        assertThat(result).extracting(GeneratedFile::path)
                .containsExactly("src/jobs/scheduler.ts", "src/jobs/scheduler-2.ts");
        assertThat(result).extracting(GeneratedFile::content).containsExactly("A", "B");
    }

    @Test
    void assemble_neverEmitsSameContentTwiceForOnePath() {
        List<GeneratedFile> result = assembler.assemble(List.of(
                List.of(new GeneratedFile("src/jobs/scheduler.ts", "A", FileType.OTHER)),
                List.of(new GeneratedFile("src/jobs/scheduler.ts", "B", FileType.OTHER)),
                List.of(new GeneratedFile("src/jobs/scheduler.ts", "C", FileType.OTHER)),
                List.of(new GeneratedFile("src/jobs/scheduler.ts", "B", FileType.OTHER)),
                List.of(new GeneratedFile("src/jobs/scheduler.ts", "C", FileType.OTHER))));

        assertThat(result).extracting(GeneratedFile::content).containsExactly("A", "B", "C");
    }

    @Test
    void assemble_keepsFirstAppearanceOrder() {
        List<GeneratedFile> result = assembler.assemble(List.of(
                List.of(file("src/a.ts"), file("src/b.ts")),
                List.of(file("src/c.ts"), file("src/a.ts"))));

        assertThat(result).extracting(GeneratedFile::path).containsExactly("src/a.ts", "src/b.ts", "src/c.ts");
    }

    @Test
    void assemble_noLists_returnsEmpty() {
        assertThat(assembler.assemble(List.of())).isEmpty();
    }

    // ------------------------------------------------------------------
    // normalize and inferType
    // ------------------------------------------------------------------

    @Test
    void normalize_pathUnderSrc_isUnchanged() {
        GeneratedFile file = new GeneratedFile("src/jobs/scheduler.ts", "x", FileType.OTHER);

        assertThat(assembler.normalize(file)).isEqualTo(file);
    }

    @Test
    void normalize_placesLooseFilesByType() {
        assertThat(assembler.normalize(new GeneratedFile("UserController.ts", "x", FileType.API)).path())
                .isEqualTo("src/controllers/UserController.ts");
        assertThat(assembler.normalize(new GeneratedFile("api/userRoutes.ts", "x", FileType.API)).path())
                .isEqualTo("src/routes/userRoutes.ts");
        assertThat(assembler.normalize(new GeneratedFile("client.ts", "x", FileType.API)).path())
                .isEqualTo("src/api/client.ts");
        assertThat(assembler.normalize(new GeneratedFile("User.ts", "x", FileType.SCHEMA)).path())
                .isEqualTo("src/models/User.ts");
        assertThat(assembler.normalize(new GeneratedFile("Button.tsx", "x", FileType.COMPONENT)).path())
                .isEqualTo("src/components/Button.tsx");
        assertThat(assembler.normalize(new GeneratedFile("helpers.ts", "x", FileType.OTHER)).path())
                .isEqualTo("src/utils/helpers.ts");
    }

    @Test
    void normalize_backslashesAndMissingType() {
        GeneratedFile normalized = assembler.normalize(new GeneratedFile("config\\app.json", "{}", null));

        assertThat(normalized.type()).isEqualTo(FileType.CONFIG);
        assertThat(normalized.path()).isEqualTo("src/config/app.json");
    }

    @Test
    void inferType_byPath() {
        assertThat(ArtifactAssembler.inferType("src/routes/tasks.ts")).isEqualTo(FileType.API);
        assertThat(ArtifactAssembler.inferType("src/models/Task.ts")).isEqualTo(FileType.SCHEMA);
        assertThat(ArtifactAssembler.inferType("package.json")).isEqualTo(FileType.CONFIG);
        assertThat(ArtifactAssembler.inferType("src/components/App.tsx")).isEqualTo(FileType.COMPONENT);
        assertThat(ArtifactAssembler.inferType("README.md")).isEqualTo(FileType.OTHER);
    }

    private static GeneratedFile file(String path) {
        return new GeneratedFile(path, "same", FileType.OTHER);
    }
}
