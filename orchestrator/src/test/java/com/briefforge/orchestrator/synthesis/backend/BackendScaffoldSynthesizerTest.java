package com.briefforge.orchestrator.synthesis.backend;

import com.briefforge.orchestrator.model.FileType;
import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.TaskPriority;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.synthesis.SubstringKeywordClassifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BackendScaffoldSynthesizerTest {

    private final BackendScaffoldSynthesizer synthesizer =
            new BackendScaffoldSynthesizer(new SubstringKeywordClassifier());

    @Test
    void synthesize_plainTitle_emitsBaseScaffoldAndTest() {
        List<GeneratedFile> files = synthesizer.synthesize(task("Reporting endpoints"));

        assertThat(files).extracting(GeneratedFile::path).containsExactly(
                "src/config/environment.ts",
                "src/utils/validation.ts",
                "src/server.ts",
                "src/tests/Reportingendpoints.test.ts");
        assertThat(files.get(0).type()).isEqualTo(FileType.CONFIG);
    }

    @Test
    void synthesize_apiTestImportsEmittedServer() {
        List<GeneratedFile> files = synthesizer.synthesize(task("Reporting endpoints"));

        GeneratedFile test = files.get(files.size() - 1);
        assertThat(test.content()).contains("from '../server'");
        assertThat(files).filteredOn(f -> f.path().equals("src/server.ts"))
                .singleElement()
                .satisfies(server -> {
                    assertThat(server.content()).contains("export const app");
                    assertThat(server.content()).contains("from './config/environment'");
                    assertThat(server.content()).contains("from './utils/validation'");
                    assertThat(server.content()).contains("'Authentication required'");
                    assertThat(server.content()).contains("app.get('/health'");
                });
    }

    @Test
    void synthesize_serverImportsOnlyAlwaysEmittedModules() {
        List<GeneratedFile> files = synthesizer.synthesize(task("Reporting endpoints"));

        String server = files.stream().filter(f -> f.path().equals("src/server.ts"))
                .findFirst().orElseThrow().content();
        assertThat(server).doesNotContain("./middleware").doesNotContain("./controllers");
    }

    @Test
    void synthesize_authTitle_addsMiddlewareAndAuthController() {
        List<GeneratedFile> files = synthesizer.synthesize(task("User Authentication API"));

        assertThat(files).extracting(GeneratedFile::path)
                .contains("src/middleware/auth.ts", "src/controllers/AuthController.ts")
                .doesNotContain("src/controllers/TaskController.ts");
        assertThat(files).filteredOn(f -> f.path().endsWith("AuthController.ts"))
                .extracting(GeneratedFile::type).containsExactly(FileType.API);
    }

    @Test
    void synthesize_taskTitleWithoutAuth_stillEmitsMiddlewareImportedByController() {
        List<GeneratedFile> files = synthesizer.synthesize(task("Task CRUD API"));

        assertThat(files).extracting(GeneratedFile::path)
                .contains("src/controllers/TaskController.ts", "src/middleware/auth.ts")
                .doesNotContain("src/controllers/AuthController.ts");
    }

    @Test
    void synthesize_authAndTaskTitle_emitsMiddlewareOnce() {
        List<GeneratedFile> files = synthesizer.synthesize(task("Auth protected task API"));

        assertThat(files).filteredOn(f -> f.path().equals("src/middleware/auth.ts")).hasSize(1);
    }

    @Test
    void synthesize_apiTestEscapesQuotesInTitle() {
        List<GeneratedFile> files = synthesizer.synthesize(task("Owner's dashboard"));

        GeneratedFile test = files.get(files.size() - 1);
        assertThat(test.path()).isEqualTo("src/tests/Ownersdashboard.test.ts");
        assertThat(test.content()).contains("Owner\\'s dashboard");
    }

    @Test
    void testPath_titleWithoutAlphanumerics_usesGenerated() {
        assertThat(BackendScaffoldSynthesizer.testPath(task("!!!"))).isEqualTo("src/tests/Generated.test.ts");
    }

    private static TechnicalTask task(String title) {
        return TechnicalTask.of("t-1", title, "Backend work", TaskType.BACKEND, TaskPriority.MEDIUM, List.of(), null);
    }
}
