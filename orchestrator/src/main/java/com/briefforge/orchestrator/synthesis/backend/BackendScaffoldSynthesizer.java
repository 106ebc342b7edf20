package com.briefforge.orchestrator.synthesis.backend;

import com.briefforge.orchestrator.model.FileType;
import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.synthesis.KeywordClassifier;
import com.briefforge.orchestrator.synthesis.Synthesizer;
import com.briefforge.orchestrator.synthesis.SynthesizerManifest;
import com.briefforge.orchestrator.synthesis.TaskText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Express scaffolding: environment config, validation helpers, a minimal
 * server, an API test skeleton, and auth or task controllers when the title
 * asks for them.
 */
@Component
public class BackendScaffoldSynthesizer implements Synthesizer {

    private static final SynthesizerManifest MANIFEST = new SynthesizerManifest(
            "backend-scaffold", TaskType.BACKEND, 50,
            "Environment config, validation, auth middleware, controllers and API test skeleton");

    static final List<String> AUTH_KEYWORDS = List.of("auth");
    static final List<String> TASK_KEYWORDS = List.of("task", "crud");

    /** Imported by the API test skeleton. */
    static final String SERVER_PATH = "src/server.ts";

    private final KeywordClassifier classifier;

    public BackendScaffoldSynthesizer(KeywordClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public SynthesizerManifest manifest() {
        return MANIFEST;
    }

    @Override
    public List<GeneratedFile> synthesize(TechnicalTask task) {
        String title = TaskText.title(task);
        boolean auth = classifier.matchesAny(title, AUTH_KEYWORDS);

        List<GeneratedFile> files = new ArrayList<>();
        files.add(new GeneratedFile("src/config/environment.ts", BackendScaffoldTemplates.ENVIRONMENT, FileType.CONFIG));
        files.add(new GeneratedFile("src/utils/validation.ts", BackendScaffoldTemplates.VALIDATION, FileType.OTHER));
        files.add(new GeneratedFile(SERVER_PATH, BackendScaffoldTemplates.SERVER, FileType.OTHER));
        if (auth) {
            files.add(new GeneratedFile("src/middleware/auth.ts", BackendScaffoldTemplates.AUTH_MIDDLEWARE, FileType.OTHER));
            files.add(new GeneratedFile("src/controllers/AuthController.ts", BackendScaffoldTemplates.AUTH_CONTROLLER, FileType.API));
        }
        if (classifier.matchesAny(title, TASK_KEYWORDS)) {
            files.add(new GeneratedFile("src/controllers/TaskController.ts", BackendScaffoldTemplates.TASK_CONTROLLER, FileType.API));
            // TaskController imports the middleware for its request type
            if (!auth) {
                files.add(new GeneratedFile("src/middleware/auth.ts", BackendScaffoldTemplates.AUTH_MIDDLEWARE, FileType.OTHER));
            }
        }
        files.add(new GeneratedFile(testPath(task), apiTest(task), FileType.OTHER));
        return files;
    }

    static String testPath(TechnicalTask task) {
        String name = task.title() == null ? "" : task.title().replaceAll("[^A-Za-z0-9]", "");
        return "src/tests/" + (name.isEmpty() ? "Generated" : name) + ".test.ts";
    }

    private static String apiTest(TechnicalTask task) {
        String title = task.title() == null ? "" : task.title();
        String quoted = title.replace("\\", "\\\\").replace("'", "\\'");
        return BackendScaffoldTemplates.API_TEST.formatted(quoted);
    }
}
