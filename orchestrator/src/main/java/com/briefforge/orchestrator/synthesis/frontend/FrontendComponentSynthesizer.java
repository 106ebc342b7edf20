package com.briefforge.orchestrator.synthesis.frontend;

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
 * React component artifacts keyed on the task title. Empty when no
 * component family matches.
 */
@Component
public class FrontendComponentSynthesizer implements Synthesizer {

    private static final SynthesizerManifest MANIFEST = new SynthesizerManifest(
            "components", TaskType.FRONTEND, 10,
            "React components for auth forms, task lists and sharing");

    /** Component families in emission order. */
    enum ComponentFamily {
        AUTH(List.of("auth", "login"), List.of(
                new GeneratedFile("src/components/auth/LoginForm.tsx",    ComponentTemplates.LOGIN_FORM,    FileType.COMPONENT),
                new GeneratedFile("src/components/auth/RegisterForm.tsx", ComponentTemplates.REGISTER_FORM, FileType.COMPONENT),
                new GeneratedFile("src/components/auth/AuthForm.css",     ComponentTemplates.AUTH_FORM_CSS, FileType.OTHER))),
        TASKS(List.of("task", "todo"), List.of(
                new GeneratedFile("src/components/tasks/TaskList.tsx", ComponentTemplates.TASK_LIST,  FileType.COMPONENT),
                new GeneratedFile("src/components/tasks/TaskItem.tsx", ComponentTemplates.TASK_ITEM,  FileType.COMPONENT),
                new GeneratedFile("src/components/tasks/TaskForm.tsx", ComponentTemplates.TASK_FORM,  FileType.COMPONENT),
                new GeneratedFile("src/types/Task.ts",                 ComponentTemplates.TASK_TYPES, FileType.OTHER))),
        SHARING(List.of("shar"), List.of(
                new GeneratedFile("src/components/sharing/ShareTaskModal.tsx", ComponentTemplates.SHARE_TASK_MODAL, FileType.COMPONENT)));

        private final List<String>        keywords;
        private final List<GeneratedFile> files;

        ComponentFamily(List<String> keywords, List<GeneratedFile> files) {
            this.keywords = keywords;
            this.files    = files;
        }

        List<String> keywords()        { return keywords; }
        List<GeneratedFile> files()    { return files; }
    }

    private final KeywordClassifier classifier;

    public FrontendComponentSynthesizer(KeywordClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public SynthesizerManifest manifest() {
        return MANIFEST;
    }

    @Override
    public List<GeneratedFile> synthesize(TechnicalTask task) {
        String title = TaskText.title(task);
        List<GeneratedFile> files = new ArrayList<>();
        for (ComponentFamily family : ComponentFamily.values()) {
            if (classifier.matchesAny(title, family.keywords())) {
                files.addAll(family.files());
            }
        }
        return files;
    }
}
