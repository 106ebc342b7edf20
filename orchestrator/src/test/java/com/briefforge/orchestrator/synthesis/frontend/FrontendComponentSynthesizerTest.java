package com.briefforge.orchestrator.synthesis.frontend;

import com.briefforge.orchestrator.model.FileType;
import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.TaskPriority;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.synthesis.SubstringKeywordClassifier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class FrontendComponentSynthesizerTest {

    private static final Pattern CSS_IMPORT = Pattern.compile("import '\\./([\\w.]+\\.css)'");

    private final FrontendComponentSynthesizer synthesizer =
            new FrontendComponentSynthesizer(new SubstringKeywordClassifier());

    @Test
    void synthesize_noComponentKeyword_returnsEmpty() {
        assertThat(synthesizer.synthesize(task("Landing page", "Marketing hero section"))).isEmpty();
    }

    @Test
    void synthesize_loginTitle_emitsAuthForms() {
        List<GeneratedFile> files = synthesizer.synthesize(task("Login screen", "Email and password"));

        assertThat(files).extracting(GeneratedFile::path).containsExactly(
                "src/components/auth/LoginForm.tsx",
                "src/components/auth/RegisterForm.tsx",
                "src/components/auth/AuthForm.css");
        assertThat(files.get(0).type()).isEqualTo(FileType.COMPONENT);
        assertThat(files.get(2).type()).isEqualTo(FileType.OTHER);
    }

    @Test
    void synthesize_sharedTaskBoard_emitsTasksThenSharing() {
        List<GeneratedFile> files = synthesizer.synthesize(task("Shared task board", "Invite teammates"));

        assertThat(files).extracting(GeneratedFile::path).containsExactly(
                "src/components/tasks/TaskList.tsx",
                "src/components/tasks/TaskItem.tsx",
                "src/components/tasks/TaskForm.tsx",
                "src/types/Task.ts",
                "src/components/sharing/ShareTaskModal.tsx");
    }

    @Test
    void synthesize_keysOnTitleOnly() {
        assertThat(synthesizer.synthesize(task("Settings page", "Let users manage tasks and login"))).isEmpty();
    }

    @Test
    void synthesize_cssImportsResolveToEmittedFiles() {
        List<GeneratedFile> files = synthesizer.synthesize(task("Auth and shared tasks", "Everything"));
        Set<String> emitted = files.stream().map(GeneratedFile::path).collect(Collectors.toSet());

        for (GeneratedFile file : files) {
            String dir = file.path().substring(0, file.path().lastIndexOf('/') + 1);
            Matcher m = CSS_IMPORT.matcher(file.content());
            while (m.find()) {
                assertThat(emitted).as("%s imports %s", file.path(), m.group(1)).contains(dir + m.group(1));
            }
        }
    }

    private static TechnicalTask task(String title, String description) {
        return TechnicalTask.of("t-1", title, description, TaskType.FRONTEND, TaskPriority.MEDIUM, List.of(), null);
    }
}
