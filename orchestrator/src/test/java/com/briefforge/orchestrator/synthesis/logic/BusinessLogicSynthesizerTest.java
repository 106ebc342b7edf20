package com.briefforge.orchestrator.synthesis.logic;

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

class BusinessLogicSynthesizerTest {

    private static final Pattern RELATIVE_IMPORT = Pattern.compile("from '\\./(\\w+)'");

    private final BusinessLogicSynthesizer synthesizer =
            new BusinessLogicSynthesizer(new SubstringKeywordClassifier());

    @Test
    void synthesize_noWorkflowKeyword_returnsEmpty() {
        assertThat(synthesizer.synthesize(task("Setup Docker and CI/CD", "Containerize the service"))).isEmpty();
    }

    @Test
    void selectFamilies_comments_pullsInSharingAndNotification() {
        Set<WorkflowFamily> families = synthesizer.selectFamilies(task("Comment threads", "Replies on cards"));

        assertThat(families).containsExactly(
                WorkflowFamily.SHARING, WorkflowFamily.NOTIFICATION, WorkflowFamily.COMMENTS);
    }

    @Test
    void synthesize_taskLifecycle_emitsTaskAndNotificationServices() {
        List<GeneratedFile> files = synthesizer.synthesize(task("Todo CRUD", "Create and complete items"));

        assertThat(files).extracting(GeneratedFile::path).containsExactly(
                "src/services/taskService.ts", "src/services/notificationService.ts");
        assertThat(files).allSatisfy(f -> assertThat(f.type()).isEqualTo(FileType.OTHER));
    }

    @Test
    void synthesize_everyRelativeImportResolvesToAnEmittedFile() {
        for (WorkflowFamily family : WorkflowFamily.values()) {
            List<GeneratedFile> files = synthesizer.synthesize(task(family.keywords().get(0), "single family"));
            Set<String> emitted = files.stream()
                    .map(f -> f.path().substring(f.path().lastIndexOf('/') + 1).replace(".ts", ""))
                    .collect(Collectors.toSet());

            for (GeneratedFile file : files) {
                Matcher m = RELATIVE_IMPORT.matcher(file.content());
                while (m.find()) {
                    assertThat(emitted)
                            .as("%s imports ./%s", file.path(), m.group(1))
                            .contains(m.group(1));
                }
            }
        }
    }

    @Test
    void synthesize_isDeterministic() {
        TechnicalTask task = task("Team task board", "Share tasks, upload files, send reminders");

        assertThat(synthesizer.synthesize(task)).isEqualTo(synthesizer.synthesize(task));
    }

    private static TechnicalTask task(String title, String description) {
        return TechnicalTask.of("t-1", title, description, TaskType.BACKEND, TaskPriority.MEDIUM, List.of(), null);
    }
}
