package com.briefforge.orchestrator.synthesis.logic;

import com.briefforge.orchestrator.model.FileType;
import com.briefforge.orchestrator.model.GeneratedFile;
import com.briefforge.orchestrator.model.TaskType;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.synthesis.KeywordClassifier;
import com.briefforge.orchestrator.synthesis.Synthesizer;
import com.briefforge.orchestrator.synthesis.SynthesizerManifest;
import com.briefforge.orchestrator.synthesis.TaskText;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Maps task text to workflow service artifacts.
 *
 * <p>Steps:
 * <ol>
 *   <li>Each {@link WorkflowFamily} whose keywords occur in the combined task
 *       text is selected.</li>
 *   <li>Families imported by a selected family are added, so every emitted
 *       artifact's imports resolve within the output (notification is
 *       usually pulled in this way).</li>
 *   <li>Artifacts are emitted in family declaration order.</li>
 * </ol>
 * A task matching no family yields an empty list.
 */
@Component
public class BusinessLogicSynthesizer implements Synthesizer {

    private static final SynthesizerManifest MANIFEST = new SynthesizerManifest(
            "business-logic", TaskType.BACKEND, 20,
            "Workflow services with permission checks and notification side effects");

    private final KeywordClassifier classifier;

    public BusinessLogicSynthesizer(KeywordClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public SynthesizerManifest manifest() {
        return MANIFEST;
    }

    @Override
    public List<GeneratedFile> synthesize(TechnicalTask task) {
        return selectFamilies(task).stream()
                .map(f -> new GeneratedFile(f.path(), f.source(), FileType.OTHER))
                .toList();
    }

    /** Matched families plus everything they import, in declaration order. */
    public Set<WorkflowFamily> selectFamilies(TechnicalTask task) {
        String combined = TaskText.combined(task);

        Set<WorkflowFamily> selected = EnumSet.noneOf(WorkflowFamily.class);
        for (WorkflowFamily family : WorkflowFamily.values()) {
            if (classifier.matchesAny(combined, family.keywords())) {
                selected.add(family);
            }
        }

        Deque<WorkflowFamily> pending = new ArrayDeque<>(selected);
        while (!pending.isEmpty()) {
            for (WorkflowFamily required : pending.pop().requires()) {
                if (selected.add(required)) {
                    pending.push(required);
                }
            }
        }
        return selected;
    }
}
