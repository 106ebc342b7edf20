package com.briefforge.orchestrator.api;

import com.briefforge.orchestrator.api.dto.BriefRequest;
import com.briefforge.orchestrator.model.AgentResponse;
import com.briefforge.orchestrator.model.DecompositionResult;
import com.briefforge.orchestrator.model.ExecutionReport;
import com.briefforge.orchestrator.model.TechnicalTask;
import com.briefforge.orchestrator.service.BriefCoordinator;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for briefs.
 *
 * POST /briefs/decompose      - brief to task list, plan and analysis
 * POST /briefs/execute        - brief to task results and assembled artifacts
 * POST /briefs/tasks/execute  - re-run a reviewed task list
 *
 * Results are returned exactly as the coordinator builds them.
 */
@RestController
@RequestMapping("/briefs")
public class BriefController {

    private final BriefCoordinator coordinator;

    public BriefController(BriefCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/briefs/decompose \
     *     -H "Content-Type: application/json" \
     *     -d '{"description":"Build a todo app with user authentication"}'
     */
    @PostMapping("/decompose")
    public DecompositionResult decompose(@RequestBody BriefRequest req) {
        requireDescription(req);
        return coordinator.decompose(req.toBrief());
    }

    @PostMapping("/execute")
    public ExecutionReport execute(@RequestBody BriefRequest req) {
        requireDescription(req);
        return coordinator.execute(req.toBrief());
    }

    /** Invalid tasks come back as failed responses, not as a 400. */
    @PostMapping("/tasks/execute")
    public List<AgentResponse> executeTasks(@RequestBody List<TechnicalTask> tasks) {
        return coordinator.executeTasks(tasks);
    }

    private static void requireDescription(BriefRequest req) {
        if (req == null || req.description() == null || req.description().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "description is required");
        }
    }
}
