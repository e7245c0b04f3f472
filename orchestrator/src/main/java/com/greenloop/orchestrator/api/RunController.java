package com.greenloop.orchestrator.api;

import com.greenloop.orchestrator.api.dto.PassResponse;
import com.greenloop.orchestrator.api.dto.RunResponse;
import com.greenloop.orchestrator.api.dto.SubmitRunRequest;
import com.greenloop.orchestrator.model.Run;
import com.greenloop.orchestrator.service.RunService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for remediation runs.
 *
 * POST /runs               submit a run for a workspace
 * GET  /runs/{id}          poll state, pass count and outcome
 * GET  /runs/{id}/passes   the pass ledger, in order
 * POST /runs/{id}/cancel   stop at the next pass boundary
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"workspaceRef":"commons-lang","branch":"greenloop/coverage"}'
     */
    @PostMapping
    public ResponseEntity<RunResponse> submit(@RequestBody SubmitRunRequest req) {
        if (isBlank(req.workspaceRef()) || isBlank(req.branch())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "workspaceRef and branch are required");
        }
        try {
            Run run = runService.submit(req.workspaceRef(), req.branch(), req.baseBranch());
            return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return runService.findById(id)
                .map(RunResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    @GetMapping("/{id}/passes")
    public List<PassResponse> getPasses(@PathVariable UUID id) {
        runService.findById(id).orElseThrow(() -> notFound(id));
        return runService.getPasses(id).stream()
                .map(PassResponse::from)
                .toList();
    }

    /**
     * HTTP 200 - cancellation recorded (a queued run is aborted right away)
     * HTTP 404 - run ID not found
     * HTTP 409 - run already finished
     */
    @PostMapping("/{id}/cancel")
    public RunResponse cancel(@PathVariable UUID id) {
        try {
            return runService.requestCancel(id)
                    .map(RunResponse::from)
                    .orElseThrow(() -> notFound(id));
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
