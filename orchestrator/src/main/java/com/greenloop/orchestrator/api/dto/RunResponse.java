package com.greenloop.orchestrator.api.dto;

import com.greenloop.orchestrator.model.Run;
import com.greenloop.orchestrator.model.RunState;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /runs, GET /runs/{id} and POST /runs/{id}/cancel.
 */
public record RunResponse(
        UUID     id,
        RunState state,
        String   workspaceRef,
        String   branch,
        String   baseBranch,
        int      passCount,
        boolean  published,
        boolean  cancelRequested,
        String   terminationCode,
        String   diagnostic,
        Instant  createdAt,
        Instant  startedAt,
        Instant  finishedAt
) {
    public static RunResponse from(Run run) {
        return new RunResponse(
                run.getId(),
                run.getState(),
                run.getWorkspaceRef(),
                run.getBranch(),
                run.getBaseBranch(),
                run.getPassCount(),
                run.isPublished(),
                run.isCancelRequested(),
                run.getTerminationCode(),
                run.getDiagnostic(),
                run.getCreatedAt(),
                run.getStartedAt(),
                run.getFinishedAt()
        );
    }
}
