package com.greenloop.orchestrator.api.dto;

import com.greenloop.orchestrator.model.Outcome;
import com.greenloop.orchestrator.model.Pass;
import com.greenloop.orchestrator.model.Workflow;

import java.time.Instant;

/** One ledger entry returned by GET /runs/{id}/passes. */
public record PassResponse(
        int      pass,
        Workflow workflow,
        String   target,
        String   targetKey,
        Outcome  outcome,
        String   detail,
        Instant  recordedAt
) {
    public static PassResponse from(Pass p) {
        return new PassResponse(
                p.getPassNumber(),
                p.getWorkflow(),
                p.getTargetLabel(),
                p.getTargetKey(),
                p.getOutcome(),
                p.getDetail(),
                p.getRecordedAt()
        );
    }
}
