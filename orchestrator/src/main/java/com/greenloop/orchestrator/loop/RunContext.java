package com.greenloop.orchestrator.loop;

import com.greenloop.orchestrator.model.RepositoryState;

import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Per-run state threaded through the loop components.
 *
 * @param startupState working-tree state checked once before the first pass
 * @param guard        owner of the iteration history
 * @param cancellation polled between passes only
 */
public record RunContext(
        UUID            runId,
        RepositoryState startupState,
        ProgressGuard   guard,
        BooleanSupplier cancellation,
        PassListener    listener) {

    public boolean cancelRequested() {
        return cancellation.getAsBoolean();
    }
}
