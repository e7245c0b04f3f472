package com.greenloop.orchestrator.model;

/**
 * Lifecycle of a remediation run.
 *
 *   PENDING → RUNNING → SUCCEEDED | BLOCKED | ABORTED
 *
 * A PENDING run cancelled before it is claimed goes straight to ABORTED.
 */
public enum RunState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    BLOCKED,
    ABORTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == BLOCKED || this == ABORTED;
    }

    public static RunState of(Termination.Status status) {
        return switch (status) {
            case SUCCESS -> SUCCEEDED;
            case BLOCKED -> BLOCKED;
            case ABORTED -> ABORTED;
        };
    }
}
