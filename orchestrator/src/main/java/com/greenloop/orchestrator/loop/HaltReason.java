package com.greenloop.orchestrator.loop;

/** Safety conditions under which the progress guard stops a run. */
public enum HaltReason {
    REGRESSION_DETECTED,
    OSCILLATION_DETECTED,
    STAGNATION_DETECTED,
    ITERATION_CAP_EXCEEDED
}
