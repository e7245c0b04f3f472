package com.greenloop.orchestrator.model;

/**
 * The remediation workflows triage can select, in priority order.
 *
 * {@link #NONE} is terminal: nothing is left to remediate and the
 * completion gate takes over.
 */
public enum Workflow {
    FIX_COMPILE_ERROR,
    FIX_TEST_FAILURE,
    IMPROVE_COVERAGE,
    NONE
}
