package com.greenloop.orchestrator.model;

/**
 * How a single pass ended.
 *
 *   APPLIED - a change was written and committed
 *   SKIPPED - nothing to do or nothing changed; no commit
 *   FAILED  - the pass gave up on its target; no commit
 */
public enum Outcome {
    APPLIED,
    SKIPPED,
    FAILED
}
