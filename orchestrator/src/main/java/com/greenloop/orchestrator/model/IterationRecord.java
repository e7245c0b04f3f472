package com.greenloop.orchestrator.model;

import java.time.Instant;

/**
 * Immutable record of one loop pass.
 *
 * @param pass      1-based pass number
 * @param target    target worked on, or null when the pass had none
 * @param detail    why the pass ended the way it did (commit message, error text)
 */
public record IterationRecord(
        int               pass,
        Workflow          workflow,
        RemediationTarget target,
        Outcome           outcome,
        String            detail,
        Instant           timestamp) {

    public String targetKey() {
        return target != null ? target.key() : null;
    }

    public String summaryLine() {
        return "pass %d %s %s %s%s".formatted(
                pass,
                workflow,
                target != null ? target.describe() : "-",
                outcome,
                detail != null && !detail.isBlank() ? " (" + detail + ")" : "");
    }
}
