package com.greenloop.orchestrator.loop;

/**
 * Raised by the loop components when a step cannot complete.
 *
 * Target-scoped kinds fail the current pass only and the loop moves on.
 * All other kinds stop the run without publishing.
 */
public class RemediationException extends RuntimeException {

    public enum Kind {
        PROBE_ERROR(false),
        LOCATE_ERROR(true),
        LOAD_ERROR(true),
        GENERATION_ERROR(true),
        POLICY_VIOLATION(true),
        APPLY_ERROR(false),
        RECORD_ERROR(false),
        INCONSISTENT_STATE(false),
        PUBLICATION_ERROR(false);

        private final boolean targetScoped;

        Kind(boolean targetScoped) {
            this.targetScoped = targetScoped;
        }

        public boolean isTargetScoped() { return targetScoped; }
    }

    private final Kind kind;

    public RemediationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RemediationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public boolean isFatal() { return !kind.isTargetScoped(); }
}
