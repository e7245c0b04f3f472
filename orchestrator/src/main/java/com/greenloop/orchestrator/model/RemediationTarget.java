package com.greenloop.orchestrator.model;

/**
 * The single unit of work a pass addresses.
 *
 * The {@code key} is stable across probes for the same problem, so the
 * progress guard can tell whether a target it already worked on is still
 * outstanding.
 *
 * @param workflow  workflow this target belongs to
 * @param classFqn  class the problem is attributed to
 * @param pathHint  file path reported by the harness, or null
 * @param line      line the problem is reported at, or 0 when unknown
 * @param detail    test method, compiler message or similar; free text
 */
public record RemediationTarget(
        Workflow workflow,
        String   classFqn,
        String   pathHint,
        int      line,
        String   detail) {

    public static RemediationTarget compileError(String classFqn, String path, int line, String message) {
        return new RemediationTarget(Workflow.FIX_COMPILE_ERROR, classFqn, path, line, message);
    }

    public static RemediationTarget testFailure(TestFailure failure) {
        return new RemediationTarget(Workflow.FIX_TEST_FAILURE,
                failure.testClass(), null, 0, failure.testMethod());
    }

    public static RemediationTarget coverageLine(String sourceClass, int line) {
        return new RemediationTarget(Workflow.IMPROVE_COVERAGE, sourceClass, null, line, null);
    }

    public String key() {
        return switch (workflow) {
            case FIX_COMPILE_ERROR -> "compile:" + compileAnchor() + ":" + line;
            case FIX_TEST_FAILURE  -> "test:" + classFqn + "#" + detail;
            case IMPROVE_COVERAGE  -> "coverage:" + classFqn + ":" + line;
            case NONE              -> "none";
        };
    }

    /** Short human-readable label for logs, commit messages and the ledger. */
    public String describe() {
        return switch (workflow) {
            case FIX_COMPILE_ERROR -> pathHint != null ? fileName(pathHint) + ":" + line : compileAnchor();
            case FIX_TEST_FAILURE  -> classFqn + "#" + detail;
            case IMPROVE_COVERAGE  -> classFqn + " line " + line;
            case NONE              -> "-";
        };
    }

    // A diagnostic without a javac location only has its message to go by.
    private String compileAnchor() {
        if (pathHint != null) return pathHint;
        if (classFqn != null) return classFqn;
        return detail;
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
