package com.greenloop.orchestrator.model;

/**
 * One failing or erroring test case, as reported by the test harness.
 *
 * @param kind       {@code failure} for assertion failures, {@code error} for unexpected exceptions
 * @param stackTrace raw trace text; may be empty
 */
public record TestFailure(
        String testClass,
        String testMethod,
        String kind,
        String message,
        String stackTrace) {

    public TestFailure {
        if (kind == null || kind.isBlank()) kind = "failure";
        if (message == null) message = "";
        if (stackTrace == null) stackTrace = "";
    }
}
