package com.greenloop.orchestrator.generation;

import com.greenloop.orchestrator.collaborator.PatchGenerator.PatchRequest;
import com.greenloop.orchestrator.model.RemediationTarget;
import com.greenloop.orchestrator.model.Workflow;

/**
 * System prompts and user messages for patch generation, one per workflow.
 *
 * Every prompt asks for exactly one thing: the complete new content of a
 * single file, inside one ```java fence.
 */
final class PatchPrompts {

    private PatchPrompts() {}

    static String system(Workflow workflow) {
        return switch (workflow) {
            case FIX_COMPILE_ERROR -> COMPILE_PROMPT + OUTPUT_RULES;
            case FIX_TEST_FAILURE  -> TEST_FAILURE_PROMPT + OUTPUT_RULES;
            case IMPROVE_COVERAGE  -> COVERAGE_PROMPT + OUTPUT_RULES;
            case NONE -> throw new IllegalArgumentException("No prompt for workflow NONE");
        };
    }

    static String userMessage(PatchRequest request) {
        RemediationTarget target = request.target();
        StringBuilder sb = new StringBuilder();
        sb.append("PROBLEM: ").append(target.describe()).append("\n\n");
        if (request.diagnostic() != null && !request.diagnostic().isBlank()) {
            sb.append("DIAGNOSTIC:\n").append(request.diagnostic().strip()).append("\n\n");
        }
        sb.append("FILE TO REWRITE: ").append(request.path()).append('\n');
        if (request.currentContent() == null || request.currentContent().isEmpty()) {
            sb.append("(the file does not exist yet; create it)\n\n");
        } else {
            sb.append("```java\n").append(request.currentContent()).append("\n```\n\n");
        }
        if (request.companionPath() != null && request.companionContent() != null) {
            sb.append("RELATED FILE (read only): ").append(request.companionPath()).append('\n')
              .append("```java\n").append(request.companionContent()).append("\n```\n");
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Workflow prompts
    // ------------------------------------------------------------------

    private static final String COMPILE_PROMPT = """
            You are fixing a Java compilation error in a Maven project.

            You are given the compiler diagnostic and the file it points at.
            Change only what is needed for the file to compile. Keep the
            public API and behaviour of the class unchanged unless the error
            itself is in a signature.
            """;

    private static final String TEST_FAILURE_PROMPT = """
            You are fixing a failing JUnit test in a Maven project.

            You are given the failure message and stack trace, the file to
            rewrite and, when available, the related test or production class.
            Fix the defect in the production code when the test expresses the
            intended behaviour. Only change the test when it is itself wrong.
            Never disable, skip or delete the failing test.
            """;

    private static final String COVERAGE_PROMPT = """
            You are raising line coverage of a Java class in a Maven project.

            You are given the class under test (read only) and its JUnit 5 test
            class, which may not exist yet. Add test methods that execute the
            uncovered line named in the problem with meaningful assertions.
            Keep every existing test. Do not use reflection to reach private
            members.
            """;

    private static final String OUTPUT_RULES = """

            OUTPUT FORMAT:
            Reply with the COMPLETE new content of the file to rewrite, in a
            single ```java fenced block. No diff, no ellipsis, no other files.
            If no change is possible, reply with <no-change/> only.
            """;
}
