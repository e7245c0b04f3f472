package com.greenloop.orchestrator.loop;

import com.greenloop.orchestrator.model.BuildStatus;
import com.greenloop.orchestrator.model.IterationRecord;
import com.greenloop.orchestrator.model.Outcome;
import com.greenloop.orchestrator.model.QualityDashboard;
import com.greenloop.orchestrator.model.RemediationTarget;
import com.greenloop.orchestrator.model.TestFailure;
import com.greenloop.orchestrator.model.Workflow;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressGuardTest {

    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");

    private static LoopSettings settings(int maxIterations, int stagnation, int oscillation) {
        return new LoopSettings(maxIterations, stagnation, oscillation, 2, 3, Duration.ZERO, false, null);
    }

    private static Snapshot failing(String... methods) {
        List<TestFailure> failures = Arrays.stream(methods)
                .map(m -> new TestFailure("com.acme.CalcTest", m, "failure", "boom", ""))
                .toList();
        return new Snapshot(BuildStatus.failed("There are test failures."),
                QualityDashboard.of(20, failures.size(), 0, 90.0), failures, List.of());
    }

    private static Snapshot brokenIn(String... classes) {
        String diagnostic = Arrays.stream(classes)
                .map(c -> "[ERROR] /w/src/main/java/com/acme/" + c + ".java:[3,1] class expected")
                .reduce("[ERROR] COMPILATION ERROR :", (a, b) -> a + "\n" + b);
        return Snapshot.compileFailure(BuildStatus.failed(diagnostic));
    }

    private static RemediationTarget compile(String cls) {
        return RemediationTarget.compileError("com.acme." + cls,
                "/w/src/main/java/com/acme/" + cls + ".java", 3, "class expected");
    }

    private static RemediationTarget test(String method) {
        return RemediationTarget.testFailure(new TestFailure("com.acme.CalcTest", method, "failure", "", ""));
    }

    private static IterationRecord rec(int pass, RemediationTarget target, Outcome outcome) {
        return new IterationRecord(pass, target.workflow(), target, outcome, "", NOW);
    }

    // ------------------------------------------------------------------
    // Regression
    // ------------------------------------------------------------------

    @Test
    void inspect_appliedTargetStillReported_detectsRegression() {
        ProgressGuard guard = new ProgressGuard(LoopSettings.defaults());
        assertThat(guard.inspect(failing("adds"))).isEmpty();
        guard.record(rec(1, test("adds"), Outcome.APPLIED));

        var halt = guard.inspect(failing("adds"));

        assertThat(halt).isPresent();
        assertThat(halt.get().reason()).isEqualTo(HaltReason.REGRESSION_DETECTED);
    }

    @Test
    void inspect_failedPassOnStillReportedTarget_isNotRegression() {
        ProgressGuard guard = new ProgressGuard(LoopSettings.defaults());
        guard.inspect(failing("adds"));
        guard.record(rec(1, test("adds"), Outcome.FAILED));

        assertThat(guard.inspect(failing("adds"))).isEmpty();
    }

    @Test
    void inspect_compileErrorAfterTestFix_doesNotJudgeTestTargets() {
        ProgressGuard guard = new ProgressGuard(LoopSettings.defaults());
        guard.inspect(failing("adds"));
        guard.record(rec(1, test("adds"), Outcome.APPLIED));

        Snapshot broken = Snapshot.compileFailure(
                BuildStatus.failed("[ERROR] /w/src/main/java/com/acme/Calc.java:[3,1] class expected"));

        assertThat(guard.inspect(broken)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Oscillation
    // ------------------------------------------------------------------

    @Test
    void inspect_targetComingBackRepeatedly_detectsOscillation() {
        ProgressGuard guard = new ProgressGuard(settings(50, 10, 2));

        assertThat(guard.inspect(failing("a"))).isEmpty();
        guard.record(rec(1, test("a"), Outcome.APPLIED));
        assertThat(guard.inspect(failing("b"))).isEmpty();
        guard.record(rec(2, test("b"), Outcome.APPLIED));
        assertThat(guard.inspect(failing("a"))).isEmpty();      // a back once
        guard.record(rec(3, test("a"), Outcome.APPLIED));
        assertThat(guard.inspect(failing("b"))).isEmpty();      // b back once
        guard.record(rec(4, test("b"), Outcome.APPLIED));

        var halt = guard.inspect(failing("a"));                  // a back twice

        assertThat(halt).isPresent();
        assertThat(halt.get().reason()).isEqualTo(HaltReason.OSCILLATION_DETECTED);
        assertThat(halt.get().message()).contains("test:com.acme.CalcTest#a");
    }

    @Test
    void inspect_compileSnapshotInBetween_doesNotCountAsDisappearance() {
        ProgressGuard guard = new ProgressGuard(settings(50, 10, 1));
        Snapshot broken = Snapshot.compileFailure(BuildStatus.failed("COMPILATION ERROR"));

        guard.inspect(failing("a"));
        guard.record(rec(1, RemediationTarget.compileError(null, null, 0, "COMPILATION ERROR"), Outcome.FAILED));
        guard.inspect(broken);
        guard.record(rec(2, RemediationTarget.compileError(null, null, 0, "COMPILATION ERROR"), Outcome.FAILED));

        // a was never observed absent, so seeing it again is not a reappearance
        assertThat(guard.inspect(failing("a"))).isEmpty();
    }

    // ------------------------------------------------------------------
    // Stagnation
    // ------------------------------------------------------------------

    @Test
    void inspect_appliedPassesWithFlatMetrics_detectsStagnation() {
        ProgressGuard guard = new ProgressGuard(settings(50, 2, 5));

        guard.inspect(failing("a"));
        guard.record(rec(1, test("a"), Outcome.APPLIED));
        assertThat(guard.inspect(failing("b"))).isEmpty();
        guard.record(rec(2, test("b"), Outcome.APPLIED));

        var halt = guard.inspect(failing("c"));

        assertThat(halt).isPresent();
        assertThat(halt.get().reason()).isEqualTo(HaltReason.STAGNATION_DETECTED);
    }

    @Test
    void inspect_metricsMoving_isNotStagnation() {
        ProgressGuard guard = new ProgressGuard(settings(50, 2, 5));

        guard.inspect(failing("a", "b", "c"));
        guard.record(rec(1, test("a"), Outcome.APPLIED));
        guard.inspect(failing("b", "c"));
        guard.record(rec(2, test("b"), Outcome.APPLIED));

        assertThat(guard.inspect(failing("c"))).isEmpty();
    }

    @Test
    void inspect_compileErrorsFallingOneByOne_isNotStagnation() {
        ProgressGuard guard = new ProgressGuard(settings(50, 2, 5));

        guard.inspect(brokenIn("Alpha", "Beta", "Gamma"));
        guard.record(rec(1, compile("Alpha"), Outcome.APPLIED));
        assertThat(guard.inspect(brokenIn("Beta", "Gamma"))).isEmpty();
        guard.record(rec(2, compile("Beta"), Outcome.APPLIED));

        assertThat(guard.inspect(brokenIn("Gamma"))).isEmpty();
    }

    @Test
    void inspect_compileErrorCountNotFalling_detectsStagnation() {
        ProgressGuard guard = new ProgressGuard(settings(50, 2, 5));

        guard.inspect(brokenIn("Alpha", "Beta"));
        guard.record(rec(1, compile("Alpha"), Outcome.APPLIED));
        guard.inspect(brokenIn("Beta", "Gamma"));
        guard.record(rec(2, compile("Beta"), Outcome.APPLIED));

        var halt = guard.inspect(brokenIn("Gamma", "Delta"));

        assertThat(halt).isPresent();
        assertThat(halt.get().reason()).isEqualTo(HaltReason.STAGNATION_DETECTED);
    }

    @Test
    void inspect_failedPassInWindow_isNotStagnation() {
        ProgressGuard guard = new ProgressGuard(settings(50, 2, 5));

        guard.inspect(failing("a"));
        guard.record(rec(1, test("a"), Outcome.FAILED));
        guard.inspect(failing("a"));
        guard.record(rec(2, test("a"), Outcome.APPLIED));

        assertThat(guard.inspect(failing("b"))).isEmpty();
    }

    // ------------------------------------------------------------------
    // Budget and history
    // ------------------------------------------------------------------

    @Test
    void checkBudget_haltsOnceCapReached() {
        ProgressGuard guard = new ProgressGuard(settings(2, 3, 2));
        assertThat(guard.checkBudget()).isEmpty();
        guard.record(rec(1, test("a"), Outcome.FAILED));
        assertThat(guard.checkBudget()).isEmpty();
        guard.record(rec(2, test("a"), Outcome.FAILED));

        assertThat(guard.checkBudget()).get()
                .extracting(ProgressGuard.Halt::reason)
                .isEqualTo(HaltReason.ITERATION_CAP_EXCEEDED);
    }

    @Test
    void failedAttempts_countsOnlyFailedPassesOnThatTarget() {
        ProgressGuard guard = new ProgressGuard(LoopSettings.defaults());
        guard.record(rec(1, test("a"), Outcome.FAILED));
        guard.record(rec(2, test("b"), Outcome.FAILED));
        guard.record(rec(3, test("a"), Outcome.APPLIED));
        guard.record(rec(4, test("a"), Outcome.FAILED));

        assertThat(guard.failedAttempts(test("a").key())).isEqualTo(2);
        assertThat(guard.failedAttempts(test("c").key())).isZero();
    }

    @Test
    void summary_listsOneLinePerPass() {
        ProgressGuard guard = new ProgressGuard(LoopSettings.defaults());
        assertThat(guard.summary()).isEqualTo("(no passes)");

        guard.record(rec(1, test("a"), Outcome.APPLIED));
        guard.record(new IterationRecord(2, Workflow.NONE, null, Outcome.SKIPPED, "", NOW));

        assertThat(guard.summary().lines()).containsExactly(
                "pass 1 FIX_TEST_FAILURE com.acme.CalcTest#a APPLIED",
                "pass 2 NONE - SKIPPED");
        assertThat(guard.history()).hasSize(2);
    }
}
