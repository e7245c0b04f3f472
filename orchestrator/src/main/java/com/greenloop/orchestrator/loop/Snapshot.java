package com.greenloop.orchestrator.loop;

import com.greenloop.orchestrator.model.BuildStatus;
import com.greenloop.orchestrator.model.BuildStatus.CompileLocation;
import com.greenloop.orchestrator.model.CoverageGap;
import com.greenloop.orchestrator.model.QualityDashboard;
import com.greenloop.orchestrator.model.RemediationTarget;
import com.greenloop.orchestrator.model.TestFailure;
import com.greenloop.orchestrator.model.Workflow;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable view of the workspace taken at the start of a pass.
 *
 * When the build does not compile the reports are stale, so
 * {@code dashboard} is null and both lists are empty.
 */
public record Snapshot(
        BuildStatus       build,
        QualityDashboard  dashboard,
        List<TestFailure> failures,
        List<CoverageGap> gaps) {

    public Snapshot {
        failures = failures == null ? List.of() : List.copyOf(failures);
        gaps     = gaps == null ? List.of() : List.copyOf(gaps);
    }

    public static Snapshot compileFailure(BuildStatus build) {
        return new Snapshot(build, null, List.of(), List.of());
    }

    public boolean compileError() {
        return build.hasCompileError();
    }

    /**
     * Whether this snapshot says anything about targets of a workflow.
     * Test and coverage targets are unknown while the tree does not compile.
     */
    public boolean observes(Workflow workflow) {
        return switch (workflow) {
            case FIX_COMPILE_ERROR -> true;
            case FIX_TEST_FAILURE, IMPROVE_COVERAGE -> dashboard != null;
            case NONE -> false;
        };
    }

    /** Compile-error targets in diagnostic order; one message-only target when javac gave no location. */
    public List<RemediationTarget> compileTargets() {
        if (!compileError()) return List.of();
        List<CompileLocation> locations = build.compileLocations();
        if (locations.isEmpty()) {
            return List.of(RemediationTarget.compileError(null, null, 0, build.headline()));
        }
        List<RemediationTarget> targets = new ArrayList<>();
        for (CompileLocation loc : locations) {
            targets.add(RemediationTarget.compileError(
                    JavaPaths.classNameOf(loc.path()).orElse(null),
                    loc.path(), loc.line(), loc.message()));
        }
        return targets;
    }

    public List<RemediationTarget> testTargets() {
        return failures.stream().map(RemediationTarget::testFailure).distinct().toList();
    }

    /** One target per uncovered line, class by class in report order. */
    public List<RemediationTarget> coverageTargets() {
        List<RemediationTarget> targets = new ArrayList<>();
        for (CoverageGap gap : gaps) {
            for (int line : gap.uncoveredLines()) {
                targets.add(RemediationTarget.coverageLine(gap.sourceClass(), line));
            }
        }
        return targets;
    }

    public List<RemediationTarget> targetsFor(Workflow workflow) {
        return switch (workflow) {
            case FIX_COMPILE_ERROR -> compileTargets();
            case FIX_TEST_FAILURE  -> testTargets();
            case IMPROVE_COVERAGE  -> coverageTargets();
            case NONE              -> List.of();
        };
    }

    /** Keys of every problem this snapshot reports, across all workflows. */
    public Set<String> outstandingKeys() {
        Set<String> keys = new LinkedHashSet<>();
        compileTargets().forEach(t -> keys.add(t.key()));
        testTargets().forEach(t -> keys.add(t.key()));
        coverageTargets().forEach(t -> keys.add(t.key()));
        return keys;
    }

    public Metrics metrics() {
        if (dashboard == null) {
            return new Metrics(compileError(), compileTargets().size(), 0, 0, 0.0);
        }
        return new Metrics(false, 0,
                dashboard.testSummary().failures(),
                dashboard.testSummary().errors(),
                dashboard.coverageSummary().linePercent());
    }

    /**
     * The figures stagnation is judged on. A falling {@code compileErrors}
     * count is progress even though no report can be read yet.
     */
    public record Metrics(boolean compileError, int compileErrors, int failures, int errors, double linePercent) {}
}
