package com.greenloop.orchestrator.loop;

import com.greenloop.orchestrator.collaborator.BuildRunner;
import com.greenloop.orchestrator.collaborator.CollaboratorException;
import com.greenloop.orchestrator.collaborator.CoverageReporter;
import com.greenloop.orchestrator.collaborator.DashboardReader;
import com.greenloop.orchestrator.collaborator.FailureReporter;
import com.greenloop.orchestrator.model.BuildStatus;
import com.greenloop.orchestrator.model.CoverageGap;
import com.greenloop.orchestrator.model.QualityDashboard;
import com.greenloop.orchestrator.model.TestFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Read-only query of build, test and coverage state.
 *
 * Reports are only fetched when they can be trusted and are needed: nothing
 * after a compile error, failures only when the dashboard counts some,
 * coverage gaps only below 100%.
 */
public class StateProbe {

    private static final Logger log = LoggerFactory.getLogger(StateProbe.class);

    private final BuildRunner      buildRunner;
    private final DashboardReader  dashboardReader;
    private final FailureReporter  failureReporter;
    private final CoverageReporter coverageReporter;

    public StateProbe(BuildRunner buildRunner,
                      DashboardReader dashboardReader,
                      FailureReporter failureReporter,
                      CoverageReporter coverageReporter) {
        this.buildRunner      = buildRunner;
        this.dashboardReader  = dashboardReader;
        this.failureReporter  = failureReporter;
        this.coverageReporter = coverageReporter;
    }

    /**
     * @throws RemediationException of kind {@code PROBE_ERROR} if the harness or
     *         a report endpoint is unreachable; this is never remediable
     */
    public Snapshot probe() {
        try {
            BuildStatus build = buildRunner.run();
            if (build == null) {
                throw new RemediationException(RemediationException.Kind.PROBE_ERROR,
                        "Build harness returned no status");
            }
            if (build.hasCompileError()) {
                log.info("Build does not compile: {}", build.headline());
                return Snapshot.compileFailure(build);
            }

            QualityDashboard dashboard = dashboardReader.read();
            if (dashboard == null) {
                throw new RemediationException(RemediationException.Kind.PROBE_ERROR,
                        "Quality dashboard unavailable");
            }

            List<TestFailure> failures = dashboard.testSummary().hasProblems()
                    ? failureReporter.list()
                    : List.of();
            List<CoverageGap> gaps = dashboard.coverageSummary().fullyCovered()
                    ? List.of()
                    : coverageReporter.list();

            log.info("Probe: build={} tests={} failures={} errors={} lineCoverage={}%",
                    build.ok() ? "ok" : "failed",
                    dashboard.testSummary().total(),
                    dashboard.testSummary().failures(),
                    dashboard.testSummary().errors(),
                    dashboard.coverageSummary().linePercent());
            return new Snapshot(build, dashboard, failures, gaps);
        } catch (CollaboratorException e) {
            throw new RemediationException(RemediationException.Kind.PROBE_ERROR,
                    "Probe failed: " + e.getMessage(), e);
        }
    }
}
