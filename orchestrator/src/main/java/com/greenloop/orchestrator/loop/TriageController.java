package com.greenloop.orchestrator.loop;

import com.greenloop.orchestrator.model.QualityDashboard;
import com.greenloop.orchestrator.model.Workflow;

/**
 * Picks the next workflow from a snapshot.
 *
 * Stateless and deterministic: the same snapshot always yields the same
 * workflow. Rules are evaluated top-down, first match wins:
 * <ol>
 *   <li>compile error in the build → {@link Workflow#FIX_COMPILE_ERROR}</li>
 *   <li>any test failure or error → {@link Workflow#FIX_TEST_FAILURE}</li>
 *   <li>line coverage below 100% → {@link Workflow#IMPROVE_COVERAGE}</li>
 *   <li>otherwise {@link Workflow#NONE}</li>
 * </ol>
 * A tree that does not compile invalidates every other signal, so rule 1
 * ignores the dashboard entirely.
 */
public class TriageController {

    public Workflow decide(Snapshot snapshot) {
        if (snapshot.compileError()) {
            return Workflow.FIX_COMPILE_ERROR;
        }
        QualityDashboard dashboard = snapshot.dashboard();
        if (dashboard == null) {
            // StateProbe always attaches a dashboard to a compiling build; only
            // snapshots built by hand reach this.
            return Workflow.NONE;
        }
        if (dashboard.testSummary().failures() > 0 || dashboard.testSummary().errors() > 0) {
            return Workflow.FIX_TEST_FAILURE;
        }
        if (dashboard.coverageSummary().linePercent() < 100.0) {
            return Workflow.IMPROVE_COVERAGE;
        }
        return Workflow.NONE;
    }
}
