package com.greenloop.orchestrator.collaborator;

import com.greenloop.orchestrator.model.QualityDashboard;

/** Reads the aggregated test/coverage metrics produced by the last build. */
public interface DashboardReader {

    QualityDashboard read();
}
