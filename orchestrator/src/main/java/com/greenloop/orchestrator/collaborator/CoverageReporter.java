package com.greenloop.orchestrator.collaborator;

import com.greenloop.orchestrator.model.CoverageGap;

import java.util.List;

/** Lists classes with uncovered lines from the last build, in report order. */
public interface CoverageReporter {

    List<CoverageGap> list();
}
