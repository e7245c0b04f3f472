package com.greenloop.orchestrator.collaborator;

import com.greenloop.orchestrator.model.TestFailure;

import java.util.List;

/** Lists failing and erroring tests of the last build, in report order. */
public interface FailureReporter {

    List<TestFailure> list();
}
