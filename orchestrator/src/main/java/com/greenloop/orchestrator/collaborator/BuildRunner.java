package com.greenloop.orchestrator.collaborator;

import com.greenloop.orchestrator.model.BuildStatus;

/** Runs the full build (compile, tests, coverage report) and reports the verdict. */
public interface BuildRunner {

    /** @throws CollaboratorException if the harness is unreachable or times out */
    BuildStatus run();
}
