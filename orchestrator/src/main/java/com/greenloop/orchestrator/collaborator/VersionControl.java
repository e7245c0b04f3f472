package com.greenloop.orchestrator.collaborator;

import com.greenloop.orchestrator.model.RepositoryState;

/**
 * Version-control operations on the managed workspace.
 *
 * All methods throw {@link CollaboratorException} when the operation fails.
 */
public interface VersionControl {

    RepositoryState status();

    void stageAll();

    void commit(String message);

    /** Pushes the current branch. Pushing an up-to-date branch succeeds. */
    void push();

    /** Opens a pull/merge request for the current branch. @return the request URL */
    String openRequest(String title);
}
