package com.greenloop.orchestrator.collaborator;

import java.util.Optional;

/** Resolves a fully-qualified class name to a workspace-relative file path. */
public interface SourceLocator {

    /** @return the file path, or empty when no file declares the class */
    Optional<String> find(String classFqn);
}
