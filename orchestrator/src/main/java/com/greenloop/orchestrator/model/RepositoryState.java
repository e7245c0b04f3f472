package com.greenloop.orchestrator.model;

/**
 * Working-tree state reported by version control.
 *
 * @param clean   true when there is nothing to stage or commit
 * @param changes porcelain listing of pending changes; empty when clean
 */
public record RepositoryState(boolean clean, String changes) {

    public static RepositoryState cleanTree() {
        return new RepositoryState(true, "");
    }

    public static RepositoryState dirty(String changes) {
        return new RepositoryState(false, changes == null ? "" : changes);
    }
}
