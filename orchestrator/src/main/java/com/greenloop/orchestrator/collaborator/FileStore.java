package com.greenloop.orchestrator.collaborator;

/**
 * Whole-file access to the workspace.
 *
 * Writes always replace the entire file; there are no partial updates.
 */
public interface FileStore {

    /** @throws CollaboratorException if the file cannot be read */
    String read(String path);

    /** @throws CollaboratorException if the write is rejected */
    void write(String path, String content);
}
