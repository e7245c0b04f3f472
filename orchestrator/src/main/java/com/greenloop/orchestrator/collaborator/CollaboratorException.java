package com.greenloop.orchestrator.collaborator;

/**
 * Thrown by collaborator adapters when a call is unreachable, times out or
 * is rejected by the far side.
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
