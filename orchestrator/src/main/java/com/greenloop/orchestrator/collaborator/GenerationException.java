package com.greenloop.orchestrator.collaborator;

/** Thrown by a {@link PatchGenerator} that could not produce content. */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
