package com.greenloop.orchestrator.toolbox;

import com.greenloop.orchestrator.collaborator.CollaboratorException;

/**
 * Thrown when the toolbox service returns an error or is unreachable.
 */
public class ToolboxException extends CollaboratorException {

    private final int statusCode;

    public ToolboxException(String message) {
        this(message, 0);
    }

    public ToolboxException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ToolboxException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    /** HTTP status returned by the toolbox, or 0 when no response was received. */
    public int statusCode() { return statusCode; }
}
