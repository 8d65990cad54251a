package com.vibeloop.core.handlers;

/**
 * A collaborator failure that terminates the run: non-transient, or transient with retries exhausted.
 */
public class FatalCollaboratorException extends RuntimeException {

    private final String where;

    public FatalCollaboratorException(String where, String message, Throwable cause) {
        super(message, cause);
        this.where = where;
    }

    public FatalCollaboratorException(String where, String message) {
        super(message);
        this.where = where;
    }

    /**
     * @return the failing call, e.g. "model.code" or "screenshot"
     */
    public String where() {
        return where;
    }
}
