package com.vibeloop.core.handlers;

/**
 * A collaborator failure worth retrying (timeout, rate limit, temporary unavailability).
 */
public class TransientCollaboratorException extends RuntimeException {

    public TransientCollaboratorException(String message) {
        super(message);
    }

    public TransientCollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
