package com.vibeloop.core.engine;

/**
 * Thrown when a command targets a run that has not started or has already stopped.
 */
public class RunNotActiveException extends RuntimeException {

    public RunNotActiveException(String message) {
        super(message);
    }
}
