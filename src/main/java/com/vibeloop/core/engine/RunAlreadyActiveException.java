package com.vibeloop.core.engine;

/**
 * Thrown when starting a run while another one is still running or paused.
 */
public class RunAlreadyActiveException extends RuntimeException {

    public RunAlreadyActiveException(String message) {
        super(message);
    }
}
