package com.vibeloop.core.contracts;

/**
 * Thrown when an inbound command fails validation at the HTTP boundary.
 * Never reaches the run loop and never produces an event.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
