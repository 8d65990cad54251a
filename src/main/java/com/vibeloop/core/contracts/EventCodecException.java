package com.vibeloop.core.contracts;

/**
 * Thrown when an event cannot be encoded to, or decoded from, its JSON form.
 */
public class EventCodecException extends RuntimeException {

    public EventCodecException(String message, Throwable cause) {
        super(message, cause);
    }

    public EventCodecException(String message) {
        super(message);
    }
}
