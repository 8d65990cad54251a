package com.vibeloop.core.events;

/**
 * Raised to a consumer whose subscriber was dropped because its delivery queue filled up.
 */
public class SubscriberOverflowException extends RuntimeException {

    public SubscriberOverflowException(String message) {
        super(message);
    }
}
