package com.vibeloop.core.storage;

/**
 * I/O failure while appending to or reading from a run's event log.
 */
public class EventLogException extends RuntimeException {

    public EventLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
