package com.vibeloop.core.contracts;

/**
 * Kind-specific body of a {@link RunEvent}. Each implementation is bound to exactly
 * one {@link EventType}.
 */
public interface EventPayload {

    EventType eventType();
}
