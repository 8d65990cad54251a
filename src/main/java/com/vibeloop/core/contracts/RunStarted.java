package com.vibeloop.core.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * First event of every run.
 *
 * @param maxIterations configured iteration budget, 0 when unbounded
 */
public record RunStarted(@JsonProperty("max_iterations") int maxIterations) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.RUN_STARTED;
    }
}
