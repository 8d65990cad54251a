package com.vibeloop.core.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param iteration last completed iteration when the loop resumed
 */
public record ControlResumed(@JsonProperty("iteration") int iteration) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.CONTROL_RESUMED;
    }
}
