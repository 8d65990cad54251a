package com.vibeloop.core.contracts;

/**
 * @param actor     the model that answered
 * @param text      response text
 * @param iteration 1-based iteration index
 */
public record ResponseReceived(Route actor, String text, int iteration) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.RESPONSE_RECEIVED;
    }
}
