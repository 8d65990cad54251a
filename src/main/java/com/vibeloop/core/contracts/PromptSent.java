package com.vibeloop.core.contracts;

import java.util.List;

/**
 * A prompt was handed to a model.
 *
 * @param actor     originator of the prompt
 * @param to        model the prompt is routed to
 * @param content   content parts exactly as submitted or derived
 * @param iteration 1-based iteration index
 */
public record PromptSent(Actor actor, Route to, List<Object> content, int iteration) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.PROMPT_SENT;
    }
}
