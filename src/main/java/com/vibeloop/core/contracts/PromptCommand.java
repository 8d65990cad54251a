package com.vibeloop.core.contracts;

import java.util.List;
import java.util.Objects;

/**
 * A prompt to be consumed by the next iteration, either injected by a caller
 * or derived by the loop from the previous response.
 *
 * @param actor   who originated the prompt
 * @param routeTo which model receives it
 * @param content ordered content parts, opaque to the engine and passed through verbatim
 */
public record PromptCommand(Actor actor, Route routeTo, List<Object> content) {

    public PromptCommand {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(routeTo, "routeTo");
        content = List.copyOf(content);
    }
}
