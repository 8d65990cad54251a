package com.vibeloop.core.llm;

import com.vibeloop.core.contracts.Route;

import java.util.List;

/**
 * Boundary to the code and vision models.
 * <p>
 * Implementations throw on failure; transient failures should be recognisable by
 * {@link com.vibeloop.core.handlers.CollaboratorFailures} so the caller can retry them.
 */
public interface ModelClient {

    /**
     * Sends one prompt to the model selected by {@code route}.
     *
     * @param route   code or vision model
     * @param content content parts as submitted (strings, text parts, image_url parts)
     */
    ModelResponse exchange(Route route, List<Object> content);
}
