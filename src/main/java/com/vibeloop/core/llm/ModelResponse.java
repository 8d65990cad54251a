package com.vibeloop.core.llm;

import com.vibeloop.core.contracts.Route;

/**
 * @param responder the model that produced the response
 * @param text      the assistant message
 */
public record ModelResponse(Route responder, String text) {}
