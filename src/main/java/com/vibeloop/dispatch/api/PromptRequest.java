package com.vibeloop.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body for {@code POST /api/prompt}. Content parts are kept as parsed JSON
 * (strings or maps) and passed through verbatim.
 */
public record PromptRequest(
    String actor,
    @JsonProperty("route_to") String routeTo,
    List<Object> content
) {}
