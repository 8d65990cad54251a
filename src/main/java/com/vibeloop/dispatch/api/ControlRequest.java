package com.vibeloop.dispatch.api;

/**
 * Request body for {@code POST /api/control}. Raw strings; validated by
 * {@link com.vibeloop.core.contracts.CommandValidator}.
 */
public record ControlRequest(String action) {}
