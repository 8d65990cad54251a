package com.vibeloop.core.engine;

import com.vibeloop.core.llm.ModelResponse;

/**
 * Result of a completed iteration, input to the next default prompt.
 */
public record IterationOutcome(int iteration, ModelResponse response, String screenshotUrl) {}
