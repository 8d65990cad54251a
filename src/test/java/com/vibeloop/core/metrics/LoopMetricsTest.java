package com.vibeloop.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LoopMetricsTest {

    private SimpleMeterRegistry registry;
    private LoopMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new LoopMetrics(registry);
    }

    @Test
    @DisplayName("recordIteration increments the counter and times by route")
    void recordIteration() {
        metrics.recordIteration("code", 1500);
        metrics.recordIteration("vision", 500);

        assertEquals(2.0, registry.get("vibe.iterations.total").counter().count());
        var timer = registry.get("vibe.iteration.duration").tag("route", "code").timer();
        assertEquals(1, timer.count());
        assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.1);
    }

    @Test
    @DisplayName("recordEventPublished counts by event type")
    void recordEventPublished() {
        metrics.recordEventPublished("prompt.sent");
        metrics.recordEventPublished("prompt.sent");
        metrics.recordEventPublished("error");

        assertEquals(2.0, registry.get("vibe.events.published").tag("type", "prompt.sent").counter().count());
        assertEquals(1.0, registry.get("vibe.events.published").tag("type", "error").counter().count());
    }

    @Test
    @DisplayName("recordRetry counts by collaborator")
    void recordRetry() {
        metrics.recordRetry("screenshot");

        assertEquals(1.0, registry.get("vibe.collaborator.retries").tag("where", "screenshot").counter().count());
    }

    @Test
    @DisplayName("recordSubscriberOverflow and recordRunResult increment their counters")
    void overflowAndRunResult() {
        metrics.recordSubscriberOverflow();
        metrics.recordRunResult("failed");

        assertEquals(1.0, registry.get("vibe.subscribers.overflow").counter().count());
        assertEquals(1.0, registry.get("vibe.runs.total").tag("result", "failed").counter().count());
    }
}
