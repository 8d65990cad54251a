package com.vibeloop.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the iteration engine.
 */
@Service
public class LoopMetrics {

    private final MeterRegistry registry;

    public LoopMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordIteration(String route, long ms) {
        Timer.builder("vibe.iteration.duration")
                .tag("route", route)
                .register(registry)
                .record(Duration.ofMillis(ms));
        Counter.builder("vibe.iterations.total")
                .register(registry)
                .increment();
    }

    public void recordEventPublished(String eventType) {
        Counter.builder("vibe.events.published")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    /**
     * Records a retry of a transient collaborator failure.
     *
     * @param where the collaborator call being retried (e.g. "model.code", "screenshot")
     */
    public void recordRetry(String where) {
        Counter.builder("vibe.collaborator.retries")
                .description("Transient collaborator failures that were retried")
                .tag("where", where)
                .register(registry)
                .increment();
    }

    public void recordSubscriberOverflow() {
        Counter.builder("vibe.subscribers.overflow")
                .description("Subscribers dropped because their delivery queue was full")
                .register(registry)
                .increment();
    }

    /**
     * @param result "completed" (budget exhausted) or "failed"
     */
    public void recordRunResult(String result) {
        Counter.builder("vibe.runs.total")
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
