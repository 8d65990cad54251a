package com.vibeloop.core.health;

import com.vibeloop.core.engine.RunManager;
import com.vibeloop.core.engine.RunStatus;
import com.vibeloop.core.events.EventBus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Actuator health indicator for the run loop.
 * <p>
 * Always UP while the process serves requests; details carry the current run, its state and
 * progress, and the number of attached event subscribers. A stopped run is not a health problem,
 * a new one can be started at any time.
 */
@Component("runLoopHealthIndicator")
public class RunLoopHealthIndicator implements HealthIndicator {

    private final RunManager runManager;
    private final EventBus eventBus;

    public RunLoopHealthIndicator(RunManager runManager, EventBus eventBus) {
        this.runManager = runManager;
        this.eventBus = eventBus;
    }

    @Override
    public Health health() {
        var builder = Health.up().withDetail("subscribers", eventBus.subscriberCount());

        Optional<RunStatus> status = runManager.currentStatus();
        if (status.isEmpty()) {
            return builder.withDetail("state", "IDLE").build();
        }

        RunStatus current = status.get();
        return builder
                .withDetail("runId", current.runId())
                .withDetail("state", current.state().name())
                .withDetail("iteration", current.iteration())
                .withDetail("lastSeq", current.lastSeq())
                .build();
    }
}
