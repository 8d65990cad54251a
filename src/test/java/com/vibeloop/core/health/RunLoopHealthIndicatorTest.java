package com.vibeloop.core.health;

import com.vibeloop.core.engine.RunManager;
import com.vibeloop.core.engine.RunState;
import com.vibeloop.core.engine.RunStatus;
import com.vibeloop.core.events.EventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RunLoopHealthIndicatorTest {

    private RunManager runManager;
    private RunLoopHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        runManager = mock(RunManager.class);
        EventBus eventBus = mock(EventBus.class);
        when(eventBus.subscriberCount()).thenReturn(2);
        indicator = new RunLoopHealthIndicator(runManager, eventBus);
    }

    @Test
    @DisplayName("reports IDLE before any run")
    void idle() {
        when(runManager.currentStatus()).thenReturn(Optional.empty());

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("IDLE", health.getDetails().get("state"));
        assertEquals(2, health.getDetails().get("subscribers"));
    }

    @Test
    @DisplayName("reports the current run's state and progress")
    void currentRun() {
        when(runManager.currentStatus()).thenReturn(Optional.of(
                new RunStatus("run-1", RunState.PAUSED, 4, 15, Instant.EPOCH)));

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("run-1", health.getDetails().get("runId"));
        assertEquals("PAUSED", health.getDetails().get("state"));
        assertEquals(4, health.getDetails().get("iteration"));
        assertEquals(15L, health.getDetails().get("lastSeq"));
    }
}
