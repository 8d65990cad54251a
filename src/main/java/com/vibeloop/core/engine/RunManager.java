package com.vibeloop.core.engine;

import com.vibeloop.core.contracts.ControlCommand;
import com.vibeloop.core.contracts.PromptCommand;
import com.vibeloop.core.events.EventBus;
import com.vibeloop.core.handlers.IterationHandler;
import com.vibeloop.core.metrics.LoopMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the single active {@link RunLoop}.
 * <p>
 * A loop is created when a run starts and replaced by the next start once it has stopped;
 * at most one run is RUNNING or PAUSED at any time.
 */
@Service
public class RunManager {

    private static final Logger log = LoggerFactory.getLogger(RunManager.class);

    private static final Duration START_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private final EventBus eventBus;
    private final IterationHandler handler;
    private final PromptPlanner planner;
    private final RunProperties properties;
    private final LoopMetrics metrics;
    private final Clock clock;

    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "run-loop-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final Object lock = new Object();
    private volatile RunLoop current;

    @Autowired
    public RunManager(EventBus eventBus, IterationHandler handler, PromptPlanner planner,
                      RunProperties properties, LoopMetrics metrics) {
        this(eventBus, handler, planner, properties, metrics, Clock.systemUTC());
    }

    public RunManager(EventBus eventBus, IterationHandler handler, PromptPlanner planner,
                      RunProperties properties, LoopMetrics metrics, Clock clock) {
        this.eventBus = eventBus;
        this.handler = handler;
        this.planner = planner;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Starts a new run and waits until it has emitted {@code run.started}.
     *
     * @throws RunAlreadyActiveException if the current run is still running or paused
     */
    public RunStatus start() {
        synchronized (lock) {
            RunLoop existing = current;
            if (existing != null && existing.state() != RunState.STOPPED) {
                throw new RunAlreadyActiveException("Run " + existing.runInfo().id() + " is still "
                        + existing.state().name().toLowerCase());
            }

            RunLoop loop = new RunLoop(Run.create(clock), eventBus, handler, planner, properties, metrics, clock);
            current = loop;
            executor.execute(loop);
            try {
                if (!loop.awaitStarted(START_TIMEOUT)) {
                    log.warn("Run {} did not report started within {}s", loop.runInfo().id(), START_TIMEOUT.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("Started run {}", loop.runInfo().id());
            return loop.status();
        }
    }

    public void control(ControlCommand command) {
        activeLoop().control(command.action());
    }

    public void prompt(PromptCommand command) {
        activeLoop().submitPrompt(command);
    }

    public Optional<RunStatus> currentStatus() {
        RunLoop loop = current;
        return loop != null ? Optional.of(loop.status()) : Optional.empty();
    }

    public Optional<String> currentRunId() {
        RunLoop loop = current;
        return loop != null ? Optional.of(loop.runInfo().id()) : Optional.empty();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        if (properties.isAutoStart() && event.getApplicationContext() instanceof WebServerApplicationContext) {
            log.info("Auto-starting a run");
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        RunLoop loop = current;
        if (loop != null && loop.state() != RunState.STOPPED) {
            loop.requestStop("Server shutting down");
            try {
                if (!loop.awaitTermination(STOP_TIMEOUT)) {
                    log.warn("Run {} did not stop within {}s, interrupting", loop.runInfo().id(), STOP_TIMEOUT.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private RunLoop activeLoop() {
        RunLoop loop = current;
        if (loop == null) {
            throw new RunNotActiveException("No run has been started");
        }
        return loop;
    }
}
