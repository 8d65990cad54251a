package com.vibeloop.core.engine;

import com.vibeloop.core.contracts.ControlAction;
import com.vibeloop.core.contracts.ControlPaused;
import com.vibeloop.core.contracts.ControlResumed;
import com.vibeloop.core.contracts.ErrorOccurred;
import com.vibeloop.core.contracts.EventPayload;
import com.vibeloop.core.contracts.PromptCommand;
import com.vibeloop.core.contracts.PromptSent;
import com.vibeloop.core.contracts.ResponseReceived;
import com.vibeloop.core.contracts.RunEvent;
import com.vibeloop.core.contracts.RunStarted;
import com.vibeloop.core.contracts.ScreenshotCaptured;
import com.vibeloop.core.events.EventBus;
import com.vibeloop.core.handlers.FatalCollaboratorException;
import com.vibeloop.core.handlers.IterationHandler;
import com.vibeloop.core.llm.ModelResponse;
import com.vibeloop.core.logging.MdcContext;
import com.vibeloop.core.metrics.LoopMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * State machine driving the iterations of a single run.
 * <p>
 * One instance per run, executed on its own thread. That thread is the only writer of the run's
 * state and sequence counter and the only publisher of its events. Other threads interact through
 * {@link #control}, {@link #submitPrompt} and {@link #requestStop}, which only enqueue; queued
 * commands are applied between iterations, never in the middle of one.
 * <pre>
 * IDLE --start--> RUNNING --pause--> PAUSED --resume--> RUNNING
 * RUNNING|PAUSED --fatal error / stop--> STOPPED (error event)
 * RUNNING --budget exhausted--> STOPPED (no error event)
 * </pre>
 */
public class RunLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RunLoop.class);

    private enum Signal { PAUSE, RESUME, PROMPT, STOP }

    private final Run run;
    private final EventBus eventBus;
    private final IterationHandler handler;
    private final PromptPlanner planner;
    private final LoopMetrics metrics;
    private final Clock clock;
    private final int maxIterations;
    private final Duration iterationDelay;
    private final boolean startPaused;

    private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
    private final Queue<PromptCommand> pendingPrompts = new ConcurrentLinkedQueue<>();
    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile RunState state = RunState.IDLE;
    private volatile int completedIterations;
    private volatile long lastSeq;
    private volatile String stopReason;

    // Loop thread only
    private long nextSeq = 1;
    private IterationOutcome lastOutcome;

    public RunLoop(Run run,
                   EventBus eventBus,
                   IterationHandler handler,
                   PromptPlanner planner,
                   RunProperties properties,
                   LoopMetrics metrics,
                   Clock clock) {
        this.run = run;
        this.eventBus = eventBus;
        this.handler = handler;
        this.planner = planner;
        this.metrics = metrics;
        this.clock = clock;
        this.maxIterations = Math.max(0, properties.getMaxIterations());
        this.iterationDelay = properties.getIterationDelay() != null ? properties.getIterationDelay() : Duration.ZERO;
        this.startPaused = properties.isStartPaused();
    }

    @Override
    public void run() {
        MdcContext.setRun(run.id());
        try {
            state = RunState.RUNNING;
            emit(new RunStarted(maxIterations));
            log.info("Run {} started (max iterations: {}, delay: {}ms)",
                    run.id(), maxIterations == 0 ? "unbounded" : maxIterations, iterationDelay.toMillis());
            started.countDown();
            if (startPaused) {
                applySignal(Signal.PAUSE);
            }
            iterate();
        } catch (FatalCollaboratorException e) {
            fail(e.where(), e.getMessage(), e);
        } catch (InterruptedException e) {
            fail("control", stopReason != null ? stopReason : "Run interrupted", e);
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            fail("engine", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        } finally {
            state = RunState.STOPPED;
            started.countDown();
            terminated.countDown();
            MdcContext.clear();
        }
    }

    /**
     * Queues a pause or resume; applied at the next yield point between iterations.
     *
     * @throws RunNotActiveException if the run has stopped
     */
    public void control(ControlAction action) {
        ensureNotStopped();
        signals.offer(action == ControlAction.PAUSE ? Signal.PAUSE : Signal.RESUME);
        log.info("Accepted {} for run {}", action.wireName(), run.id());
    }

    /**
     * Queues a prompt to be used by the next iteration instead of the derived default.
     *
     * @throws RunNotActiveException if the run has stopped
     */
    public void submitPrompt(PromptCommand prompt) {
        ensureNotStopped();
        pendingPrompts.add(prompt);
        signals.offer(Signal.PROMPT);
        log.info("Queued {} prompt for {} route of run {}",
                prompt.actor().wireName(), prompt.routeTo().wireName(), run.id());
    }

    /**
     * Asks the loop to stop at its next yield point. Stopping is a fatal transition: the run
     * ends with an {@code error} event carrying {@code reason}.
     */
    public void requestStop(String reason) {
        if (state == RunState.STOPPED) {
            return;
        }
        stopReason = reason;
        signals.offer(Signal.STOP);
    }

    public boolean awaitStarted(Duration timeout) throws InterruptedException {
        return started.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Run runInfo() {
        return run;
    }

    public RunState state() {
        return state;
    }

    public RunStatus status() {
        return new RunStatus(run.id(), state, completedIterations, lastSeq, run.createdAt());
    }

    private void iterate() throws InterruptedException {
        while (true) {
            // Yield point: apply everything queued since the last iteration
            Signal signal;
            while ((signal = signals.poll()) != null) {
                applySignal(signal);
            }

            if (stopReason != null) {
                fail("control", stopReason, null);
                return;
            }
            if (maxIterations > 0 && completedIterations >= maxIterations) {
                state = RunState.STOPPED;
                metrics.recordRunResult("completed");
                log.info("Run {} completed its budget of {} iterations", run.id(), maxIterations);
                return;
            }
            if (state == RunState.PAUSED) {
                applySignal(signals.take());
                continue;
            }

            runIteration(completedIterations + 1);

            if (!iterationDelay.isZero() && !iterationDelay.isNegative()) {
                Signal early = signals.poll(iterationDelay.toMillis(), TimeUnit.MILLISECONDS);
                if (early != null) {
                    applySignal(early);
                }
            }
        }
    }

    private void runIteration(int iteration) {
        MdcContext.setIteration(run.id(), iteration);
        long start = System.currentTimeMillis();

        PromptCommand injected = pendingPrompts.poll();
        PromptCommand prompt = injected != null ? injected : planner.next(lastOutcome);
        emit(new PromptSent(prompt.actor(), prompt.routeTo(), prompt.content(), iteration));

        ModelResponse response = handler.exchange(run.id(), iteration, prompt);
        emit(new ResponseReceived(response.responder(), response.text(), iteration));

        String screenshotUrl = handler.capture(run.id(), iteration, response);
        emit(new ScreenshotCaptured(screenshotUrl, iteration));

        lastOutcome = new IterationOutcome(iteration, response, screenshotUrl);
        completedIterations = iteration;
        metrics.recordIteration(prompt.routeTo().wireName(), System.currentTimeMillis() - start);
        MdcContext.clearIteration();
    }

    private void applySignal(Signal signal) {
        switch (signal) {
            case PAUSE -> {
                if (state == RunState.RUNNING) {
                    state = RunState.PAUSED;
                    emit(new ControlPaused(completedIterations));
                    log.info("Run {} paused after iteration {}", run.id(), completedIterations);
                } else {
                    log.debug("Pause ignored, run {} is {}", run.id(), state);
                }
            }
            case RESUME -> {
                if (state == RunState.PAUSED) {
                    state = RunState.RUNNING;
                    emit(new ControlResumed(completedIterations));
                    log.info("Run {} resumed after iteration {}", run.id(), completedIterations);
                } else {
                    log.debug("Resume ignored, run {} is {}", run.id(), state);
                }
            }
            case PROMPT, STOP -> {
                // wake-up only; prompts are taken at the start of the next iteration, stop at the yield point
            }
        }
    }

    private void fail(String where, String message, Throwable cause) {
        if (state == RunState.STOPPED) {
            return;
        }
        if (cause != null) {
            log.error("Run {} failed in {}: {}", run.id(), where, message, cause);
        } else {
            log.error("Run {} stopped in {}: {}", run.id(), where, message);
        }
        // The log is written through an interruptible channel: an interrupted thread would close it
        // instead of writing the error event.
        boolean interrupted = Thread.interrupted();
        try {
            emit(new ErrorOccurred(message, where));
        } catch (RuntimeException e) {
            log.error("Could not record error event for run {}", run.id(), e);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        state = RunState.STOPPED;
        metrics.recordRunResult("failed");
    }

    private void emit(EventPayload payload) {
        RunEvent event = new RunEvent(run.id(), nextSeq, clock.instant().truncatedTo(ChronoUnit.MILLIS), payload);
        eventBus.publish(event);
        lastSeq = nextSeq;
        nextSeq++;
    }

    private void ensureNotStopped() {
        if (state == RunState.STOPPED) {
            throw new RunNotActiveException("Run " + run.id() + " has stopped; start a new run");
        }
    }
}
