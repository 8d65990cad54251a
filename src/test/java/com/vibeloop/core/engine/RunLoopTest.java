package com.vibeloop.core.engine;

import com.vibeloop.core.browser.ScreenshotCapturer;
import com.vibeloop.core.contracts.Actor;
import com.vibeloop.core.contracts.ControlAction;
import com.vibeloop.core.contracts.ErrorOccurred;
import com.vibeloop.core.contracts.EventCodec;
import com.vibeloop.core.contracts.EventType;
import com.vibeloop.core.contracts.PromptCommand;
import com.vibeloop.core.contracts.PromptSent;
import com.vibeloop.core.contracts.ResponseReceived;
import com.vibeloop.core.contracts.Route;
import com.vibeloop.core.contracts.RunEvent;
import com.vibeloop.core.contracts.RunStarted;
import com.vibeloop.core.contracts.ScreenshotCaptured;
import com.vibeloop.core.events.EventBus;
import com.vibeloop.core.events.EventBusProperties;
import com.vibeloop.core.events.Subscriber;
import com.vibeloop.core.handlers.IterationHandler;
import com.vibeloop.core.handlers.RetryPolicy;
import com.vibeloop.core.handlers.RetryProperties;
import com.vibeloop.core.handlers.TransientCollaboratorException;
import com.vibeloop.core.llm.ContentParts;
import com.vibeloop.core.llm.ModelClient;
import com.vibeloop.core.llm.ModelResponse;
import com.vibeloop.core.metrics.LoopMetrics;
import com.vibeloop.core.storage.EventLog;
import com.vibeloop.core.storage.RunPaths;
import com.vibeloop.core.storage.WorkspaceManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RunLoop}, driving real storage, bus and handlers with scripted collaborators.
 */
class RunLoopTest {

    private static final String RUN = "test-run";
    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final Duration QUIET = Duration.ofMillis(300);

    @TempDir
    Path root;

    private SimpleMeterRegistry registry;
    private EventLog eventLog;
    private EventBus eventBus;
    private RunProperties runProperties;
    private ScriptedModel model;
    private ScriptedBrowser browser;
    private IterationHandler handler;
    private LoopMetrics metrics;
    private Thread loopThread;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new LoopMetrics(registry);
        RunPaths paths = new RunPaths(root);
        eventLog = new EventLog(paths, new EventCodec());
        EventBusProperties busProperties = new EventBusProperties();
        busProperties.setSubscriberQueueCapacity(1024);
        eventBus = new EventBus(eventLog, busProperties, metrics);

        RetryProperties retry = new RetryProperties();
        retry.setMaxAttempts(3);
        retry.setBaseDelay(Duration.ZERO);
        retry.setMaxDelay(Duration.ZERO);

        model = new ScriptedModel();
        browser = new ScriptedBrowser();
        handler = new IterationHandler(model, browser, new WorkspaceManager(paths), paths,
                new RetryPolicy(retry, metrics, delay -> { }));

        runProperties = new RunProperties();
        runProperties.setIterationDelay(Duration.ZERO);
        runProperties.setInitialPrompt("make a landing page");
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        browser.release();
        if (loopThread != null) {
            loopThread.interrupt();
            loopThread.join(WAIT.toMillis());
        }
    }

    private RunLoop newLoop(int maxIterations) {
        runProperties.setMaxIterations(maxIterations);
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        return new RunLoop(new Run(RUN, clock.instant()), eventBus, handler,
                new PromptPlanner(runProperties), runProperties, metrics, clock);
    }

    private void start(RunLoop loop) throws InterruptedException {
        loopThread = new Thread(loop, "run-loop-test");
        loopThread.start();
        assertTrue(loop.awaitStarted(WAIT));
    }

    private static RunEvent next(Subscriber subscriber) throws InterruptedException {
        RunEvent event = subscriber.poll(WAIT);
        assertNotNull(event, "timed out waiting for an event");
        return event;
    }

    private static void expectQuiet(Subscriber subscriber) throws InterruptedException {
        RunEvent event = subscriber.poll(QUIET);
        assertNull(event, () -> "unexpected event " + event.type().wireName());
    }

    private static List<EventType> types(List<RunEvent> events) {
        return events.stream().map(RunEvent::type).toList();
    }

    private List<RunEvent> finish(RunLoop loop) throws InterruptedException {
        assertTrue(loop.awaitTermination(WAIT));
        return eventLog.read(RUN);
    }

    @Nested
    @DisplayName("uninterrupted run")
    class UninterruptedRunTests {

        @Test
        @DisplayName("each iteration emits prompt.sent, response.received, screenshot.captured in order")
        void threeEventsPerIteration() throws Exception {
            RunLoop loop = newLoop(3);
            start(loop);

            List<RunEvent> events = finish(loop);

            assertEquals(List.of(
                    EventType.RUN_STARTED,
                    EventType.PROMPT_SENT, EventType.RESPONSE_RECEIVED, EventType.SCREENSHOT_CAPTURED,
                    EventType.PROMPT_SENT, EventType.RESPONSE_RECEIVED, EventType.SCREENSHOT_CAPTURED,
                    EventType.PROMPT_SENT, EventType.RESPONSE_RECEIVED, EventType.SCREENSHOT_CAPTURED
            ), types(events));
            assertEquals(new RunStarted(3), events.get(0).payload());
            assertEquals(RunState.STOPPED, loop.state());
        }

        @Test
        @DisplayName("sequence numbers start at 1 and have no gaps")
        void gapFreeSequence() throws Exception {
            RunLoop loop = newLoop(4);
            start(loop);

            List<RunEvent> events = finish(loop);

            for (int i = 0; i < events.size(); i++) {
                assertEquals(i + 1, events.get(i).seq());
            }
            assertEquals(events.size(), loop.status().lastSeq());
        }

        @Test
        @DisplayName("exactly one screenshot per completed iteration, numbered by iteration")
        void oneScreenshotPerIteration() throws Exception {
            RunLoop loop = newLoop(3);
            start(loop);

            List<ScreenshotCaptured> shots = finish(loop).stream()
                    .map(RunEvent::payload)
                    .filter(ScreenshotCaptured.class::isInstance)
                    .map(ScreenshotCaptured.class::cast)
                    .toList();

            assertEquals(List.of(1, 2, 3), shots.stream().map(ScreenshotCaptured::iteration).toList());
            assertEquals("/static/runs/test-run/screenshots/snap_2.png", shots.get(1).url());
            assertEquals(3, loop.status().iteration());
        }

        @Test
        @DisplayName("default prompts alternate between the code and vision models")
        void alternatesModels() throws Exception {
            RunLoop loop = newLoop(3);
            start(loop);

            List<PromptSent> prompts = finish(loop).stream()
                    .map(RunEvent::payload)
                    .filter(PromptSent.class::isInstance)
                    .map(PromptSent.class::cast)
                    .toList();

            assertEquals(Actor.USER, prompts.get(0).actor());
            assertEquals(Route.CODE, prompts.get(0).to());
            assertEquals(List.of(ContentParts.textPart("make a landing page")), prompts.get(0).content());

            assertEquals(Actor.CODE, prompts.get(1).actor());
            assertEquals(Route.VISION, prompts.get(1).to());
            assertEquals(List.of("/static/runs/test-run/screenshots/snap_1.png"),
                    ContentParts.imageUrls(prompts.get(1).content()));

            assertEquals(Actor.VISION, prompts.get(2).actor());
            assertEquals(Route.CODE, prompts.get(2).to());
            assertEquals(ScriptedModel.CRITIQUE, ContentParts.text(prompts.get(2).content()));
        }

        @Test
        @DisplayName("budget exhaustion stops without an error event and records a completed run")
        void budgetExhausted() throws Exception {
            RunLoop loop = newLoop(1);
            start(loop);

            List<RunEvent> events = finish(loop);

            assertFalse(types(events).contains(EventType.ERROR));
            assertEquals(1.0, registry.get("vibe.runs.total").tag("result", "completed").counter().count());
            assertEquals(1.0, registry.get("vibe.iterations.total").counter().count());
        }
    }

    @Nested
    @DisplayName("pause and resume")
    class PauseResumeTests {

        @Test
        @DisplayName("pause sent during an iteration takes effect before the next prompt")
        void pauseBetweenIterations() throws Exception {
            browser.holdFirstCapture();
            Subscriber subscriber = eventBus.subscribe(RUN);
            RunLoop loop = newLoop(2);
            start(loop);

            assertEquals(EventType.RUN_STARTED, next(subscriber).type());
            assertEquals(EventType.PROMPT_SENT, next(subscriber).type());
            assertEquals(EventType.RESPONSE_RECEIVED, next(subscriber).type());
            assertTrue(browser.awaitHeld());

            loop.control(ControlAction.PAUSE);
            browser.release();

            assertEquals(EventType.SCREENSHOT_CAPTURED, next(subscriber).type());
            RunEvent paused = next(subscriber);
            assertEquals(EventType.CONTROL_PAUSED, paused.type());
            expectQuiet(subscriber);
            assertEquals(RunState.PAUSED, loop.state());

            loop.control(ControlAction.RESUME);

            assertEquals(EventType.CONTROL_RESUMED, next(subscriber).type());
            RunEvent prompt = next(subscriber);
            assertEquals(EventType.PROMPT_SENT, prompt.type());
            assertEquals(2, ((PromptSent) prompt.payload()).iteration());
            finish(loop);
        }

        @Test
        @DisplayName("a run can start paused and wait for resume")
        void startPaused() throws Exception {
            runProperties.setStartPaused(true);
            Subscriber subscriber = eventBus.subscribe(RUN);
            RunLoop loop = newLoop(1);
            start(loop);

            assertEquals(EventType.RUN_STARTED, next(subscriber).type());
            assertEquals(EventType.CONTROL_PAUSED, next(subscriber).type());
            expectQuiet(subscriber);
            assertEquals(0, model.calls.get());

            loop.control(ControlAction.RESUME);

            assertEquals(EventType.CONTROL_RESUMED, next(subscriber).type());
            assertEquals(EventType.PROMPT_SENT, next(subscriber).type());
            finish(loop);
        }

        @Test
        @DisplayName("pause while paused and resume while running emit nothing")
        void idempotentControl() throws Exception {
            runProperties.setStartPaused(true);
            Subscriber subscriber = eventBus.subscribe(RUN);
            RunLoop loop = newLoop(1);
            start(loop);
            next(subscriber);
            next(subscriber);

            loop.control(ControlAction.PAUSE);
            expectQuiet(subscriber);

            loop.control(ControlAction.RESUME);
            loop.control(ControlAction.RESUME);

            List<RunEvent> events = finish(loop);
            assertEquals(1, types(events).stream().filter(t -> t == EventType.CONTROL_PAUSED).count());
            assertEquals(1, types(events).stream().filter(t -> t == EventType.CONTROL_RESUMED).count());
            assertFalse(types(events).contains(EventType.ERROR));
        }
    }

    @Nested
    @DisplayName("injected prompts")
    class InjectedPromptTests {

        @Test
        @DisplayName("the next prompt.sent carries the injected content verbatim")
        void injectedPromptUsedNext() throws Exception {
            browser.holdFirstCapture();
            RunLoop loop = newLoop(3);
            start(loop);
            assertTrue(browser.awaitHeld());

            loop.submitPrompt(new PromptCommand(Actor.USER, Route.CODE, List.of("add a button")));
            browser.release();

            List<PromptSent> prompts = finish(loop).stream()
                    .map(RunEvent::payload)
                    .filter(PromptSent.class::isInstance)
                    .map(PromptSent.class::cast)
                    .toList();

            PromptSent second = prompts.get(1);
            assertEquals(Actor.USER, second.actor());
            assertEquals(Route.CODE, second.to());
            assertEquals(List.of("add a button"), second.content());
            assertEquals(2, second.iteration());
        }

        @Test
        @DisplayName("the loop continues from the injected prompt's response")
        void continuesAfterInjection() throws Exception {
            browser.holdFirstCapture();
            RunLoop loop = newLoop(3);
            start(loop);
            assertTrue(browser.awaitHeld());

            loop.submitPrompt(new PromptCommand(Actor.USER, Route.VISION, List.of("what is off?")));
            browser.release();

            List<RunEvent> events = finish(loop);
            List<Route> answered = events.stream()
                    .map(RunEvent::payload)
                    .filter(ResponseReceived.class::isInstance)
                    .map(p -> ((ResponseReceived) p).actor())
                    .toList();
            assertEquals(List.of(Route.CODE, Route.VISION, Route.CODE), answered);
        }
    }

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("transient screenshot failures are retried without an error event")
        void transientScreenshotFailures() throws Exception {
            browser.failTransiently(2);
            RunLoop loop = newLoop(1);
            start(loop);

            List<RunEvent> events = finish(loop);

            assertEquals(List.of(EventType.RUN_STARTED, EventType.PROMPT_SENT,
                    EventType.RESPONSE_RECEIVED, EventType.SCREENSHOT_CAPTURED), types(events));
            assertEquals(3, browser.attempts.get());
            assertEquals(2.0, registry.get("vibe.collaborator.retries").tag("where", "screenshot").counter().count());
        }

        @Test
        @DisplayName("a fatal model failure emits one error event and stops the run")
        void fatalModelFailure() throws Exception {
            model.failWith(new IllegalStateException("401 - invalid api key"));
            RunLoop loop = newLoop(5);
            start(loop);

            List<RunEvent> events = finish(loop);

            assertEquals(List.of(EventType.RUN_STARTED, EventType.PROMPT_SENT, EventType.ERROR), types(events));
            ErrorOccurred error = (ErrorOccurred) events.get(2).payload();
            assertEquals("model.code", error.where());
            assertTrue(error.msg().contains("401"));
            assertEquals(RunState.STOPPED, loop.state());
            assertEquals(1.0, registry.get("vibe.runs.total").tag("result", "failed").counter().count());
        }

        @Test
        @DisplayName("commands are rejected once the run has stopped")
        void commandsRejectedAfterStop() throws Exception {
            model.failWith(new IllegalStateException("boom"));
            RunLoop loop = newLoop(5);
            start(loop);
            finish(loop);

            assertThrows(RunNotActiveException.class, () -> loop.control(ControlAction.RESUME));
            assertThrows(RunNotActiveException.class,
                    () -> loop.submitPrompt(new PromptCommand(Actor.USER, Route.CODE, List.of("x"))));
            assertEquals(3, eventLog.read(RUN).size());
        }

        @Test
        @DisplayName("requestStop ends a paused run with a control error")
        void requestStop() throws Exception {
            runProperties.setStartPaused(true);
            RunLoop loop = newLoop(5);
            start(loop);

            loop.requestStop("Server shutting down");

            List<RunEvent> events = finish(loop);
            RunEvent last = events.get(events.size() - 1);
            assertEquals(new ErrorOccurred("Server shutting down", "control"), last.payload());
            assertEquals(1, types(events).stream().filter(t -> t == EventType.ERROR).count());
        }

        @Test
        @DisplayName("interrupting a paused loop still logs the terminal error event")
        void interruptedWhilePaused() throws Exception {
            runProperties.setStartPaused(true);
            RunLoop loop = newLoop(5);
            Subscriber subscriber = eventBus.subscribe(RUN);
            start(loop);
            assertEquals(EventType.RUN_STARTED, next(subscriber).type());
            assertEquals(EventType.CONTROL_PAUSED, next(subscriber).type());

            loopThread.interrupt();

            List<RunEvent> events = finish(loop);
            assertEquals(List.of(EventType.RUN_STARTED, EventType.CONTROL_PAUSED, EventType.ERROR), types(events));
            assertEquals(new ErrorOccurred("Run interrupted", "control"), events.get(2).payload());
            assertEquals(RunState.STOPPED, loop.state());
        }

        @Test
        @DisplayName("an interrupted retry backoff still logs the terminal error event")
        void interruptedDuringBackoff() throws Exception {
            RetryProperties retry = new RetryProperties();
            retry.setMaxAttempts(3);
            RunPaths paths = new RunPaths(root);
            handler = new IterationHandler(model, browser, new WorkspaceManager(paths), paths,
                    new RetryPolicy(retry, metrics, delay -> {
                        throw new InterruptedException("backoff interrupted");
                    }));
            model.failWith(new TransientCollaboratorException("503 upstream busy"));
            RunLoop loop = newLoop(5);
            start(loop);

            List<RunEvent> events = finish(loop);

            assertEquals(List.of(EventType.RUN_STARTED, EventType.PROMPT_SENT, EventType.ERROR), types(events));
            ErrorOccurred error = (ErrorOccurred) events.get(2).payload();
            assertEquals("model.code", error.where());
            assertTrue(error.msg().contains("interrupted during backoff"));
        }
    }

    /**
     * Answers code prompts with an html block and vision prompts with a fixed critique.
     */
    private static final class ScriptedModel implements ModelClient {

        static final String CRITIQUE = "make the header bigger";

        final AtomicInteger calls = new AtomicInteger();
        private volatile RuntimeException failure;

        void failWith(RuntimeException failure) {
            this.failure = failure;
        }

        @Override
        public ModelResponse exchange(Route route, List<Object> content) {
            calls.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
            return route == Route.CODE
                    ? new ModelResponse(route, "```html\n<h1>Landing</h1>\n```")
                    : new ModelResponse(route, CRITIQUE);
        }
    }

    /**
     * Writes a tiny file as the screenshot; can hold the first capture or fail transiently.
     */
    private static final class ScriptedBrowser implements ScreenshotCapturer {

        final AtomicInteger attempts = new AtomicInteger();
        private final AtomicInteger transientFailures = new AtomicInteger();
        private final CountDownLatch held = new CountDownLatch(1);
        private final CountDownLatch released = new CountDownLatch(1);
        private volatile boolean holdFirst;

        void holdFirstCapture() {
            holdFirst = true;
        }

        boolean awaitHeld() throws InterruptedException {
            return held.await(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        }

        void release() {
            released.countDown();
        }

        void failTransiently(int times) {
            transientFailures.set(times);
        }

        @Override
        public void capture(Path page, Path output) {
            if (attempts.incrementAndGet() == 1 && holdFirst) {
                held.countDown();
                try {
                    released.await(WAIT.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (transientFailures.getAndDecrement() > 0) {
                throw new TransientCollaboratorException("browser not ready");
            }
            try {
                Files.write(output, new byte[]{(byte) 0x89, 'P', 'N', 'G'});
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
