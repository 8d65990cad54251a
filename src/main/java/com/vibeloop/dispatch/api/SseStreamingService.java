package com.vibeloop.dispatch.api;

import com.vibeloop.core.contracts.EventCodec;
import com.vibeloop.core.contracts.RunEvent;
import com.vibeloop.core.events.EventBus;
import com.vibeloop.core.events.EventBusProperties;
import com.vibeloop.core.events.Subscriber;
import com.vibeloop.core.events.SubscriberOverflowException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges {@link EventBus} subscribers to {@link SseEmitter} instances.
 * <p>
 * Each emitter gets its own {@link Subscriber} and a pump thread that drains it, so a slow
 * HTTP client only ever fills its own queue. Replayed history is sent before live events; every
 * message carries the event JSON as data and the sequence number as the SSE id, which browsers
 * send back as {@code Last-Event-ID} on reconnect.
 * <p>
 * Heartbeats are sent as SSE comments to keep idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    /** How often a pump re-checks whether its emitter is still registered. */
    private static final Duration POLL_INTERVAL = Duration.ofMillis(500);

    private final EventBus eventBus;
    private final EventCodec codec;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    private final AtomicInteger pumpCounter = new AtomicInteger();
    private final ExecutorService pumpExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sse-pump-" + pumpCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, EventCodec codec, EventBusProperties properties) {
        this(eventBus, codec, properties.getSseTimeout().toMillis());
    }

    SseStreamingService(EventBus eventBus, EventCodec codec, long timeoutMs) {
        this.eventBus = eventBus;
        this.codec = codec;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void shutdown() {
        heartbeatScheduler.shutdownNow();
        for (EmitterRegistration registration : activeRegistrations) {
            cleanup(registration);
        }
        pumpExecutor.shutdownNow();
        try {
            pumpExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("SSE streaming stopped");
    }

    /**
     * Creates an emitter streaming events of {@code runId} with {@code seq > afterSeq}.
     *
     * @param runId    the run to follow, or {@code null} for live events of every run
     * @param afterSeq last sequence number the client already has, 0 for full history
     */
    public SseEmitter createEmitter(String runId, long afterSeq) {
        SseEmitter emitter = newEmitter(timeoutMs);
        Subscriber subscriber = eventBus.subscribe(runId, afterSeq);

        var registration = new EmitterRegistration(runId != null ? runId : "*", emitter, subscriber);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for run {}", registration.runId());
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for run {}", registration.runId());
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for run {}: {}", registration.runId(), ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for run {}: {}", registration.runId(), e.getMessage());
        }

        pumpExecutor.execute(() -> pump(registration));
        log.info("SSE emitter created for run {} after #{} (timeout={}ms)", registration.runId(), afterSeq, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    SseEmitter newEmitter(long timeoutMs) {
        return new SseEmitter(timeoutMs);
    }

    private void pump(EmitterRegistration registration) {
        Subscriber subscriber = registration.subscriber();
        SseEmitter emitter = registration.emitter();
        try {
            while (true) {
                RunEvent event = subscriber.poll(POLL_INTERVAL);
                if (event == null) {
                    if (subscriber.isClosed()) {
                        return;
                    }
                    continue;
                }
                emitter.send(SseEmitter.event()
                        .id(Long.toString(event.seq()))
                        .data(codec.encode(event)));
            }
        } catch (SubscriberOverflowException e) {
            log.warn("SSE client for run {} could not keep up: {}", registration.runId(), e.getMessage());
            emitter.completeWithError(e);
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE client for run {} went away: {}", registration.runId(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            cleanup(registration);
        }
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                log.debug("Heartbeat failed for run {} (connection likely closed): {}",
                        registration.runId(), e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for run {} (emitter not active)", registration.runId());
            }
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (activeRegistrations.remove(registration)) {
            eventBus.unsubscribe(registration.subscriber());
            log.debug("Cleaned up SSE registration for run {}", registration.runId());
        }
    }

    private record EmitterRegistration(
            String runId,
            SseEmitter emitter,
            Subscriber subscriber
    ) {}
}
