package com.vibeloop.core.events;

import com.vibeloop.core.contracts.RunEvent;
import com.vibeloop.core.metrics.LoopMetrics;
import com.vibeloop.core.storage.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process pub/sub channel between the run loop (sole publisher) and live observers.
 * <p>
 * Every published event is appended to the {@link EventLog} before it becomes visible to any
 * subscriber. Each subscriber owns a bounded queue; a subscriber whose queue is full is dropped
 * instead of blocking the publisher. Subscribing to a run replays its logged history first, and
 * replay capture and registration happen under the same lock as publishing, so a subscriber sees
 * every event exactly once and in sequence order.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final EventLog eventLog;
    private final EventBusProperties properties;
    private final LoopMetrics metrics;

    private final Object lock = new Object();
    private final CopyOnWriteArrayList<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    public EventBus(EventLog eventLog, EventBusProperties properties, LoopMetrics metrics) {
        this.eventLog = eventLog;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Appends the event to the run's log, then enqueues it for every matching subscriber.
     *
     * @throws com.vibeloop.core.storage.EventLogException if the append fails; nothing is delivered
     */
    public void publish(RunEvent event) {
        synchronized (lock) {
            eventLog.append(event);
            log.debug("Published {} #{} for run {}", event.type().wireName(), event.seq(), event.runId());
            metrics.recordEventPublished(event.type().wireName());

            for (Subscriber subscriber : subscribers) {
                if (!subscriber.accepts(event)) {
                    continue;
                }
                if (!subscriber.offer(event)) {
                    subscribers.remove(subscriber);
                    subscriber.markOverflowed();
                    metrics.recordSubscriberOverflow();
                    log.warn("Dropped subscriber {} of run {}: delivery queue full at event #{}",
                            subscriber.id(), event.runId(), event.seq());
                }
            }
        }
    }

    /**
     * Subscribes to a run, replaying its whole history before live events.
     *
     * @param runId the run to follow, or {@code null} for live events of every run (no replay)
     */
    public Subscriber subscribe(String runId) {
        return subscribe(runId, 0L);
    }

    /**
     * Subscribes to a run, replaying logged events with {@code seq > afterSeq} before live events.
     */
    public Subscriber subscribe(String runId, long afterSeq) {
        synchronized (lock) {
            List<RunEvent> replay = runId != null ? eventLog.read(runId, afterSeq) : List.of();
            Subscriber subscriber = new Subscriber(runId, replay, properties.getSubscriberQueueCapacity());
            subscribers.add(subscriber);
            log.debug("Subscriber {} attached to run {} (replaying {} events after #{})",
                    subscriber.id(), runId != null ? runId : "*", replay.size(), afterSeq);
            return subscriber;
        }
    }

    public void unsubscribe(Subscriber subscriber) {
        if (subscribers.remove(subscriber)) {
            log.debug("Subscriber {} detached", subscriber.id());
        }
        subscriber.close();
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
