package com.vibeloop.core.events;

import com.vibeloop.core.contracts.RunEvent;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A live observer attached to the {@link EventBus}.
 * <p>
 * Delivers the replayed history captured at subscription time first, then live events from a
 * bounded queue. Only the bus enqueues; only the owning consumer thread polls.
 */
public final class Subscriber {

    private final String id = UUID.randomUUID().toString().substring(0, 8);
    private final String runId;
    private final Deque<RunEvent> backlog;
    private final BlockingQueue<RunEvent> queue;
    private volatile boolean overflowed;
    private volatile boolean closed;

    Subscriber(String runId, List<RunEvent> replay, int capacity) {
        this.runId = runId;
        this.backlog = new ArrayDeque<>(replay);
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public String id() {
        return id;
    }

    /**
     * @return the run this subscriber follows, or {@code null} when it follows every run
     */
    public String runId() {
        return runId;
    }

    /**
     * Next event, waiting up to {@code timeout} for a live one.
     *
     * @return the event, or {@code null} on timeout or once closed and drained
     * @throws SubscriberOverflowException if the bus dropped this subscriber for overflow
     */
    public RunEvent poll(Duration timeout) throws InterruptedException {
        if (overflowed) {
            throw new SubscriberOverflowException("Subscriber " + id + " fell more than "
                    + (queue.size() + queue.remainingCapacity()) + " events behind and was dropped");
        }
        RunEvent replayed = backlog.poll();
        if (replayed != null) {
            return replayed;
        }
        if (closed) {
            return queue.poll();
        }
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isOverflowed() {
        return overflowed;
    }

    public boolean isClosed() {
        return closed;
    }

    boolean accepts(RunEvent event) {
        return runId == null || runId.equals(event.runId());
    }

    boolean offer(RunEvent event) {
        return queue.offer(event);
    }

    void markOverflowed() {
        overflowed = true;
        closed = true;
        queue.clear();
    }

    void close() {
        closed = true;
    }
}
