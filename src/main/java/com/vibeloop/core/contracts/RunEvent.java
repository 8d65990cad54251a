package com.vibeloop.core.contracts;

import java.time.Instant;
import java.util.Objects;

/**
 * An immutable, ordered record of something that happened during a run.
 *
 * @param runId     the run this event belongs to
 * @param seq       per-run sequence number, starting at 1, gap-free
 * @param timestamp when the event was emitted (UTC)
 * @param payload   kind-specific body; determines {@link #type()}
 */
public record RunEvent(
    String runId,
    long seq,
    Instant timestamp,
    EventPayload payload
) {

    public RunEvent {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(payload, "payload");
    }

    public EventType type() {
        return payload.eventType();
    }
}
