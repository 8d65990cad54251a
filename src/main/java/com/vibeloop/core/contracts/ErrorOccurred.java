package com.vibeloop.core.contracts;

/**
 * Terminal failure of a run. Emitted at most once per run.
 *
 * @param msg   failure detail
 * @param where component that failed (e.g. "model.code", "screenshot", "control")
 */
public record ErrorOccurred(String msg, String where) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.ERROR;
    }
}
