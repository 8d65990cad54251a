package com.vibeloop.core.contracts;

import java.util.Objects;

/**
 * Validated pause/resume instruction for the run loop.
 *
 * @param action the requested control action
 */
public record ControlCommand(ControlAction action) {

    public ControlCommand {
        Objects.requireNonNull(action, "action");
    }
}
