package com.vibeloop.core.contracts;

import java.util.List;

/**
 * Turns raw inbound values into typed commands, rejecting malformed input
 * with a {@link ValidationException}.
 */
public final class CommandValidator {

    private CommandValidator() {}

    public static ControlCommand control(String action) {
        if (action == null || action.isBlank()) {
            throw new ValidationException("action is required");
        }
        return ControlAction.fromWireName(action)
                .map(ControlCommand::new)
                .orElseThrow(() -> new ValidationException(
                        "Unknown action: " + action + " (expected pause or resume)"));
    }

    public static PromptCommand prompt(String actor, String routeTo, List<Object> content) {
        if (actor == null || actor.isBlank()) {
            throw new ValidationException("actor is required");
        }
        Actor parsedActor = Actor.fromWireName(actor)
                .orElseThrow(() -> new ValidationException(
                        "Unknown actor: " + actor + " (expected user, vision or code)"));

        if (routeTo == null || routeTo.isBlank()) {
            throw new ValidationException("route_to is required");
        }
        Route parsedRoute = Route.fromWireName(routeTo)
                .orElseThrow(() -> new ValidationException(
                        "Unknown route_to: " + routeTo + " (expected vision or code)"));

        if (content == null || content.isEmpty()) {
            throw new ValidationException("content must contain at least one part");
        }
        for (int i = 0; i < content.size(); i++) {
            if (content.get(i) == null) {
                throw new ValidationException("content[" + i + "] is null");
            }
        }
        return new PromptCommand(parsedActor, parsedRoute, content);
    }
}
