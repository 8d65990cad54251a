package com.vibeloop.core.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Downstream model a prompt is routed to.
 */
public enum Route {
    VISION("vision"),
    CODE("code");

    private final String wireName;

    Route(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * The actor that speaks for this route when its response is forwarded to the other model.
     */
    public Actor asActor() {
        return this == CODE ? Actor.CODE : Actor.VISION;
    }

    public Route opposite() {
        return this == CODE ? VISION : CODE;
    }

    public static Optional<Route> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(r -> r.wireName.equals(value))
                .findFirst();
    }

    @JsonCreator
    static Route decode(String value) {
        return fromWireName(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown route: " + value));
    }
}
