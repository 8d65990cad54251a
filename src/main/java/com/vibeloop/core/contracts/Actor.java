package com.vibeloop.core.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Originator of a prompt: the human operator or one of the two models.
 */
public enum Actor {
    USER("user"),
    VISION("vision"),
    CODE("code");

    private final String wireName;

    Actor(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<Actor> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(a -> a.wireName.equals(value))
                .findFirst();
    }

    @JsonCreator
    static Actor decode(String value) {
        return fromWireName(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown actor: " + value));
    }
}
