package com.vibeloop.core.contracts;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Loop control actions accepted on {@code POST /api/control}.
 */
public enum ControlAction {
    PAUSE("pause"),
    RESUME("resume");

    private final String wireName;

    ControlAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<ControlAction> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(a -> a.wireName.equals(value))
                .findFirst();
    }
}
