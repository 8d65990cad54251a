package com.vibeloop.core.contracts;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of event discriminators ({@code t} on the wire), each mapped to its payload type.
 */
public enum EventType {
    RUN_STARTED("run.started", RunStarted.class),
    PROMPT_SENT("prompt.sent", PromptSent.class),
    RESPONSE_RECEIVED("response.received", ResponseReceived.class),
    SCREENSHOT_CAPTURED("screenshot.captured", ScreenshotCaptured.class),
    CONTROL_PAUSED("control.paused", ControlPaused.class),
    CONTROL_RESUMED("control.resumed", ControlResumed.class),
    ERROR("error", ErrorOccurred.class);

    private static final Map<String, EventType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EventType::wireName, Function.identity()));

    private final String wireName;
    private final Class<? extends EventPayload> payloadType;

    EventType(String wireName, Class<? extends EventPayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    public static Optional<EventType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(value));
    }
}
