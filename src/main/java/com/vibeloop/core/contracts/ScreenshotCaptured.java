package com.vibeloop.core.contracts;

/**
 * @param url       path under {@code /static} where the PNG is served
 * @param iteration 1-based iteration index
 */
public record ScreenshotCaptured(String url, int iteration) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.SCREENSHOT_CAPTURED;
    }
}
