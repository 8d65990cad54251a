package com.vibeloop.core.browser;

import java.nio.file.Path;

/**
 * Boundary to the browser that renders the workspace page.
 */
public interface ScreenshotCapturer {

    /**
     * Renders {@code page} and writes a PNG screenshot to {@code output}.
     */
    void capture(Path page, Path output);
}
