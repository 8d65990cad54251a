package com.vibeloop.core.browser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BlankScreenshotCapturerTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("writes a viewport-sized PNG, creating parent directories")
    void writesPng() throws Exception {
        BrowserProperties properties = new BrowserProperties();
        properties.setViewportWidth(320);
        properties.setViewportHeight(200);
        Path output = root.resolve("screenshots/snap_1.png");

        new BlankScreenshotCapturer(properties).capture(root.resolve("index.html"), output);

        BufferedImage image = ImageIO.read(output.toFile());
        assertNotNull(image);
        assertEquals(320, image.getWidth());
        assertEquals(200, image.getHeight());
    }
}
