package com.vibeloop.core.browser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Placeholder used when the browser is disabled: writes a blank viewport-sized PNG
 * so the iteration still yields a screenshot artifact.
 */
@Component
@ConditionalOnProperty(prefix = "vibe.browser", name = "enabled", havingValue = "false")
public class BlankScreenshotCapturer implements ScreenshotCapturer {

    private static final Logger log = LoggerFactory.getLogger(BlankScreenshotCapturer.class);

    private final BrowserProperties properties;

    public BlankScreenshotCapturer(BrowserProperties properties) {
        this.properties = properties;
    }

    @Override
    public void capture(Path page, Path output) {
        BufferedImage image = new BufferedImage(
                properties.getViewportWidth(), properties.getViewportHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
        } finally {
            g.dispose();
        }
        try {
            Files.createDirectories(output.getParent());
            ImageIO.write(image, "png", output.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write placeholder screenshot " + output, e);
        }
        log.debug("Wrote placeholder screenshot {} for {}", output, page.getFileName());
    }
}
