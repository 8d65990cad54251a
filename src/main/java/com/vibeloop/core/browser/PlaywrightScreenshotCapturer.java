package com.vibeloop.core.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.WaitUntilState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Headless Chromium screenshots via Microsoft Playwright.
 * <p>
 * The browser is launched lazily on first capture and reused; each capture opens a fresh page
 * with the configured viewport. Playwright timeouts surface as
 * {@link com.microsoft.playwright.TimeoutError}, which callers treat as transient.
 */
@Component
@ConditionalOnProperty(prefix = "vibe.browser", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PlaywrightScreenshotCapturer implements ScreenshotCapturer {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightScreenshotCapturer.class);

    private final BrowserProperties properties;

    private Playwright playwright;
    private Browser browser;

    public PlaywrightScreenshotCapturer(BrowserProperties properties) {
        this.properties = properties;
    }

    @Override
    public synchronized void capture(Path page, Path output) {
        ensureBrowser();
        createParentDirectories(output);

        Page tab = browser.newPage(new Browser.NewPageOptions()
                .setViewportSize(properties.getViewportWidth(), properties.getViewportHeight()));
        try {
            tab.setDefaultTimeout(properties.getTimeout().toMillis());
            tab.navigate(page.toAbsolutePath().toUri().toString(),
                    new Page.NavigateOptions().setWaitUntil(WaitUntilState.LOAD));
            tab.screenshot(new Page.ScreenshotOptions().setPath(output).setFullPage(false));
            log.debug("Captured {} -> {}", page.getFileName(), output);
        } finally {
            tab.close();
        }
    }

    private void ensureBrowser() {
        if (browser != null && browser.isConnected()) {
            return;
        }
        closeQuietly();
        playwright = Playwright.create();
        browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                .setHeadless(properties.isHeadless()));
        log.info("Playwright browser launched (headless: {})", properties.isHeadless());
    }

    @PreDestroy
    public synchronized void close() {
        closeQuietly();
    }

    private void closeQuietly() {
        if (browser != null) {
            try {
                browser.close();
            } catch (RuntimeException e) {
                log.trace("Error closing browser: {}", e.getMessage());
            }
            browser = null;
        }
        if (playwright != null) {
            try {
                playwright.close();
            } catch (RuntimeException e) {
                log.trace("Error closing Playwright: {}", e.getMessage());
            }
            playwright = null;
        }
    }

    private static void createParentDirectories(Path output) {
        try {
            Files.createDirectories(output.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create screenshot directory for " + output, e);
        }
    }
}
