package com.vibeloop.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "vibe.run")
public class RunProperties {

    /** Iteration budget per run; 0 runs until stopped. */
    private int maxIterations = 50;

    /** Pause between iterations; commands arriving meanwhile are applied immediately. */
    private Duration iterationDelay = Duration.ofSeconds(2);

    /** Text of the first prompt sent to the code model. */
    private String initialPrompt = "iterate";

    /** Start a run as soon as the server is ready. */
    private boolean autoStart = false;

    /** Enter PAUSED right after the run starts, waiting for a resume. */
    private boolean startPaused = false;

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public Duration getIterationDelay() {
        return iterationDelay;
    }

    public void setIterationDelay(Duration iterationDelay) {
        this.iterationDelay = iterationDelay;
    }

    public String getInitialPrompt() {
        return initialPrompt;
    }

    public void setInitialPrompt(String initialPrompt) {
        this.initialPrompt = initialPrompt;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public boolean isStartPaused() {
        return startPaused;
    }

    public void setStartPaused(boolean startPaused) {
        this.startPaused = startPaused;
    }
}
