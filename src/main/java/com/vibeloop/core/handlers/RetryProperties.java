package com.vibeloop.core.handlers;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "vibe.retry")
public class RetryProperties {

    /** Total attempts per collaborator call, including the first one. */
    private int maxAttempts = 5;

    /** Delay before the first retry; doubles on every further retry. */
    private Duration baseDelay = Duration.ofMillis(500);

    private Duration maxDelay = Duration.ofSeconds(8);

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }
}
