package com.vibeloop.core.events;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "vibe.events")
public class EventBusProperties {

    /** Live events a subscriber may have pending before it is dropped. */
    private int subscriberQueueCapacity = 256;

    /** How long an SSE connection may stay open. */
    private Duration sseTimeout = Duration.ofMinutes(30);

    public int getSubscriberQueueCapacity() {
        return subscriberQueueCapacity;
    }

    public void setSubscriberQueueCapacity(int subscriberQueueCapacity) {
        this.subscriberQueueCapacity = subscriberQueueCapacity;
    }

    public Duration getSseTimeout() {
        return sseTimeout;
    }

    public void setSseTimeout(Duration sseTimeout) {
        this.sseTimeout = sseTimeout;
    }
}
