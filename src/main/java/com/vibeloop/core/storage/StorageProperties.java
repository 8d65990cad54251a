package com.vibeloop.core.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "vibe.storage")
public class StorageProperties {

    /** Root directory holding {@code runs/<run-id>/...}; also served under {@code /static}. */
    private String root = "storage";

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }
}
