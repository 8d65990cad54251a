package com.vibeloop.dispatch.api;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

/**
 * Serves the storage root under {@code /static/**} so screenshot URLs in
 * {@code screenshot.captured} events resolve.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    private final String storageRoot;

    public StaticResourceConfig(@Value("${vibe.storage.root:storage}") String storageRoot) {
        this.storageRoot = storageRoot;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/static/**")
                .addResourceLocations(location());
    }

    String location() {
        return "file:" + Path.of(storageRoot).toAbsolutePath().normalize() + "/";
    }
}
