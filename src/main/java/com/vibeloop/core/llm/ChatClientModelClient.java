package com.vibeloop.core.llm;

import com.vibeloop.core.contracts.Route;
import com.vibeloop.core.storage.RunPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.content.Media;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;

/**
 * Model exchange over Spring AI's {@link ChatClient} against an OpenAI-compatible endpoint.
 * <p>
 * The route selects model and system prompt. Image parts become {@link Media}: data URLs and
 * remote URLs are passed by reference, {@code /static/...} screenshots are read from storage.
 * Retries are left to the caller; Spring AI's own retry should be limited to one attempt.
 */
@Component
@ConditionalOnProperty(prefix = "vibe.llm", name = "provider", havingValue = "openai")
public class ChatClientModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClientModelClient.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final RunPaths paths;

    public ChatClientModelClient(ChatClient.Builder builder, LlmProperties properties, RunPaths paths) {
        this.chatClient = builder.build();
        this.properties = properties;
        this.paths = paths;
        log.info("Model client initialized: code={}, vision={}",
                properties.getCodeModel(), properties.getVisionModel());
    }

    @Override
    public ModelResponse exchange(Route route, List<Object> content) {
        String model = route == Route.CODE ? properties.getCodeModel() : properties.getVisionModel();
        String system = route == Route.CODE ? properties.getCodeSystemPrompt() : properties.getVisionSystemPrompt();

        String text = ContentParts.text(content);
        String userText = text.isBlank()
                ? (route == Route.VISION ? "Review the attached screenshot." : "Continue.")
                : text;
        Media[] media = ContentParts.imageUrls(content).stream()
                .map(this::toMedia)
                .toArray(Media[]::new);

        log.info("Model call started → {} ({}, {} image(s))", route.wireName(), model, media.length);
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(system)
                .user(u -> u.text(userText).media(media))
                .options(OpenAiChatOptions.builder().model(model).build())
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("Model call complete → {} ({}s)", route.wireName(), String.format("%.1f", elapsed / 1000.0));

        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("Model " + model + " returned empty content for the "
                    + route.wireName() + " route");
        }
        return new ModelResponse(route, response);
    }

    Media toMedia(String url) {
        if (url.startsWith("data:")) {
            int end = url.indexOf(';');
            MimeType mime = end > 5 ? MimeTypeUtils.parseMimeType(url.substring(5, end)) : MimeTypeUtils.IMAGE_PNG;
            return new Media(mime, URI.create(url));
        }
        Path local = paths.resolveStaticUrl(url);
        if (local != null) {
            return new Media(guessMimeType(url), new FileSystemResource(local));
        }
        return new Media(guessMimeType(url), URI.create(url));
    }

    private static MimeType guessMimeType(String url) {
        String lower = url.toLowerCase();
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
            return MimeTypeUtils.IMAGE_JPEG;
        }
        if (lower.endsWith(".gif")) {
            return MimeTypeUtils.IMAGE_GIF;
        }
        return MimeTypeUtils.IMAGE_PNG;
    }
}
