package com.vibeloop.core.llm;

import com.vibeloop.core.contracts.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Offline model: answers with the last text of the prompt, or "ok".
 * Lets the loop run end to end without API keys or network latency.
 */
@Component
@ConditionalOnProperty(prefix = "vibe.llm", name = "provider", havingValue = "echo", matchIfMissing = true)
public class EchoModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(EchoModelClient.class);

    @Override
    public ModelResponse exchange(Route route, List<Object> content) {
        String text = ContentParts.lastText(content);
        log.debug("Echo exchange on {} route ({} parts)", route.wireName(), content.size());
        return new ModelResponse(route, text.isBlank() ? "ok" : text);
    }
}
