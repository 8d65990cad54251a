package com.vibeloop.core.llm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the loosely typed content parts of a prompt.
 * <p>
 * A part is either a bare string, {@code {"type":"text","text":...}} or
 * {@code {"type":"image_url","image_url":{"url":...}}}. Unknown parts are ignored.
 */
public final class ContentParts {

    private ContentParts() {}

    public static String text(List<Object> content) {
        List<String> texts = new ArrayList<>();
        for (Object part : content) {
            if (part instanceof String s) {
                texts.add(s);
            } else if (part instanceof Map<?, ?> map && "text".equals(map.get("type"))
                    && map.get("text") instanceof String s) {
                texts.add(s);
            }
        }
        return String.join("\n", texts);
    }

    /**
     * The last text in the content, or an empty string.
     */
    public static String lastText(List<Object> content) {
        String last = "";
        for (Object part : content) {
            if (part instanceof String s) {
                last = s;
            } else if (part instanceof Map<?, ?> map && "text".equals(map.get("type"))
                    && map.get("text") instanceof String s) {
                last = s;
            }
        }
        return last;
    }

    public static List<String> imageUrls(List<Object> content) {
        List<String> urls = new ArrayList<>();
        for (Object part : content) {
            if (!(part instanceof Map<?, ?> map) || !"image_url".equals(map.get("type"))) {
                continue;
            }
            Object image = map.get("image_url");
            if (image instanceof Map<?, ?> imageMap && imageMap.get("url") instanceof String url) {
                urls.add(url);
            } else if (image instanceof String url) {
                urls.add(url);
            }
        }
        return urls;
    }

    public static Map<String, Object> textPart(String text) {
        return orderedPart("text", "text", text);
    }

    public static Map<String, Object> imagePart(String url) {
        return orderedPart("image_url", "image_url", Map.of("url", url));
    }

    private static Map<String, Object> orderedPart(String type, String key, Object value) {
        Map<String, Object> part = new LinkedHashMap<>();
        part.put("type", type);
        part.put(key, value);
        return Collections.unmodifiableMap(part);
    }
}
