package com.example.usagemeter.service;

import com.example.usagemeter.config.UsageMeterProperties;
import com.example.usagemeter.model.UsageEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Strips markup, script and path-traversal sequences from the free-text parts of an event and
 * truncates over-long strings. Runs before the event is persisted.
 */
@Component
public class UsageEventSanitizer {

    private static final Pattern SCRIPT_BLOCK = Pattern.compile("(?is)<script\\b[^>]*>.*?</script\\s*>");
    private static final Pattern MARKUP_TAG = Pattern.compile("(?s)<[^>]*>");
    private static final Pattern SCRIPT_SCHEME = Pattern.compile("(?i)\\b(?:javascript|vbscript)\\s*:");
    private static final Pattern EVENT_HANDLER = Pattern.compile("(?i)\\bon[a-z]+\\s*=");
    private static final Pattern PATH_TRAVERSAL = Pattern.compile("(?i)(?:\\.\\.|%2e%2e)(?:[/\\\\]|%2f|%5c)");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\\t\\n\\r]]");

    private static final int MAX_DEPTH = 8;

    private final int maxStringLength;

    public UsageEventSanitizer(UsageMeterProperties properties) {
        this.maxStringLength = properties.getTracker().getMaxMetadataStringLength();
    }

    public UsageEvent sanitize(UsageEvent event) {
        return event.toBuilder()
                .resourceType(sanitizeText(event.getResourceType()))
                .resourceId(sanitizeText(event.getResourceId()))
                .metadata(sanitizeMap(event.getMetadata(), 0))
                .build();
    }

    public String sanitizeText(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = SCRIPT_BLOCK.matcher(value).replaceAll("");
        cleaned = MARKUP_TAG.matcher(cleaned).replaceAll("");
        cleaned = SCRIPT_SCHEME.matcher(cleaned).replaceAll("");
        cleaned = EVENT_HANDLER.matcher(cleaned).replaceAll("");
        cleaned = CONTROL_CHARS.matcher(cleaned).replaceAll("");
        // "....//" collapses to "../" after one pass
        String previous;
        do {
            previous = cleaned;
            cleaned = PATH_TRAVERSAL.matcher(cleaned).replaceAll("");
        } while (!cleaned.equals(previous));
        if (cleaned.length() > maxStringLength) {
            cleaned = cleaned.substring(0, maxStringLength);
        }
        return cleaned;
    }

    private Map<String, Object> sanitizeMap(Map<?, ?> source, int depth) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String key = sanitizeText(String.valueOf(entry.getKey()));
            if (key.isEmpty()) {
                continue;
            }
            result.put(key, sanitizeValue(entry.getValue(), depth + 1));
        }
        return result;
    }

    private Object sanitizeValue(Object value, int depth) {
        if (value instanceof String text) {
            return sanitizeText(text);
        }
        if (depth > MAX_DEPTH) {
            return value instanceof Map || value instanceof Collection ? null : value;
        }
        if (value instanceof Map<?, ?> nested) {
            return sanitizeMap(nested, depth);
        }
        if (value instanceof Collection<?> items) {
            List<Object> cleaned = new ArrayList<>(items.size());
            for (Object item : items) {
                cleaned.add(sanitizeValue(item, depth + 1));
            }
            return cleaned;
        }
        return value;
    }
}
