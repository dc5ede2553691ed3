package com.example.apitest.service;

import com.example.apitest.model.ProgressEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounds progress payloads so a single event stays small enough for any pub/sub transport.
 */
@RequiredArgsConstructor
@Component
public class ProgressEventSanitizer {
    public static final int MAX_EVENT_BYTES = 32768;
    public static final int MAX_STRING_LENGTH = 2048;
    public static final int MAX_COLLECTION_ITEMS = 20;
    public static final int MAX_DEPTH = 4;
    static final String TRUNCATED_SUFFIX = "… (truncated)";
    static final String TRUNCATED_MARKER = "__truncated__";

    private final ObjectMapper objectMapper;

    public ProgressEvent sanitize(ProgressEvent event) {
        ProgressEvent bounded = event.toBuilder()
                .payload(event.getPayload() == null ? null
                        : sanitizeMap(event.getPayload(), 0, MAX_DEPTH, MAX_STRING_LENGTH, MAX_COLLECTION_ITEMS))
                .build();
        if (encodedSize(bounded) <= MAX_EVENT_BYTES) {
            return bounded;
        }
        Map<String, Object> reduced = event.getPayload() == null
                ? Map.of("message", "payload omitted")
                : sanitizeMap(event.getPayload(), 0, 2, 512, 5);
        ProgressEvent truncated = bounded.toBuilder().truncated(true).payload(reduced).build();
        if (encodedSize(truncated) <= MAX_EVENT_BYTES) {
            return truncated;
        }
        return truncated.toBuilder().payload(Map.of("message", "payload truncated due to size limits")).build();
    }

    private Map<String, Object> sanitizeMap(Map<?, ?> value, int depth, int maxDepth, int maxString, int maxItems) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (depth >= maxDepth) {
            out.put(TRUNCATED_MARKER, true);
            return out;
        }
        int index = 0;
        for (Map.Entry<?, ?> entry : value.entrySet()) {
            if (index++ >= maxItems) {
                out.put(TRUNCATED_MARKER, true);
                break;
            }
            out.put(String.valueOf(entry.getKey()), sanitizeValue(entry.getValue(), depth + 1, maxDepth, maxString, maxItems));
        }
        return out;
    }

    private Object sanitizeValue(Object value, int depth, int maxDepth, int maxString, int maxItems) {
        if (value == null || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map) {
            return sanitizeMap((Map<?, ?>) value, depth, maxDepth, maxString, maxItems);
        }
        if (value instanceof Collection) {
            Collection<?> items = (Collection<?>) value;
            List<Object> out = new ArrayList<>();
            if (depth >= maxDepth) {
                out.add(TRUNCATED_MARKER);
                return out;
            }
            int index = 0;
            for (Object item : items) {
                if (index++ >= maxItems) {
                    Map<String, Object> marker = new LinkedHashMap<>();
                    marker.put(TRUNCATED_MARKER, true);
                    marker.put("count", items.size());
                    out.add(marker);
                    break;
                }
                out.add(sanitizeValue(item, depth + 1, maxDepth, maxString, maxItems));
            }
            return out;
        }
        Object plain = value;
        if (!(value instanceof CharSequence)) {
            try {
                plain = objectMapper.convertValue(value, Object.class);
            } catch (IllegalArgumentException e) {
                plain = value.toString();
            }
            if (plain == null || plain instanceof Map || plain instanceof Collection
                    || plain instanceof Number || plain instanceof Boolean) {
                return sanitizeValue(plain, depth, maxDepth, maxString, maxItems);
            }
        }
        String text = String.valueOf(plain);
        if (text.length() <= maxString) {
            return text;
        }
        return text.substring(0, maxString) + TRUNCATED_SUFFIX;
    }

    private int encodedSize(ProgressEvent event) {
        try {
            return objectMapper.writeValueAsString(event).getBytes(StandardCharsets.UTF_8).length;
        } catch (JsonProcessingException e) {
            return Integer.MAX_VALUE;
        }
    }
}
