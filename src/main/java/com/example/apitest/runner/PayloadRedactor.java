package com.example.apitest.runner;

import com.example.apitest.context.ExecutionContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks sensitive values before a payload leaves the executor: configured keys at any depth,
 * {@code {{secret.*}}} template text and literal secret values.
 */
public class PayloadRedactor {
    private static final Pattern SECRET_TEMPLATE = Pattern.compile("\\{\\{\\s*secret\\.[^{}]+}}", Pattern.CASE_INSENSITIVE);

    private final Set<String> redactKeys = new LinkedHashSet<>();
    private final String placeholder;

    public PayloadRedactor(Collection<String> redactKeys, String placeholder) {
        if (redactKeys != null) {
            for (String key : redactKeys) {
                if (key != null && !key.isBlank()) {
                    this.redactKeys.add(key.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.placeholder = placeholder == null || placeholder.isEmpty() ? "***" : placeholder;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> redactMap(Map<String, Object> data, Collection<String> secretValues) {
        return data == null ? null : (Map<String, Object>) redact(data, secretValues);
    }

    public Object redact(Object data, Collection<String> secretValues) {
        if (data instanceof Map) {
            Map<String, Object> sanitized = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) data).entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (redactKeys.contains(key.toLowerCase(Locale.ROOT))) {
                    sanitized.put(key, placeholder);
                } else {
                    sanitized.put(key, redact(entry.getValue(), secretValues));
                }
            }
            return sanitized;
        }
        if (data instanceof Collection) {
            List<Object> sanitized = new ArrayList<>();
            for (Object item : (Collection<?>) data) {
                sanitized.add(redact(item, secretValues));
            }
            return sanitized;
        }
        if (data instanceof String) {
            String text = (String) data;
            if (SECRET_TEMPLATE.matcher(text).find()) {
                return placeholder;
            }
            if (secretValues != null) {
                for (String secret : secretValues) {
                    if (!secret.isEmpty() && text.contains(secret)) {
                        text = text.replace(secret, placeholder);
                    }
                }
            }
            return text;
        }
        return data;
    }

    public static Set<String> secretValues(ExecutionContext context) {
        Set<String> values = new LinkedHashSet<>();
        if (context != null) {
            gather(context.getSecrets(), values);
        }
        values.removeIf(String::isEmpty);
        return values;
    }

    private static void gather(Object value, Set<String> sink) {
        if (value == null) {
            return;
        }
        if (value instanceof Map) {
            for (Object item : ((Map<?, ?>) value).values()) {
                gather(item, sink);
            }
        } else if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                gather(item, sink);
            }
        } else {
            sink.add(value.toString());
        }
    }
}
