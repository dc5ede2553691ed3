package com.example.apitest.util;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@UtilityClass
public class InputMergeUtils {

    /**
     * Shallow merge of {@code overrides} onto a copy of {@code base}. When both sides hold a map
     * under the same key, the override map updates the base map key by key instead of replacing it.
     */
    public static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> overrides) {
        Map<String, Object> merged = deepCopy(base);
        if (overrides == null) {
            return merged;
        }
        for (Map.Entry<String, Object> entry : overrides.entrySet()) {
            Object current = merged.get(entry.getKey());
            Object value = entry.getValue();
            if (value instanceof Map && current instanceof Map) {
                Map<String, Object> nested = deepCopy(asStringMap(current));
                nested.putAll(deepCopy(asStringMap(value)));
                merged.put(entry.getKey(), nested);
            } else {
                merged.put(entry.getKey(), copyValue(value));
            }
        }
        return merged;
    }

    public static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<String, Object> entry : source.entrySet()) {
                copy.put(entry.getKey(), copyValue(entry.getValue()));
            }
        }
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return deepCopy(asStringMap(value));
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                copy.add(copyValue(item));
            }
            return copy;
        }
        return value;
    }

    private static Map<String, Object> asStringMap(Object value) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            out.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return out;
    }
}
