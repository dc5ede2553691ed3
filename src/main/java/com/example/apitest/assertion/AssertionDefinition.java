package com.example.apitest.assertion;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * One declarative check: {@code {name?, operator, expected?, actual?, path?, enabled?, message?}}.
 */
@Value
@Builder(toBuilder = true)
public class AssertionDefinition {
    String name;
    String operator;
    Object expected;
    Object actual;
    String path;
    @Builder.Default
    boolean enabled = true;
    String message;

    public static AssertionDefinition fromMap(Map<?, ?> raw) {
        Object enabled = raw.get("enabled");
        return AssertionDefinition.builder()
                .name(asString(raw.get("name")))
                .operator(asString(raw.get("operator")))
                .expected(raw.get("expected"))
                .actual(raw.get("actual"))
                .path(asString(raw.get("path")))
                .enabled(!(Boolean.FALSE.equals(enabled) || "false".equalsIgnoreCase(String.valueOf(enabled))))
                .message(asString(raw.get("message")))
                .build();
    }

    /**
     * Accepts a list of definitions, a map with an {@code items} list, or a map of
     * {@code operator -> expected} pairs. Entries that are not maps are ignored.
     */
    public static List<AssertionDefinition> normalize(Object raw) {
        List<AssertionDefinition> definitions = new ArrayList<>();
        if (raw instanceof Collection) {
            for (Object item : (Collection<?>) raw) {
                if (item instanceof AssertionDefinition) {
                    definitions.add((AssertionDefinition) item);
                } else if (item instanceof Map) {
                    definitions.add(fromMap((Map<?, ?>) item));
                }
            }
        } else if (raw instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) raw;
            Object items = map.get("items");
            if (items instanceof Collection) {
                return normalize(items);
            }
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!"items".equals(entry.getKey())) {
                    definitions.add(AssertionDefinition.builder()
                            .operator(String.valueOf(entry.getKey()))
                            .expected(entry.getValue())
                            .build());
                }
            }
        }
        return definitions;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
