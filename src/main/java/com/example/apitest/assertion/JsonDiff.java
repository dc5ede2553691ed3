package com.example.apitest.assertion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Semantic diff between an expected and an actual JSON-like value (maps, lists, scalars).
 * Numbers compare by value, so {@code 1} and {@code 1.0} are equal.
 */
public final class JsonDiff {
    public static final int MAX_DEPTH = 32;
    public static final int MAX_ENTRIES = 250;
    public static final int MAX_TEXT_CHARACTERS = 8000;
    private static final int MAX_VALUE_CHARACTERS = 160;
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonDiff() {
    }

    public static List<JsonDiffEntry> diff(Object expected, Object actual) {
        return diff(expected, actual, MAX_DEPTH, MAX_ENTRIES);
    }

    public static List<JsonDiffEntry> diff(Object expected, Object actual, int maxDepth, int maxEntries) {
        List<JsonDiffEntry> entries = new ArrayList<>();
        walk(expected, actual, "$", 0, entries, maxDepth, maxEntries);
        return entries;
    }

    /**
     * Renders entries in a unified-diff like layout, or null when there is nothing to show.
     */
    public static String format(List<JsonDiffEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (JsonDiffEntry entry : entries) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append("@@ ").append(entry.getPath()).append('\n');
            switch (entry.getChange()) {
                case ADDED:
                    text.append("+ ").append(formatValue(entry.getActual()));
                    break;
                case REMOVED:
                    text.append("- ").append(formatValue(entry.getExpected()));
                    break;
                case TYPE:
                    text.append("- type: ").append(describeType(entry.getExpected())).append('\n');
                    text.append("+ type: ").append(describeType(entry.getActual()));
                    break;
                default:
                    text.append("- expected: ").append(formatValue(entry.getExpected())).append('\n');
                    text.append("+ actual: ").append(formatValue(entry.getActual()));
            }
        }
        if (text.length() > MAX_TEXT_CHARACTERS) {
            return text.substring(0, MAX_TEXT_CHARACTERS) + "\n… diff truncated";
        }
        return text.toString();
    }

    private static void walk(Object expected, Object actual, String path, int depth,
                             List<JsonDiffEntry> entries, int maxDepth, int maxEntries) {
        if (entries.size() >= maxEntries) {
            return;
        }
        if (depth >= maxDepth) {
            if (!ValueComparison.valuesEqual(expected, actual)) {
                entries.add(new JsonDiffEntry(path, JsonDiffEntry.Change.CHANGED, expected, actual));
            }
            return;
        }
        if (!describeType(expected).equals(describeType(actual))) {
            entries.add(new JsonDiffEntry(path, JsonDiffEntry.Change.TYPE, expected, actual));
            return;
        }
        if (expected instanceof Map) {
            Map<?, ?> left = (Map<?, ?>) expected;
            Map<?, ?> right = (Map<?, ?>) actual;
            TreeSet<String> keys = new TreeSet<>();
            left.keySet().forEach(k -> keys.add(String.valueOf(k)));
            for (String key : keys) {
                if (!right.containsKey(key)) {
                    entries.add(new JsonDiffEntry(extend(path, key), JsonDiffEntry.Change.REMOVED, left.get(key), null));
                    if (entries.size() >= maxEntries) {
                        return;
                    }
                }
            }
            TreeSet<String> added = new TreeSet<>();
            right.keySet().forEach(k -> added.add(String.valueOf(k)));
            added.removeAll(keys);
            for (String key : added) {
                entries.add(new JsonDiffEntry(extend(path, key), JsonDiffEntry.Change.ADDED, null, right.get(key)));
                if (entries.size() >= maxEntries) {
                    return;
                }
            }
            for (String key : keys) {
                if (right.containsKey(key)) {
                    walk(left.get(key), right.get(key), extend(path, key), depth + 1, entries, maxDepth, maxEntries);
                    if (entries.size() >= maxEntries) {
                        return;
                    }
                }
            }
            return;
        }
        if (expected instanceof Collection) {
            List<?> left = new ArrayList<>((Collection<?>) expected);
            List<?> right = new ArrayList<>((Collection<?>) actual);
            int common = Math.min(left.size(), right.size());
            for (int i = 0; i < common; i++) {
                walk(left.get(i), right.get(i), path + "[" + i + "]", depth + 1, entries, maxDepth, maxEntries);
                if (entries.size() >= maxEntries) {
                    return;
                }
            }
            for (int i = common; i < left.size(); i++) {
                entries.add(new JsonDiffEntry(path + "[" + i + "]", JsonDiffEntry.Change.REMOVED, left.get(i), null));
                if (entries.size() >= maxEntries) {
                    return;
                }
            }
            for (int i = common; i < right.size(); i++) {
                entries.add(new JsonDiffEntry(path + "[" + i + "]", JsonDiffEntry.Change.ADDED, null, right.get(i)));
                if (entries.size() >= maxEntries) {
                    return;
                }
            }
            return;
        }
        if (!ValueComparison.valuesEqual(expected, actual)) {
            entries.add(new JsonDiffEntry(path, JsonDiffEntry.Change.CHANGED, expected, actual));
        }
    }

    private static String extend(String base, String key) {
        if (IDENTIFIER.matcher(key).matches()) {
            return base + "." + key;
        }
        return base + "['" + key.replace("'", "\\'") + "']";
    }

    static String describeType(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Collection) {
            return "array";
        }
        if (value instanceof Map) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }

    private static String formatValue(Object value) {
        String formatted = stringify(value);
        if (formatted.length() <= MAX_VALUE_CHARACTERS) {
            return formatted;
        }
        return formatted.substring(0, MAX_VALUE_CHARACTERS - 1) + "…";
    }

    private static String stringify(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof String) {
            String text = (String) value;
            if (!text.contains("\n") && text.length() <= MAX_VALUE_CHARACTERS) {
                return text;
            }
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
