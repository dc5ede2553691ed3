package com.example.apitest.context;

import com.example.apitest.util.JsonPathUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{path.to.value}}} placeholders inside strings, maps and lists.
 * <p>
 * Supported roots are {@code variables}, {@code env}, {@code secret}, {@code prev.<alias>}
 * (also {@code steps.<alias>}) and {@code response}; any other root is looked up in the
 * variables with the full path. A segment of the form {@code jsonpath('<expr>')} evaluates the
 * expression against the current node. Placeholders that resolve to nothing are kept as written.
 */
@Slf4j
@Component
public class TemplateRenderer {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");
    private static final Pattern SINGLE_PLACEHOLDER = Pattern.compile("^\\{\\{\\s*([^{}]+?)\\s*}}$");
    private static final Pattern JSONPATH_SEGMENT = Pattern.compile("^jsonpath\\((['\"])(.+)\\1\\)$");

    public Object render(Object value, ExecutionContext context) {
        if (value instanceof String) {
            return renderString((String) value, context);
        }
        if (value instanceof Map) {
            Map<String, Object> rendered = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                rendered.put(String.valueOf(entry.getKey()), render(entry.getValue(), context));
            }
            return rendered;
        }
        if (value instanceof Collection) {
            List<Object> rendered = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                rendered.add(render(item, context));
            }
            return rendered;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> renderMap(Map<String, Object> value, ExecutionContext context) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        return (Map<String, Object>) render(value, context);
    }

    private Object renderString(String template, ExecutionContext context) {
        if (!template.contains("{{") || !template.contains("}}")) {
            return template;
        }
        Matcher single = SINGLE_PLACEHOLDER.matcher(template);
        if (single.matches()) {
            Object resolved = resolve(single.group(1), context);
            return resolved == null ? template : resolved;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Object resolved = resolve(matcher.group(1), context);
            String replacement = resolved == null ? matcher.group() : String.valueOf(resolved);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    Object resolve(String expression, ExecutionContext context) {
        List<String> segments = split(expression.trim());
        if (segments.isEmpty()) {
            return null;
        }
        String root = segments.get(0);
        List<String> rest = segments.subList(1, segments.size());
        switch (root) {
            case "variables":
                return traverse(context.getVariables(), rest);
            case "env":
                return traverse(context.getEnvironment(), rest);
            case "secret":
                return traverse(context.getSecrets(), rest);
            case "prev":
            case "steps":
                if (rest.isEmpty()) {
                    return null;
                }
                return traverse(context.getStep(rest.get(0)), rest.subList(1, rest.size()));
            case "response":
                return traverse(context.getCurrentResponse(), rest);
            default:
                return traverse(context.getVariables(), segments);
        }
    }

    private Object traverse(Object data, List<String> path) {
        Object current = data;
        for (String segment : path) {
            if (current == null) {
                return null;
            }
            Matcher jsonPath = JSONPATH_SEGMENT.matcher(segment);
            if (jsonPath.matches()) {
                Object target = current;
                if (current instanceof Map && ((Map<?, ?>) current).containsKey("json")) {
                    target = ((Map<?, ?>) current).get("json");
                }
                try {
                    return JsonPathUtil.evaluate(target, jsonPath.group(2));
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring template segment {}: {}", segment, e.getMessage());
                    return null;
                }
            }
            if (current instanceof Map) {
                current = ((Map<?, ?>) current).get(segment);
            } else if (current instanceof List) {
                List<?> list = (List<?>) current;
                int index;
                try {
                    index = Integer.parseInt(segment);
                } catch (NumberFormatException e) {
                    return null;
                }
                if (index < 0) {
                    index += list.size();
                }
                if (index < 0 || index >= list.size()) {
                    return null;
                }
                current = list.get(index);
            } else {
                return null;
            }
        }
        return current;
    }

    /**
     * Splits on dots, except inside a {@code jsonpath(...)} call whose expression has dots of its own.
     */
    private static List<String> split(String expression) {
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            }
            if (c == '.' && depth == 0) {
                segments.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            segments.add(current.toString().trim());
        }
        return segments;
    }
}
