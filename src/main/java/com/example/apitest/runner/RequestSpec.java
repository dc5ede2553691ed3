package com.example.apitest.runner;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A rendered HTTP request. {@code json} wins over {@code body}; a map or list body is sent as
 * JSON as well.
 */
@Value
@Builder(toBuilder = true)
public class RequestSpec {
    String method;
    String url;
    Map<String, Object> headers;
    Map<String, Object> params;
    boolean jsonPresent;
    Object json;
    Object body;
    /**
     * The same request before template rendering, used for the recorded payload so rendered
     * secrets never reach it. Null when the request had no templates.
     */
    RequestSpec display;

    public static RequestSpec fromInputs(Map<String, Object> inputs) {
        Map<String, Object> source = inputs == null ? Map.of() : inputs;
        Object method = source.get("method");
        Object url = source.get("url");
        return RequestSpec.builder()
                .method(method == null ? "GET" : method.toString().trim().toUpperCase(Locale.ROOT))
                .url(url == null ? null : url.toString())
                .headers(asMap(source.get("headers")))
                .params(asMap(source.get("params")))
                .jsonPresent(source.containsKey("json"))
                .json(source.get("json"))
                .body(source.get("body"))
                .build();
    }

    public RequestSpec withDisplay(RequestSpec display) {
        return toBuilder().display(display).build();
    }

    private static Map<String, Object> asMap(Object value) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                out.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return out;
    }
}
