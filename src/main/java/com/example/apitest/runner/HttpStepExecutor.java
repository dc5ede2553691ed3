package com.example.apitest.runner;

import com.example.apitest.context.ExecutionContext;
import com.example.apitest.util.Sleeper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Executes one HTTP step with OkHttp. Transient socket failures and configured retryable statuses
 * are retried here, separately from the policy level retry of the orchestrator.
 */
@Slf4j
public class HttpStepExecutor implements StepExecutor {
    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final double MAX_RETRY_DELAY_SECONDS = 30.0;

    private final OkHttpClient client;
    private final ObjectMapper objectMapper;
    private final PayloadRedactor redactor;
    private final Settings settings;
    private final Sleeper sleeper;

    public HttpStepExecutor(OkHttpClient client, ObjectMapper objectMapper, PayloadRedactor redactor,
                            Settings settings, Sleeper sleeper) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.redactor = redactor;
        this.settings = settings;
        this.sleeper = sleeper;
    }

    @Override
    public StepResult execute(RequestSpec spec, ExecutionContext context, Duration timeout)
            throws TransportException, InterruptedException {
        ExecutionContext active = context == null ? new ExecutionContext() : context;
        if (spec.getUrl() == null || spec.getUrl().isBlank()) {
            throw new IllegalArgumentException("HTTP step requires a non-empty URL");
        }
        Set<String> secrets = PayloadRedactor.secretValues(active);
        String method = spec.getMethod() == null ? "GET" : spec.getMethod().toUpperCase(Locale.ROOT);
        Map<String, Object> requestPayload = redactor.redactMap(
                buildRequestPayload(spec.getDisplay() != null ? spec.getDisplay() : spec, method), secrets);

        Request request = buildRequest(spec, method);
        OkHttpClient callClient = timeout == null ? client : client.newBuilder()
                .callTimeout(timeout)
                .readTimeout(timeout)
                .build();

        int maxAttempts = Math.max(1, settings.getRetryAttempts());
        int attempts = 0;
        IOException lastError = null;
        Map<String, Object> partialResponse = Map.of();
        long start = System.nanoTime();
        while (attempts < maxAttempts) {
            attempts++;
            Response response;
            try {
                response = callClient.newCall(request).execute();
            } catch (IOException e) {
                lastError = e;
                partialResponse = Map.of();
                log.warn("Transport error on attempt {} for {} {}: {}", attempts, method, request.url().host(),
                        e.getClass().getSimpleName());
                if (attempts < maxAttempts) {
                    sleeper.sleep(retryDelay(attempts));
                }
                continue;
            }
            if (attempts < maxAttempts && shouldRetry(method, response.code())) {
                log.info("Retrying {} {} after status {} (attempt {})", method, request.url().host(), response.code(), attempts);
                response.close();
                sleeper.sleep(retryDelay(attempts));
                continue;
            }
            try (Response completed = response) {
                return capture(completed, active, requestPayload, secrets, attempts, elapsedMs(start));
            } catch (IOException e) {
                lastError = e;
                Map<String, Object> partial = new LinkedHashMap<>();
                partial.put("status_code", response.code());
                partial.put("headers", flattenHeaders(response.headers()));
                partialResponse = redactor.redactMap(partial, secrets);
                log.warn("Failed reading response body on attempt {} for {} {}: {}", attempts, method,
                        request.url().host(), e.getClass().getSimpleName());
                if (attempts < maxAttempts) {
                    sleeper.sleep(retryDelay(attempts));
                }
            }
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("duration_ms", elapsedMs(start));
        metrics.put("status", "network_error");
        metrics.put("response_size", 0);
        metrics.put("attempts", attempts);
        metrics.put("retries", Math.max(0, attempts - 1));
        String message = String.valueOf(redactor.redact(
                lastError == null ? "HTTP request failed" : String.valueOf(lastError.getMessage()), secrets));
        metrics.put("error", message);
        throw new TransportException(message, requestPayload, partialResponse, metrics, lastError);
    }

    private StepResult capture(Response response, ExecutionContext context, Map<String, Object> requestPayload,
                               Set<String> secrets, int attempts, long durationMs) throws IOException {
        ResponseBody body = response.body();
        byte[] bytes = body == null ? new byte[0] : body.bytes();
        Charset charset = body == null || body.contentType() == null
                ? StandardCharsets.UTF_8
                : body.contentType().charset(StandardCharsets.UTF_8);
        String text = new String(bytes, charset);
        Map<String, Object> headers = flattenHeaders(response.headers());
        Object json = parseJson(text);

        Map<String, Object> responsePayload = new LinkedHashMap<>();
        responsePayload.put("status_code", response.code());
        responsePayload.put("headers", headers);
        responsePayload.put("body", truncatedBody(bytes, charset));
        if (json != null) {
            responsePayload.put("json", json);
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("duration_ms", durationMs);
        metrics.put("status", "completed");
        metrics.put("status_code", response.code());
        metrics.put("response_size", bytes.length);
        metrics.put("attempts", attempts);
        metrics.put("retries", Math.max(0, attempts - 1));

        Map<String, Object> contextData = new LinkedHashMap<>();
        contextData.put("status_code", response.code());
        contextData.put("headers", headers);
        contextData.put("body", text);
        contextData.put("json", json);
        context.setCurrentResponse(contextData);

        log.debug("HTTP {} -> {} in {} ms ({} bytes)", response.request().method(), response.code(), durationMs, bytes.length);
        return new StepResult(requestPayload, redactor.redactMap(responsePayload, secrets), metrics, contextData);
    }

    private Request buildRequest(RequestSpec spec, String method) {
        HttpUrl parsed = HttpUrl.parse(spec.getUrl());
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid URL: " + spec.getUrl());
        }
        HttpUrl.Builder urlBuilder = parsed.newBuilder();
        if (spec.getParams() != null) {
            for (Map.Entry<String, Object> entry : spec.getParams().entrySet()) {
                addQueryParameter(urlBuilder, entry.getKey(), entry.getValue());
            }
        }
        Request.Builder rb = new Request.Builder().url(urlBuilder.build());
        if (spec.getHeaders() != null) {
            for (Map.Entry<String, Object> entry : spec.getHeaders().entrySet()) {
                if (entry.getValue() != null) {
                    rb.addHeader(entry.getKey(), entry.getValue().toString());
                }
            }
        }
        rb.method(method, requestBody(spec, method));
        return rb.build();
    }

    private void addQueryParameter(HttpUrl.Builder builder, String name, Object value) {
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                builder.addQueryParameter(name, item == null ? null : item.toString());
            }
        } else {
            builder.addQueryParameter(name, value == null ? null : value.toString());
        }
    }

    private RequestBody requestBody(RequestSpec spec, String method) {
        if (!acceptsBody(method)) {
            return null;
        }
        Object payload = spec.isJsonPresent() ? spec.getJson() : spec.getBody();
        if (payload == null) {
            return requiresBody(method) ? RequestBody.create(new byte[0], null) : null;
        }
        if (spec.isJsonPresent() || payload instanceof Map || payload instanceof Collection) {
            return RequestBody.create(toJson(payload), JSON);
        }
        Object contentType = headerValue(spec.getHeaders(), "Content-Type");
        MediaType mediaType = contentType == null ? null : MediaType.parse(contentType.toString());
        return RequestBody.create(payload.toString().getBytes(StandardCharsets.UTF_8), mediaType);
    }

    private Map<String, Object> buildRequestPayload(RequestSpec spec, String method) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("method", method);
        payload.put("url", spec.getUrl());
        if (spec.getHeaders() != null && !spec.getHeaders().isEmpty()) {
            payload.put("headers", new LinkedHashMap<>(spec.getHeaders()));
        }
        if (spec.getParams() != null && !spec.getParams().isEmpty()) {
            payload.put("params", new LinkedHashMap<>(spec.getParams()));
        }
        if (spec.isJsonPresent()) {
            payload.put("json", spec.getJson());
        } else if (spec.getBody() instanceof Map || spec.getBody() instanceof Collection) {
            payload.put("json", spec.getBody());
        } else if (spec.getBody() != null) {
            payload.put("body", truncatedBody(spec.getBody().toString().getBytes(StandardCharsets.UTF_8),
                    StandardCharsets.UTF_8));
        }
        return payload;
    }

    private Map<String, Object> truncatedBody(byte[] bytes, Charset charset) {
        int limit = settings.getMaxResponseSizeBytes();
        Map<String, Object> body = new LinkedHashMap<>();
        if (bytes.length <= limit) {
            body.put("text", new String(bytes, charset));
            body.put("truncated", false);
            return body;
        }
        int cut = limit;
        // back off to the start of a UTF-8 sequence
        while (StandardCharsets.UTF_8.equals(charset) && cut > 0 && (bytes[cut] & 0xC0) == 0x80) {
            cut--;
        }
        body.put("text", new String(Arrays.copyOf(bytes, cut), charset));
        body.put("truncated", true);
        body.put("note", "Body truncated to " + limit + " bytes from " + bytes.length + " bytes");
        return body;
    }

    private Object parseJson(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request json is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private boolean shouldRetry(String method, int statusCode) {
        if (!settings.getRetryStatuses().contains(statusCode)) {
            return false;
        }
        return settings.getRetryMethods().isEmpty() || settings.getRetryMethods().contains(method);
    }

    private double retryDelay(int attempt) {
        return Math.min(settings.getRetryBackoffFactor() * Math.pow(2, attempt - 1), MAX_RETRY_DELAY_SECONDS);
    }

    private static Map<String, Object> flattenHeaders(Headers headers) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String name : headers.names()) {
            out.put(name, String.join(", ", headers.values(name)));
        }
        return out;
    }

    private static Object headerValue(Map<String, Object> headers, String name) {
        if (headers == null) {
            return null;
        }
        for (Map.Entry<String, Object> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static boolean acceptsBody(String method) {
        return requiresBody(method) || "DELETE".equals(method);
    }

    private static boolean requiresBody(String method) {
        return "POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    @Value
    @Builder
    public static class Settings {
        @Builder.Default
        int maxResponseSizeBytes = 1_048_576;
        @Builder.Default
        int retryAttempts = 3;
        @Builder.Default
        double retryBackoffFactor = 0.5;
        @Builder.Default
        Set<Integer> retryStatuses = Set.of(429, 502, 503, 504);
        @Builder.Default
        Set<String> retryMethods = Set.of("GET", "HEAD", "OPTIONS", "PUT", "DELETE");
    }
}
