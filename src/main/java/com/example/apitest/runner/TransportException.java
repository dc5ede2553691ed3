package com.example.apitest.runner;

import java.util.Map;

/**
 * The request never produced an HTTP response (timeout, refused connection, DNS failure).
 * Carries whatever was captured so the report keeps its diagnostics.
 */
public class TransportException extends Exception {
    private final Map<String, Object> requestPayload;
    private final Map<String, Object> responsePayload;
    private final Map<String, Object> metrics;

    public TransportException(String message,
                              Map<String, Object> requestPayload,
                              Map<String, Object> responsePayload,
                              Map<String, Object> metrics,
                              Throwable cause) {
        super(message, cause);
        this.requestPayload = requestPayload == null ? Map.of() : requestPayload;
        this.responsePayload = responsePayload == null ? Map.of() : responsePayload;
        this.metrics = metrics == null ? Map.of() : metrics;
    }

    public Map<String, Object> getRequestPayload() {
        return requestPayload;
    }

    public Map<String, Object> getResponsePayload() {
        return responsePayload;
    }

    public Map<String, Object> getMetrics() {
        return metrics;
    }
}
