package com.example.apitest.policy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BackoffStrategy {
    EXPONENTIAL("exponential"),
    EXPONENTIAL_JITTER("exponential_jitter"),
    FULL_JITTER("full_jitter");

    private final String value;

    BackoffStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a strategy name, falling back to {@code fallback} for blank or unknown values.
     */
    public static BackoffStrategy fromValue(Object raw, BackoffStrategy fallback) {
        if (raw == null) {
            return fallback;
        }
        String normalized = raw.toString().trim().toLowerCase(Locale.ROOT);
        for (BackoffStrategy strategy : values()) {
            if (strategy.value.equals(normalized)) {
                return strategy;
            }
        }
        return fallback;
    }
}
