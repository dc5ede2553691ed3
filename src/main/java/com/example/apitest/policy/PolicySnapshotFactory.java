package com.example.apitest.policy;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds {@link PolicySnapshot}s from loosely typed policy payloads. Values are coerced and
 * clamped into their legal ranges; anything blank or unparsable falls back to the configured
 * defaults. Only overlapping tag filters are rejected outright.
 */
@Slf4j
public class PolicySnapshotFactory {
    public static final int MAX_RETRY_ATTEMPTS = 10;
    public static final int MAX_PRIORITY = 9;

    private final PolicySnapshot defaults;

    public PolicySnapshotFactory(PolicySnapshot defaults) {
        this.defaults = defaults;
    }

    public PolicySnapshot defaults() {
        return defaults;
    }

    /**
     * Resolves the snapshot a run should use: the default one when no policy is attached or the
     * attached policy is disabled.
     */
    public PolicySnapshot resolve(Map<String, Object> raw) {
        if (raw == null) {
            return defaults;
        }
        PolicySnapshot snapshot = fromMap(raw);
        if (!snapshot.isEnabled()) {
            log.info("Policy {} is disabled, falling back to default policy", snapshot.getName());
            return defaults;
        }
        return snapshot;
    }

    public PolicySnapshot fromMap(Map<String, Object> raw) {
        if (raw == null) {
            return defaults;
        }
        RetryBackoff backoff = resolveBackoff(asMap(raw.get("retry_backoff")));

        Integer maxConcurrency = null;
        if (raw.get("max_concurrency") != null) {
            int value = coerceInt(raw.get("max_concurrency"), 0);
            maxConcurrency = value > 0 ? value : null;
        }
        Double perHostQps = null;
        if (raw.get("per_host_qps") != null) {
            double value = coerceDouble(raw.get("per_host_qps"), 0.0);
            perHostQps = value > 0 ? value : null;
        }

        return PolicySnapshot.builder()
                .id(raw.get("id") == null ? null : raw.get("id").toString())
                .name(raw.get("name") == null ? defaults.getName() : raw.get("name").toString())
                .maxConcurrency(maxConcurrency)
                .perHostQps(perHostQps)
                .priority(clamp(coerceInt(raw.get("priority"), defaults.getPriority()), 0, MAX_PRIORITY))
                .retryMaxAttempts(clamp(coerceInt(raw.get("retry_max_attempts"), defaults.getRetryMaxAttempts()),
                        1, MAX_RETRY_ATTEMPTS))
                .retryBackoff(backoff)
                .timeoutSeconds(Math.max(1.0, coerceDouble(raw.get("timeout_seconds"), defaults.getTimeoutSeconds())))
                .circuitBreakerThreshold(Math.max(0,
                        coerceInt(raw.get("circuit_breaker_threshold"), defaults.getCircuitBreakerThreshold())))
                .circuitBreakerWindowSeconds(Math.max(0,
                        coerceInt(raw.get("circuit_breaker_window_seconds"), defaults.getCircuitBreakerWindowSeconds())))
                .tagsInclude(coerceTags(raw.get("tags_include")))
                .tagsExclude(coerceTags(raw.get("tags_exclude")))
                .enabled(coerceBoolean(raw.get("enabled"), true))
                .build();
    }

    private RetryBackoff resolveBackoff(Map<String, Object> raw) {
        RetryBackoff fallback = defaults.getRetryBackoff();
        if (raw == null) {
            return fallback;
        }
        double base = Math.max(0.1, coerceDouble(raw.get("base_seconds"), fallback.getBaseSeconds()));
        double max = Math.max(base, coerceDouble(raw.get("max_seconds"), fallback.getMaxSeconds()));
        double jitter = Math.max(0.0, Math.min(1.0, coerceDouble(raw.get("jitter_ratio"), fallback.getJitterRatio())));
        return RetryBackoff.builder()
                .strategy(BackoffStrategy.fromValue(raw.get("strategy"), fallback.getStrategy()))
                .baseSeconds(base)
                .maxSeconds(max)
                .jitterRatio(jitter)
                .retryOnAssertions(coerceBoolean(raw.get("retry_on_assertions"), fallback.isRetryOnAssertions()))
                .cooldownSeconds(Math.max(1.0, coerceDouble(raw.get("cooldown_seconds"), fallback.getCooldownSeconds())))
                .build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(value, max));
    }

    static double coerceDouble(Object value, double fallback) {
        if (value == null || value instanceof Boolean) {
            return fallback;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return fallback;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    static int coerceInt(Object value, int fallback) {
        if (value == null || value instanceof Boolean) {
            return fallback;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return fallback;
        }
        try {
            return (int) Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    static boolean coerceBoolean(Object value, boolean fallback) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) {
            return fallback;
        }
        return text.equals("true") || text.equals("1") || text.equals("yes");
    }

    static List<String> coerceTags(Object value) {
        List<String> tags = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    tags.add(item.toString());
                }
            }
        } else if (value != null) {
            tags.addAll(Arrays.asList(value.toString().split(",")));
        }
        return tags;
    }
}
