package com.example.apitest.policy;

import lombok.Value;

import java.util.Locale;

/**
 * Resource governor for one run: concurrency slots, per-host rate limiting, per-host circuit
 * breaking and retry backoff, all driven by a single {@link PolicySnapshot}.
 */
public class PolicyRuntime {
    private final PolicySnapshot snapshot;
    private final PolicyRuntimeRegistry registry;

    PolicyRuntime(PolicySnapshot snapshot, PolicyRuntimeRegistry registry) {
        this.snapshot = snapshot;
        this.registry = registry;
    }

    public PolicySnapshot getSnapshot() {
        return snapshot;
    }

    /**
     * Blocks until a slot is free. Without a concurrency limit the returned permit is a no-op.
     */
    public SlotPermit acquireSlot() throws InterruptedException {
        Integer capacity = snapshot.getMaxConcurrency();
        if (capacity == null || capacity <= 0) {
            return SlotPermit.unbounded();
        }
        return SlotPermit.acquire(registry.semaphore(snapshot.getKey(), capacity));
    }

    public double rateLimitDelay(String host) {
        Double rate = snapshot.getPerHostQps();
        if (rate == null || rate <= 0) {
            return 0.0;
        }
        return registry.rateLimiter(snapshot.getKey(), rate).waitTime(host);
    }

    public double circuitRemaining(String host) {
        CircuitBreakerState state = circuit(host);
        return state == null ? 0.0 : state.remaining();
    }

    public FailureOutcome recordFailure(String host) {
        CircuitBreakerState state = circuit(host);
        if (state == null) {
            return new FailureOutcome(0.0, false);
        }
        boolean opened = state.recordFailure();
        return new FailureOutcome(state.remaining(), opened);
    }

    public void recordSuccess(String host) {
        CircuitBreakerState state = circuit(host);
        if (state != null) {
            state.recordSuccess();
        }
    }

    /**
     * Delay before the given retry, never above {@code max_seconds}. Attempt numbers start at 1.
     */
    public double backoffDelay(int attempt) {
        if (attempt <= 0) {
            return 0.0;
        }
        RetryBackoff backoff = snapshot.getRetryBackoff();
        double max = backoff.getMaxSeconds();
        double computed = Math.min(backoff.getBaseSeconds() * Math.pow(2, attempt - 1), max);
        BackoffStrategy strategy = backoff.getStrategy() == null ? BackoffStrategy.EXPONENTIAL : backoff.getStrategy();
        switch (strategy) {
            case FULL_JITTER:
                return registry.random().nextDouble() * computed;
            case EXPONENTIAL_JITTER:
                double span = computed * backoff.getJitterRatio();
                if (span <= 0) {
                    return computed;
                }
                double jittered = computed + (registry.random().nextDouble() * 2 - 1) * span;
                return Math.max(0.0, Math.min(jittered, max));
            case EXPONENTIAL:
            default:
                return computed;
        }
    }

    public static String normalizeHost(String host) {
        if (host == null || host.isBlank()) {
            return "default";
        }
        return host.trim().toLowerCase(Locale.ROOT);
    }

    private CircuitBreakerState circuit(String host) {
        int threshold = snapshot.getCircuitBreakerThreshold();
        if (threshold <= 0) {
            return null;
        }
        return registry.circuit(snapshot.getKey(), normalizeHost(host), threshold,
                snapshot.getCircuitBreakerWindowSeconds(), snapshot.getRetryBackoff().getCooldownSeconds());
    }

    @Value
    public static class FailureOutcome {
        double cooldownRemaining;
        boolean opened;
    }
}
