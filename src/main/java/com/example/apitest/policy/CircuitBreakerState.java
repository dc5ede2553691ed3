package com.example.apitest.policy;

import java.util.function.LongSupplier;

/**
 * Failure tracking for a single host. Failures are counted inside a rolling window that starts
 * at the first failure; once the threshold is reached the breaker opens for the cooldown and
 * becomes eligible again as soon as the cooldown has elapsed.
 */
public class CircuitBreakerState {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final LongSupplier nanoClock;
    private int threshold;
    private double windowSeconds;
    private double cooldownSeconds;

    private int consecutiveFailures;
    private long windowStart;
    private long openedUntil;
    private boolean open;

    public CircuitBreakerState(int threshold, double windowSeconds, double cooldownSeconds, LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
        updatePolicy(threshold, windowSeconds, cooldownSeconds);
    }

    public synchronized void updatePolicy(int threshold, double windowSeconds, double cooldownSeconds) {
        this.threshold = Math.max(1, threshold);
        this.windowSeconds = Math.max(0.0, windowSeconds);
        this.cooldownSeconds = Math.max(1.0, cooldownSeconds);
    }

    /**
     * @return true when this failure opened the breaker
     */
    public synchronized boolean recordFailure() {
        long now = nanoClock.getAsLong();
        if (consecutiveFailures == 0 || windowExpired(now)) {
            consecutiveFailures = 0;
            windowStart = now;
        }
        consecutiveFailures++;
        if (consecutiveFailures >= threshold) {
            consecutiveFailures = 0;
            open = true;
            openedUntil = now + (long) (cooldownSeconds * NANOS_PER_SECOND);
            return true;
        }
        return false;
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
        open = false;
        openedUntil = 0L;
    }

    public synchronized double remaining() {
        if (!open) {
            return 0.0;
        }
        long remaining = openedUntil - nanoClock.getAsLong();
        if (remaining <= 0) {
            open = false;
            return 0.0;
        }
        return remaining / NANOS_PER_SECOND;
    }

    private boolean windowExpired(long now) {
        return windowSeconds > 0 && (now - windowStart) / NANOS_PER_SECOND > windowSeconds;
    }
}
