package com.example.apitest.policy;

import java.util.function.LongSupplier;

/**
 * Classic token bucket that reports how long a caller has to wait instead of rejecting.
 * Callers are expected to sleep for the returned delay before dispatching.
 */
public class TokenBucket {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final double rate;
    private final double capacity;
    private final LongSupplier nanoClock;
    private double tokens;
    private long updatedAt;

    public TokenBucket(double rate, double capacity, LongSupplier nanoClock) {
        if (rate <= 0) {
            throw new IllegalArgumentException("Token bucket rate must be greater than zero");
        }
        this.rate = rate;
        this.capacity = capacity > 0 ? capacity : rate;
        this.nanoClock = nanoClock;
        this.tokens = this.capacity;
        this.updatedAt = nanoClock.getAsLong();
    }

    /**
     * Takes one token. Returns the number of seconds the caller must wait, 0 when a token was
     * available right away. An empty bucket goes into debt, so callers arriving together are
     * spaced one token apart.
     */
    public synchronized double consume() {
        long now = nanoClock.getAsLong();
        long elapsed = now - updatedAt;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + (elapsed / NANOS_PER_SECOND) * rate);
            updatedAt = now;
        }
        tokens -= 1.0;
        return tokens >= 0.0 ? 0.0 : -tokens / rate;
    }
}
