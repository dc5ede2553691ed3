package com.example.apitest.policy;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * One {@link TokenBucket} per normalized host. Buckets are created lazily and each one
 * synchronizes on itself, so hosts never wait on each other.
 */
public class PerHostRateLimiter {
    private final double rate;
    private final double capacity;
    private final LongSupplier nanoClock;
    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    public PerHostRateLimiter(double rate, LongSupplier nanoClock) {
        this.rate = Math.max(rate, 1e-6);
        this.capacity = Math.max(this.rate, 1.0);
        this.nanoClock = nanoClock;
    }

    public double getRate() {
        return rate;
    }

    public double waitTime(String host) {
        TokenBucket bucket = buckets.computeIfAbsent(PolicyRuntime.normalizeHost(host),
                h -> new TokenBucket(rate, capacity, nanoClock));
        return bucket.consume();
    }
}
