package com.example.apitest.policy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.function.LongSupplier;

/**
 * Process-wide holder of the mutable state behind {@link PolicyRuntime}. Runs that share a
 * policy key share slots, rate limiters and circuit breakers. State lives in this process only;
 * a shared store would replace this class to enforce limits across worker processes.
 */
@Slf4j
@Component
public class PolicyRuntimeRegistry {
    private final LongSupplier nanoClock;
    private final Random random;

    private final Map<String, SizedSemaphore> semaphores = new ConcurrentHashMap<>();
    private final Map<String, PerHostRateLimiter> rateLimiters = new ConcurrentHashMap<>();
    private final Map<String, Map<String, CircuitBreakerState>> circuits = new ConcurrentHashMap<>();

    @Autowired
    public PolicyRuntimeRegistry() {
        this(System::nanoTime, new Random());
    }

    public PolicyRuntimeRegistry(LongSupplier nanoClock, Random random) {
        this.nanoClock = nanoClock;
        this.random = random;
    }

    public PolicyRuntime runtimeFor(PolicySnapshot snapshot) {
        return new PolicyRuntime(snapshot, this);
    }

    Random random() {
        return random;
    }

    Semaphore semaphore(String key, int capacity) {
        return semaphores.compute(key, (k, existing) -> {
            if (existing != null && existing.capacity == capacity) {
                return existing;
            }
            if (existing != null) {
                log.info("Concurrency limit for policy {} changed from {} to {}", k, existing.capacity, capacity);
            }
            return new SizedSemaphore(capacity, new Semaphore(capacity, true));
        }).semaphore;
    }

    PerHostRateLimiter rateLimiter(String key, double rate) {
        return rateLimiters.compute(key, (k, existing) -> {
            if (existing != null && Math.abs(existing.getRate() - rate) <= 1e-6 * Math.max(1.0, rate)) {
                return existing;
            }
            return new PerHostRateLimiter(rate, nanoClock);
        });
    }

    CircuitBreakerState circuit(String key, String host, int threshold, double windowSeconds, double cooldownSeconds) {
        Map<String, CircuitBreakerState> states = circuits.computeIfAbsent(key, k -> new ConcurrentHashMap<>());
        CircuitBreakerState state = states.computeIfAbsent(host,
                h -> new CircuitBreakerState(threshold, windowSeconds, cooldownSeconds, nanoClock));
        state.updatePolicy(threshold, windowSeconds, cooldownSeconds);
        return state;
    }

    private static final class SizedSemaphore {
        private final int capacity;
        private final Semaphore semaphore;

        private SizedSemaphore(int capacity, Semaphore semaphore) {
            this.capacity = capacity;
            this.semaphore = semaphore;
        }
    }
}
