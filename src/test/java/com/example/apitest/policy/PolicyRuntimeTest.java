package com.example.apitest.policy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PolicyRuntimeTest {
    private static final long SECOND = 1_000_000_000L;

    private final AtomicLong clock = new AtomicLong(10 * SECOND);
    private PolicyRuntimeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PolicyRuntimeRegistry(clock::get, new Random(42));
    }

    @Test
    @DisplayName("Exponential backoff is non-decreasing and capped at max_seconds")
    void exponentialBackoffIsMonotonicAndCapped() {
        // Given
        PolicyRuntime runtime = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL, 1.5, 30, 0.0).build());

        // When / Then
        double previous = 0;
        for (int attempt = 1; attempt <= 10; attempt++) {
            double delay = runtime.backoffDelay(attempt);
            assertThat(delay).isGreaterThanOrEqualTo(previous).isLessThanOrEqualTo(30.0);
            previous = delay;
        }
        assertThat(runtime.backoffDelay(1)).isEqualTo(1.5);
        assertThat(runtime.backoffDelay(3)).isEqualTo(6.0);
        assertThat(runtime.backoffDelay(10)).isEqualTo(30.0);
    }

    @Test
    void backoffIsZeroForNonPositiveAttempts() {
        PolicyRuntime runtime = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL, 1.5, 30, 0.0).build());

        assertThat(runtime.backoffDelay(0)).isZero();
        assertThat(runtime.backoffDelay(-3)).isZero();
    }

    @Test
    @DisplayName("Jittered strategies stay within their documented bounds")
    void jitteredBackoffStaysInBounds() {
        PolicyRuntime fullJitter = registry.runtimeFor(policy(BackoffStrategy.FULL_JITTER, 2, 10, 0.0).build());
        PolicyRuntime jitter = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL_JITTER, 2, 10, 0.5).build());

        for (int round = 0; round < 50; round++) {
            for (int attempt = 1; attempt <= 10; attempt++) {
                double computed = Math.min(2 * Math.pow(2, attempt - 1), 10);
                assertThat(fullJitter.backoffDelay(attempt)).isBetween(0.0, computed);
                assertThat(jitter.backoffDelay(attempt)).isBetween(computed * 0.5, Math.min(computed * 1.5, 10));
            }
        }
    }

    @Test
    @DisplayName("Breaker opens after threshold failures and isolates hosts")
    void circuitOpensPerHost() {
        // Given
        PolicyRuntime runtime = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL, 1, 10, 0.0)
                .circuitBreakerThreshold(3)
                .circuitBreakerWindowSeconds(60)
                .build());

        // When
        assertThat(runtime.recordFailure("api.a.test").isOpened()).isFalse();
        assertThat(runtime.recordFailure("api.a.test").isOpened()).isFalse();
        PolicyRuntime.FailureOutcome third = runtime.recordFailure("API.A.TEST ");

        // Then
        assertThat(third.isOpened()).isTrue();
        assertThat(third.getCooldownRemaining()).isCloseTo(5.0, within(1e-9));
        assertThat(runtime.circuitRemaining("api.a.test")).isGreaterThan(0);
        assertThat(runtime.circuitRemaining("api.b.test")).isZero();
    }

    @Test
    void circuitBecomesEligibleAfterCooldown() {
        PolicyRuntime runtime = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL, 1, 10, 0.0)
                .circuitBreakerThreshold(1)
                .build());

        runtime.recordFailure("host");
        assertThat(runtime.circuitRemaining("host")).isCloseTo(5.0, within(1e-9));

        clock.addAndGet(2 * SECOND);
        assertThat(runtime.circuitRemaining("host")).isCloseTo(3.0, within(1e-9));

        clock.addAndGet(3 * SECOND);
        assertThat(runtime.circuitRemaining("host")).isZero();
    }

    @Test
    @DisplayName("Failures spread beyond the window do not open the breaker")
    void failuresOutsideWindowDoNotAccumulate() {
        PolicyRuntime runtime = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL, 1, 10, 0.0)
                .circuitBreakerThreshold(2)
                .circuitBreakerWindowSeconds(10)
                .build());

        runtime.recordFailure("host");
        clock.addAndGet(11 * SECOND);
        PolicyRuntime.FailureOutcome outcome = runtime.recordFailure("host");

        assertThat(outcome.isOpened()).isFalse();
        assertThat(runtime.circuitRemaining("host")).isZero();
    }

    @Test
    void successResetsFailureCount() {
        PolicyRuntime runtime = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL, 1, 10, 0.0)
                .circuitBreakerThreshold(2)
                .build());

        runtime.recordFailure("host");
        runtime.recordSuccess("host");
        assertThat(runtime.recordFailure("host").isOpened()).isFalse();
        assertThat(runtime.recordFailure("host").isOpened()).isTrue();
        runtime.recordSuccess("host");
        assertThat(runtime.circuitRemaining("host")).isZero();
    }

    @Test
    void zeroThresholdDisablesBreaker() {
        PolicyRuntime runtime = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL, 1, 10, 0.0)
                .circuitBreakerThreshold(0)
                .build());

        for (int i = 0; i < 20; i++) {
            PolicyRuntime.FailureOutcome outcome = runtime.recordFailure("host");
            assertThat(outcome.isOpened()).isFalse();
            assertThat(outcome.getCooldownRemaining()).isZero();
        }
        assertThat(runtime.circuitRemaining("host")).isZero();
    }

    @Test
    @DisplayName("Rate limiter returns the wait instead of rejecting, per host")
    void rateLimitDelayPerHost() {
        PolicyRuntime runtime = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL, 1, 10, 0.0)
                .perHostQps(2.0)
                .build());

        assertThat(runtime.rateLimitDelay("a")).isZero();
        assertThat(runtime.rateLimitDelay("a")).isZero();
        assertThat(runtime.rateLimitDelay("a")).isCloseTo(0.5, within(1e-9));
        assertThat(runtime.rateLimitDelay("b")).isZero();

        clock.addAndGet(SECOND);
        assertThat(runtime.rateLimitDelay("a")).isZero();
    }

    @Test
    @DisplayName("Callers arriving at the same instant are spaced one token apart")
    void rateLimitSpacesSimultaneousCallers() {
        // Given
        PolicyRuntime runtime = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL, 1, 10, 0.0)
                .perHostQps(1.0)
                .build());

        // When
        double first = runtime.rateLimitDelay("h");
        double second = runtime.rateLimitDelay("h");
        double third = runtime.rateLimitDelay("h");

        // Then
        assertThat(first).isZero();
        assertThat(second).isCloseTo(1.0, within(1e-9));
        assertThat(third).isCloseTo(2.0, within(1e-9));

        clock.addAndGet(2 * SECOND);
        assertThat(runtime.rateLimitDelay("h")).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Concurrent callers on one host get distinct waits")
    void rateLimitDelaysAreDistinctAcrossThreads() throws Exception {
        // Given
        PolicyRuntime runtime = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL, 1, 10, 0.0)
                .perHostQps(1.0)
                .build());
        int callers = 6;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        List<Future<Double>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < callers; i++) {
                Callable<Double> call = () -> {
                    start.await();
                    return runtime.rateLimitDelay("h");
                };
                futures.add(pool.submit(call));
            }
            start.countDown();
            List<Double> delays = new ArrayList<>();
            for (Future<Double> future : futures) {
                delays.add(future.get(5, TimeUnit.SECONDS));
            }

            // Then
            assertThat(delays).containsExactlyInAnyOrder(0.0, 1.0, 2.0, 3.0, 4.0, 5.0);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("A blocked slot acquisition resumes once a permit is released")
    void acquireSlotWaitsForRelease() throws Exception {
        // Given
        PolicyRuntime runtime = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL, 1, 10, 0.0)
                .id("single")
                .maxConcurrency(1)
                .build());
        SlotPermit held = runtime.acquireSlot();
        CountDownLatch acquired = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try (SlotPermit permit = runtime.acquireSlot()) {
                acquired.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        // When
        waiter.start();

        // Then
        assertThat(acquired.await(200, TimeUnit.MILLISECONDS)).isFalse();
        held.close();
        assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();
        waiter.join(5_000);
        assertThat(registry.semaphore("single", 1).availablePermits()).isEqualTo(1);
    }

    @Test
    void rateLimitIsNoopWithoutQps() {
        PolicyRuntime runtime = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL, 1, 10, 0.0).build());

        for (int i = 0; i < 100; i++) {
            assertThat(runtime.rateLimitDelay("a")).isZero();
        }
    }

    @Test
    @DisplayName("Slot permits release exactly once")
    void slotReleaseIsIdempotent() throws InterruptedException {
        PolicySnapshot snapshot = policy(BackoffStrategy.EXPONENTIAL, 1, 10, 0.0).id("p-1").maxConcurrency(2).build();
        PolicyRuntime runtime = registry.runtimeFor(snapshot);
        Semaphore semaphore = registry.semaphore("p-1", 2);

        SlotPermit first = runtime.acquireSlot();
        SlotPermit second = runtime.acquireSlot();
        assertThat(semaphore.availablePermits()).isZero();

        first.close();
        first.close();
        assertThat(semaphore.availablePermits()).isEqualTo(1);

        second.close();
        assertThat(semaphore.availablePermits()).isEqualTo(2);
    }

    @Test
    void slotIsNoopWithoutConcurrencyLimit() throws InterruptedException {
        PolicyRuntime runtime = registry.runtimeFor(policy(BackoffStrategy.EXPONENTIAL, 1, 10, 0.0).build());

        try (SlotPermit permit = runtime.acquireSlot()) {
            assertThat(permit).isNotNull();
        }
    }

    @Test
    void runsSharingPolicyKeyShareState() {
        PolicySnapshot snapshot = policy(BackoffStrategy.EXPONENTIAL, 1, 10, 0.0)
                .id("shared")
                .circuitBreakerThreshold(2)
                .build();

        registry.runtimeFor(snapshot).recordFailure("host");
        registry.runtimeFor(snapshot).recordFailure("host");

        assertThat(registry.runtimeFor(snapshot).circuitRemaining("host")).isGreaterThan(0);
        assertThat(registry.runtimeFor(snapshot.toBuilder().id("other").build()).circuitRemaining("host")).isZero();
    }

    private static PolicySnapshot.PolicySnapshotBuilder policy(BackoffStrategy strategy, double base, double max,
                                                               double jitter) {
        return PolicySnapshot.builder()
                .name("test")
                .retryMaxAttempts(3)
                .timeoutSeconds(5)
                .enabled(true)
                .retryBackoff(RetryBackoff.builder()
                        .strategy(strategy)
                        .baseSeconds(base)
                        .maxSeconds(max)
                        .jitterRatio(jitter)
                        .cooldownSeconds(5)
                        .build());
    }
}
