package com.example.apitest.service;

import com.example.apitest.assertion.AssertionEngine;
import com.example.apitest.model.ProgressEventType;
import com.example.apitest.policy.PolicyRuntime;
import com.example.apitest.policy.PolicySnapshot;
import com.example.apitest.policy.SlotPermit;
import com.example.apitest.runner.StepExecutor;
import com.example.apitest.runner.StepResult;
import com.example.apitest.runner.TransportException;
import com.example.apitest.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one request under its policy until it passes, fails for good or runs out of attempts.
 * <p>
 * Each attempt checks the host's breaker, takes a concurrency slot, waits out the rate limiter and
 * dispatches. Only the rate-limit wait and the dispatch happen while the slot is held; breaker
 * and backoff sleeps happen outside it. A blocked attempt still counts as an attempt.
 */
@Slf4j
@Service
public class AttemptLoop {
    private final StepExecutor executor;
    private final AssertionEngine assertionEngine;
    private final ProgressEmitter emitter;
    private final Sleeper sleeper;

    public AttemptLoop(StepExecutor executor, AssertionEngine assertionEngine, ProgressEmitter emitter, Sleeper sleeper) {
        this.executor = executor;
        this.assertionEngine = assertionEngine;
        this.emitter = emitter;
        this.sleeper = sleeper;
    }

    public AttemptOutcome run(AttemptRequest request) throws InterruptedException {
        PolicyRuntime runtime = request.getRuntime();
        PolicySnapshot policy = runtime.getSnapshot();
        String host = hostOf(request.getSpec().getUrl());
        int maxAttempts = Math.max(1, policy.getRetryMaxAttempts());
        List<Map<String, Object>> history = new ArrayList<>();
        long start = System.nanoTime();

        StepResult lastResult = null;
        TransportException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            double blockedFor = runtime.circuitRemaining(host);
            if (blockedFor > 0) {
                Map<String, Object> blocked = entry(attempt, "blocked");
                blocked.put("host", host);
                blocked.put("cooldown_remaining", blockedFor);
                history.add(blocked);
                emit(request, ProgressEventType.BLOCKED, blocked);
                if (attempt < maxAttempts) {
                    log.info("Circuit open for {}, waiting {}s before attempt {}", host, blockedFor, attempt + 1);
                    sleeper.sleep(blockedFor);
                    continue;
                }
                log.warn("Circuit still open for {} after {} attempts", host, attempt);
                return outcome(AttemptOutcome.Kind.CIRCUIT_OPEN, attempt, host, start, lastResult, lastError, null, history)
                        .cooldownRemaining(blockedFor)
                        .build();
            }

            StepResult result;
            try (SlotPermit ignored = runtime.acquireSlot()) {
                double wait = runtime.rateLimitDelay(host);
                if (wait > 0) {
                    log.debug("Rate limit for {} requires {}s wait", host, wait);
                    sleeper.sleep(wait);
                }
                Map<String, Object> dispatch = entry(attempt, "dispatch");
                dispatch.put("method", request.getSpec().getMethod());
                dispatch.put("host", host);
                emit(request, ProgressEventType.STEP_PROGRESS, dispatch);
                result = executor.execute(request.getSpec(), request.getContext(), request.getTimeout());
            } catch (TransportException e) {
                lastError = e;
                lastResult = null;
                PolicyRuntime.FailureOutcome failure = runtime.recordFailure(host);
                Map<String, Object> failed = entry(attempt, "transport_error");
                failed.put("error", e.getMessage());
                failed.put("duration_ms", e.getMetrics().get("duration_ms"));
                history.add(failed);
                if (failure.isOpened()) {
                    log.warn("Circuit opened for {} for {}s", host, failure.getCooldownRemaining());
                }
                if (attempt < maxAttempts) {
                    double delay = runtime.backoffDelay(attempt);
                    Map<String, Object> retrying = entry(attempt, "retrying");
                    retrying.put("reason", "transport_error");
                    retrying.put("error", e.getMessage());
                    retrying.put("delay_seconds", delay);
                    retrying.put("circuit_opened", failure.isOpened());
                    emit(request, ProgressEventType.RETRYING, retrying);
                    sleeper.sleep(delay);
                    continue;
                }
                log.warn("Transport failure for {} on final attempt {}: {}", host, attempt, e.getMessage());
                return outcome(AttemptOutcome.Kind.TRANSPORT_ERROR, attempt, host, start, null, e, null, history).build();
            }

            runtime.recordSuccess(host);
            lastResult = result;
            lastError = null;
            AssertionEngine.Evaluation evaluation =
                    assertionEngine.evaluate(request.getAssertions(), result.getContextData(), request.getContext());

            Map<String, Object> completed = entry(attempt, evaluation.isPassed() ? "passed" : "assertion_failed");
            completed.put("status_code", result.getMetrics().get("status_code"));
            completed.put("duration_ms", result.getMetrics().get("duration_ms"));
            history.add(completed);
            emit(request, ProgressEventType.STEP_PROGRESS, completed);

            if (evaluation.isPassed()) {
                return outcome(AttemptOutcome.Kind.PASSED, attempt, host, start, result, null, evaluation, history).build();
            }
            if (policy.getRetryBackoff().isRetryOnAssertions() && attempt < maxAttempts) {
                double delay = runtime.backoffDelay(attempt);
                Map<String, Object> retrying = entry(attempt, "retrying");
                retrying.put("reason", "assertion_failed");
                retrying.put("delay_seconds", delay);
                emit(request, ProgressEventType.RETRYING, retrying);
                sleeper.sleep(delay);
                continue;
            }
            return outcome(AttemptOutcome.Kind.FAILED, attempt, host, start, result, null, evaluation, history).build();
        }
        throw new IllegalStateException("Attempt loop ended without an outcome");
    }

    private AttemptOutcome.AttemptOutcomeBuilder outcome(AttemptOutcome.Kind kind, int attempts, String host, long start,
                                                         StepResult result, TransportException error,
                                                         AssertionEngine.Evaluation evaluation,
                                                         List<Map<String, Object>> history) {
        return AttemptOutcome.builder()
                .kind(kind)
                .attempts(attempts)
                .host(host)
                .durationMs((System.nanoTime() - start) / 1_000_000L)
                .result(result)
                .error(error)
                .evaluation(evaluation)
                .history(List.copyOf(history));
    }

    private void emit(AttemptRequest request, ProgressEventType type, Map<String, Object> payload) {
        emitter.emit(type, request.getReportId(), request.getStepAlias(), new LinkedHashMap<>(payload));
    }

    private static Map<String, Object> entry(int attempt, String outcome) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("attempt", attempt);
        entry.put("outcome", outcome);
        return entry;
    }

    static String hostOf(String url) {
        HttpUrl parsed = url == null ? null : HttpUrl.parse(url);
        return PolicyRuntime.normalizeHost(parsed == null ? null : parsed.host());
    }
}
