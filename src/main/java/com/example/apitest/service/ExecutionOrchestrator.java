package com.example.apitest.service;

import com.example.apitest.assertion.AssertionResult;
import com.example.apitest.context.ExecutionContext;
import com.example.apitest.context.TemplateRenderer;
import com.example.apitest.model.ReportStatus;
import com.example.apitest.model.TestCaseDefinition;
import com.example.apitest.model.TestReport;
import com.example.apitest.policy.PolicyRuntimeRegistry;
import com.example.apitest.policy.PolicySnapshot;
import com.example.apitest.policy.PolicySnapshotFactory;
import com.example.apitest.runner.RequestSpec;
import com.example.apitest.runner.StepResult;
import com.example.apitest.runner.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Drives a single test case run from RUNNING to its terminal status.
 */
@Slf4j
@Service
public class ExecutionOrchestrator {
    private final AttemptLoop attemptLoop;
    private final TemplateRenderer renderer;
    private final PolicyRuntimeRegistry runtimeRegistry;
    private final PolicySnapshotFactory policyFactory;
    private final ReportLifecycle lifecycle;

    public ExecutionOrchestrator(AttemptLoop attemptLoop, TemplateRenderer renderer, PolicyRuntimeRegistry runtimeRegistry,
                                 PolicySnapshotFactory policyFactory, ReportStore reportStore, ProgressEmitter emitter) {
        this.attemptLoop = attemptLoop;
        this.renderer = renderer;
        this.runtimeRegistry = runtimeRegistry;
        this.policyFactory = policyFactory;
        this.lifecycle = new ReportLifecycle(reportStore, emitter);
    }

    public TestReport runCase(TestReport report, TestCaseDefinition testCase, PolicySnapshot policy) {
        return runCase(report, testCase, policy, new ExecutionContext());
    }

    public TestReport runCase(TestReport report, TestCaseDefinition testCase, PolicySnapshot policy,
                              ExecutionContext context) {
        PolicySnapshot effective = policy == null ? policyFactory.defaults() : policy;
        try {
            lifecycle.start(report, effective, Map.of("case_name", String.valueOf(testCase.getName())));
            Map<String, Object> inputs = testCase.getInputs();
            RequestSpec spec = RequestSpec.fromInputs(renderer.renderMap(inputs, context))
                    .withDisplay(RequestSpec.fromInputs(inputs));

            AttemptOutcome outcome = attemptLoop.run(AttemptRequest.builder()
                    .reportId(report.getId())
                    .spec(spec)
                    .assertions(testCase.getAssertions())
                    .context(context)
                    .runtime(runtimeRegistry.runtimeFor(effective))
                    .timeout(timeoutOf(effective))
                    .build());
            return complete(report, outcome);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw lifecycle.failUnexpected(report, new IllegalStateException("Execution interrupted", e));
        } catch (RuntimeException e) {
            throw lifecycle.failUnexpected(report, e);
        }
    }

    private TestReport complete(TestReport report, AttemptOutcome outcome) {
        report.setRetryAttempt(outcome.getAttempts());
        report.setDurationMs(outcome.getDurationMs());
        Map<String, Object> metrics = new LinkedHashMap<>();
        String error = null;
        ReportStatus status;

        switch (outcome.getKind()) {
            case PASSED:
            case FAILED: {
                StepResult result = outcome.getResult();
                report.setRequestPayload(result.getRequestPayload());
                report.setResponsePayload(result.getResponsePayload());
                metrics.putAll(result.getMetrics());
                status = outcome.getKind() == AttemptOutcome.Kind.PASSED ? ReportStatus.PASSED : ReportStatus.FAILED;
                break;
            }
            case TRANSPORT_ERROR: {
                TransportException failure = outcome.getError();
                error = failure.getMessage();
                report.setRequestPayload(failure.getRequestPayload());
                report.setResponsePayload(failure.getResponsePayload().isEmpty()
                        ? Map.of("error", String.valueOf(error)) : failure.getResponsePayload());
                metrics.putAll(failure.getMetrics());
                status = ReportStatus.ERROR;
                break;
            }
            default: {
                error = "Circuit breaker open for host " + outcome.getHost();
                if (outcome.getError() != null) {
                    report.setRequestPayload(outcome.getError().getRequestPayload());
                    report.setResponsePayload(outcome.getError().getResponsePayload());
                } else if (outcome.getResult() != null) {
                    report.setRequestPayload(outcome.getResult().getRequestPayload());
                    report.setResponsePayload(outcome.getResult().getResponsePayload());
                }
                metrics.put("duration_ms", outcome.getDurationMs());
                metrics.put("status", "circuit_open");
                metrics.put("host", outcome.getHost());
                metrics.put("cooldown_remaining", outcome.getCooldownRemaining());
                status = ReportStatus.ERROR;
            }
        }
        metrics.put("attempt_history", outcome.getHistory());
        report.mergeMetrics(metrics);
        if (error != null) {
            report.setErrorMessage(error);
        }

        List<Map<String, Object>> results = outcome.getEvaluation() == null ? List.of()
                : outcome.getEvaluation().getResults().stream().map(AssertionResult::toMap).collect(Collectors.toList());
        lifecycle.finish(report, status, ReportLifecycle.assertionsPayload(status == ReportStatus.PASSED, results, error));
        return report;
    }

    static Duration timeoutOf(PolicySnapshot policy) {
        return Duration.ofMillis(Math.round(Math.max(1.0, policy.getTimeoutSeconds()) * 1000));
    }
}
