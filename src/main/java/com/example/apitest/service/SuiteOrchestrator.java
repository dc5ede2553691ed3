package com.example.apitest.service;

import com.example.apitest.assertion.AssertionDefinition;
import com.example.apitest.assertion.AssertionResult;
import com.example.apitest.context.ExecutionContext;
import com.example.apitest.context.TemplateRenderer;
import com.example.apitest.model.ProgressEventType;
import com.example.apitest.model.ReportStatus;
import com.example.apitest.model.SuiteDefinition;
import com.example.apitest.model.SuiteStep;
import com.example.apitest.model.TestCaseDefinition;
import com.example.apitest.model.TestReport;
import com.example.apitest.policy.PolicyRuntime;
import com.example.apitest.policy.PolicyRuntimeRegistry;
import com.example.apitest.policy.PolicySnapshot;
import com.example.apitest.policy.PolicySnapshotFactory;
import com.example.apitest.runner.RequestSpec;
import com.example.apitest.runner.StepResult;
import com.example.apitest.util.InputMergeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs suite steps in order against one shared context. A step that ends in a transport or
 * circuit error aborts the remaining steps; a step with failing assertions does not.
 */
@Slf4j
@Service
public class SuiteOrchestrator {
    private final AttemptLoop attemptLoop;
    private final TemplateRenderer renderer;
    private final PolicyRuntimeRegistry runtimeRegistry;
    private final PolicySnapshotFactory policyFactory;
    private final ProgressEmitter emitter;
    private final ReportLifecycle lifecycle;

    public SuiteOrchestrator(AttemptLoop attemptLoop, TemplateRenderer renderer, PolicyRuntimeRegistry runtimeRegistry,
                             PolicySnapshotFactory policyFactory, ReportStore reportStore, ProgressEmitter emitter) {
        this.attemptLoop = attemptLoop;
        this.renderer = renderer;
        this.runtimeRegistry = runtimeRegistry;
        this.policyFactory = policyFactory;
        this.emitter = emitter;
        this.lifecycle = new ReportLifecycle(reportStore, emitter);
    }

    public TestReport runSuite(TestReport report, SuiteDefinition suite, PolicySnapshot policy) {
        return runSuite(report, suite, policy, new ExecutionContext());
    }

    public TestReport runSuite(TestReport report, SuiteDefinition suite, PolicySnapshot policy, ExecutionContext context) {
        PolicySnapshot effective = policy == null ? policyFactory.defaults() : policy;
        try {
            lifecycle.start(report, effective, Map.of("suite_name", String.valueOf(suite.getName()),
                    "steps", suite.getSteps().size()));
            context.putVariables(InputMergeUtils.deepCopy(suite.getVariables()));
            return execute(report, suite, effective, context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw lifecycle.failUnexpected(report, new IllegalStateException("Execution interrupted", e));
        } catch (RuntimeException e) {
            throw lifecycle.failUnexpected(report, e);
        }
    }

    private TestReport execute(TestReport report, SuiteDefinition suite, PolicySnapshot policy, ExecutionContext context)
            throws InterruptedException {
        PolicyRuntime runtime = runtimeRegistry.runtimeFor(policy);
        List<Map<String, Object>> requestSteps = new ArrayList<>();
        List<Map<String, Object>> responseSteps = new ArrayList<>();
        List<Map<String, Object>> assertionSteps = new ArrayList<>();
        List<Map<String, Object>> metricSteps = new ArrayList<>();
        long totalDuration = 0;
        long totalResponseSize = 0;
        int totalAttempts = 0;
        boolean allPassed = true;
        String suiteError = null;

        List<SuiteStep> steps = suite.getSteps();
        for (int index = 0; index < steps.size(); index++) {
            SuiteStep step = steps.get(index);
            String alias = step.getAlias() == null || step.getAlias().isBlank() ? "step_" + (index + 1) : step.getAlias();
            TestCaseDefinition testCase = step.getTestCase();
            String caseId = testCase == null ? null : testCase.getId();

            if (testCase != null && !policy.admits(testCase.getTags())) {
                log.info("Skipping step {} of suite {}: tags {} not admitted by policy {}",
                        alias, suite.getId(), testCase.getTags(), policy.getName());
                Map<String, Object> skipped = stepEntry(alias, caseId);
                skipped.put("status", "skipped");
                metricSteps.add(skipped);
                emitter.emit(ProgressEventType.STEP_PROGRESS, report.getId(), alias,
                        Map.of("stage", "skipped", "reason", "tags not admitted by policy"));
                continue;
            }

            Map<String, Object> inputs = InputMergeUtils.merge(
                    testCase == null ? Map.<String, Object>of() : testCase.getInputs(), step.getInputs());
            if (!step.getVariables().isEmpty()) {
                context.putVariables(renderer.renderMap(step.getVariables(), context));
            }
            List<AssertionDefinition> assertions = new ArrayList<>();
            if (testCase != null) {
                assertions.addAll(testCase.getAssertions());
            }
            assertions.addAll(step.getAssertions());

            emitter.emit(ProgressEventType.STEP_PROGRESS, report.getId(), alias,
                    Map.of("stage", "started", "index", index));
            RequestSpec spec = RequestSpec.fromInputs(renderer.renderMap(inputs, context))
                    .withDisplay(RequestSpec.fromInputs(inputs));
            AttemptOutcome outcome = attemptLoop.run(AttemptRequest.builder()
                    .reportId(report.getId())
                    .stepAlias(alias)
                    .spec(spec)
                    .assertions(assertions)
                    .context(context)
                    .runtime(runtime)
                    .timeout(ExecutionOrchestrator.timeoutOf(policy))
                    .build());
            totalAttempts += outcome.getAttempts();

            if (outcome.isError()) {
                String error = outcome.getKind() == AttemptOutcome.Kind.CIRCUIT_OPEN
                        ? "Circuit breaker open for host " + outcome.getHost()
                        : outcome.getError().getMessage();
                Map<String, Object> errorMetrics = outcome.getError() == null ? Map.<String, Object>of() : outcome.getError().getMetrics();
                requestSteps.add(withAlias(alias, caseId, "request",
                        outcome.getError() == null ? Map.of() : outcome.getError().getRequestPayload()));
                responseSteps.add(withAlias(alias, caseId, "response", Map.of("error", String.valueOf(error))));
                Map<String, Object> stepAssertions = stepEntry(alias, caseId);
                stepAssertions.put("passed", false);
                stepAssertions.put("error", error);
                stepAssertions.put("assertions", List.of());
                assertionSteps.add(stepAssertions);
                Map<String, Object> stepMetrics = stepEntry(alias, caseId);
                stepMetrics.put("duration_ms", errorMetrics.getOrDefault("duration_ms", outcome.getDurationMs()));
                stepMetrics.put("status", outcome.getKind() == AttemptOutcome.Kind.CIRCUIT_OPEN ? "circuit_open" : "error");
                stepMetrics.put("response_size", 0);
                stepMetrics.put("attempts", outcome.getAttempts());
                metricSteps.add(stepMetrics);
                totalDuration += asLong(stepMetrics.get("duration_ms"));
                emitter.emit(ProgressEventType.ASSERTION_RESULT, report.getId(), alias, stepAssertions);
                log.warn("Suite {} aborted at step {}: {}", suite.getId(), alias, error);
                suiteError = error;
                allPassed = false;
                break;
            }

            StepResult result = outcome.getResult();
            boolean stepPassed = outcome.getKind() == AttemptOutcome.Kind.PASSED;
            requestSteps.add(withAlias(alias, caseId, "request", result.getRequestPayload()));
            responseSteps.add(withAlias(alias, caseId, "response", result.getResponsePayload()));
            Map<String, Object> stepAssertions = stepEntry(alias, caseId);
            stepAssertions.put("passed", stepPassed);
            stepAssertions.put("assertions", outcome.getEvaluation().getResults().stream()
                    .map(AssertionResult::toMap).collect(Collectors.toList()));
            assertionSteps.add(stepAssertions);
            Map<String, Object> stepMetrics = stepEntry(alias, caseId);
            stepMetrics.put("duration_ms", result.getMetrics().get("duration_ms"));
            stepMetrics.put("status", result.getMetrics().get("status"));
            stepMetrics.put("response_size", result.getMetrics().get("response_size"));
            stepMetrics.put("attempts", outcome.getAttempts());
            metricSteps.add(stepMetrics);
            totalDuration += asLong(result.getMetrics().get("duration_ms"));
            totalResponseSize += asLong(result.getMetrics().get("response_size"));
            emitter.emit(ProgressEventType.ASSERTION_RESULT, report.getId(), alias, stepAssertions);

            allPassed &= stepPassed;
            context.rememberStep(alias, result.getContextData());
        }

        ReportStatus status = suiteError != null ? ReportStatus.ERROR
                : allPassed ? ReportStatus.PASSED : ReportStatus.FAILED;
        report.setRetryAttempt(totalAttempts);
        report.setDurationMs(totalDuration);
        report.setRequestPayload(Map.of("steps", requestSteps));
        report.setResponsePayload(Map.of("steps", responseSteps));
        if (suiteError != null) {
            report.setErrorMessage(suiteError);
        }
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("duration_ms", totalDuration);
        metrics.put("response_size", totalResponseSize);
        metrics.put("status", status == ReportStatus.ERROR ? "error" : "completed");
        metrics.put("steps", metricSteps);
        report.mergeMetrics(metrics);

        Map<String, Object> assertionsResult = new LinkedHashMap<>();
        assertionsResult.put("passed", status == ReportStatus.PASSED);
        assertionsResult.put("steps", assertionSteps);
        if (suiteError != null) {
            assertionsResult.put("error", suiteError);
        }
        lifecycle.finish(report, status, assertionsResult);
        return report;
    }

    private static Map<String, Object> stepEntry(String alias, String caseId) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("alias", alias);
        entry.put("case_id", caseId);
        return entry;
    }

    private static Map<String, Object> withAlias(String alias, String caseId, String key, Object value) {
        Map<String, Object> entry = stepEntry(alias, caseId);
        entry.put(key, value);
        return entry;
    }

    private static long asLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}
