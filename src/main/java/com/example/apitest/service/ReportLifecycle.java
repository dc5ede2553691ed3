package com.example.apitest.service;

import com.example.apitest.model.ProgressEventType;
import com.example.apitest.model.ReportStatus;
import com.example.apitest.model.TestReport;
import com.example.apitest.policy.PolicySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Status changes, persistence and the started/finished events shared by case and suite runs.
 */
@Slf4j
@RequiredArgsConstructor
class ReportLifecycle {
    private final ReportStore reportStore;
    private final ProgressEmitter emitter;

    void start(TestReport report, PolicySnapshot policy, Map<String, Object> details) {
        report.setPolicySnapshot(policy.toMap());
        report.markRunning();
        reportStore.save(report);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("entity_type", report.getEntityType());
        payload.put("entity_id", report.getEntityId());
        payload.put("policy", policy.getName());
        payload.put("max_attempts", policy.getRetryMaxAttempts());
        payload.putAll(details);
        emitter.emit(ProgressEventType.STARTED, report.getId(), null, payload);
    }

    void finish(TestReport report, ReportStatus status, Map<String, Object> assertionsResult) {
        emitter.emit(ProgressEventType.ASSERTION_RESULT, report.getId(), null, assertionsResult);
        report.setAssertionsResult(assertionsResult);
        report.transitionTo(status);
        reportStore.save(report);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status.getValue());
        payload.put("attempts", report.getRetryAttempt());
        payload.put("duration_ms", report.getDurationMs());
        emitter.emit(ProgressEventType.FINISHED, report.getId(), null, payload);
        log.info("Report {} for {} {} finished as {} after {} attempt(s)",
                report.getId(), report.getEntityType(), report.getEntityId(), status, report.getRetryAttempt());
    }

    /**
     * Safety net for errors nobody planned for: marks the report ERROR (unless it already
     * finished) and hands the exception back for rethrowing.
     */
    RuntimeException failUnexpected(TestReport report, RuntimeException error) {
        log.error("Unexpected error while executing report {}", report.getId(), error);
        if (!report.isFinished()) {
            String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
            Map<String, Object> assertions = new LinkedHashMap<>();
            assertions.put("passed", false);
            assertions.put("results", new ArrayList<>());
            assertions.put("error", message);
            report.setErrorMessage(message);
            report.mergeMetrics(Map.of("status", "error", "error", message));
            emitter.emit(ProgressEventType.ASSERTION_RESULT, report.getId(), null, assertions);
            report.setAssertionsResult(assertions);
            report.transitionTo(ReportStatus.ERROR);
            reportStore.save(report);
            emitter.emit(ProgressEventType.FINISHED, report.getId(), null, Map.of("status", "error", "error", message));
        }
        return error;
    }

    static Map<String, Object> assertionsPayload(boolean passed, List<Map<String, Object>> results, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("passed", passed);
        payload.put("results", results);
        if (error != null) {
            payload.put("error", error);
        }
        return payload;
    }
}
