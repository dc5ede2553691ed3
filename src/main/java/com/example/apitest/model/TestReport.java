package com.example.apitest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Run record owned by the report store. Only the orchestrators mutate it, one writer per run.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TestReport {
    public static final String ENTITY_CASE = "case";
    public static final String ENTITY_SUITE = "suite";

    private String id = UUID.randomUUID().toString();
    private String entityType;
    private String entityId;
    @Setter(AccessLevel.NONE)
    private ReportStatus status = ReportStatus.PENDING;
    private Map<String, Object> policySnapshot;
    private int retryAttempt;
    private Long durationMs;
    private Map<String, Object> requestPayload;
    private Map<String, Object> responsePayload;
    private Map<String, Object> assertionsResult;
    private Map<String, Object> metrics = new LinkedHashMap<>();
    private String errorMessage;
    private Instant startedAt;
    private Instant finishedAt;

    public TestReport(String entityType, String entityId) {
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public static TestReport forCase(String caseId) {
        return new TestReport(ENTITY_CASE, caseId);
    }

    public static TestReport forSuite(String suiteId) {
        return new TestReport(ENTITY_SUITE, suiteId);
    }

    /**
     * @throws IllegalStateException when the status machine does not allow the move
     */
    public synchronized void transitionTo(ReportStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Report " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
        if (next == ReportStatus.RUNNING) {
            startedAt = Instant.now();
        } else if (next.isTerminal()) {
            finishedAt = Instant.now();
        }
    }

    public void markRunning() {
        transitionTo(ReportStatus.RUNNING);
    }

    @JsonIgnore
    public synchronized boolean isFinished() {
        return status.isTerminal();
    }

    public synchronized ReportStatus getStatus() {
        return status;
    }

    public void mergeMetrics(Map<String, Object> updates) {
        Map<String, Object> merged = metrics == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metrics);
        if (updates != null) {
            merged.putAll(updates);
        }
        metrics = merged;
    }
}
