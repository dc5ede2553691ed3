package com.example.apitest.service;

import com.example.apitest.model.TestReport;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryReportStore implements ReportStore {
    private final Map<String, TestReport> reports = new ConcurrentHashMap<>();

    @Override
    public TestReport save(TestReport report) {
        reports.put(report.getId(), report);
        return report;
    }

    @Override
    public Optional<TestReport> findById(String id) {
        return Optional.ofNullable(reports.get(id));
    }
}
