package com.example.apitest.service;

import com.example.apitest.model.TestReport;

import java.util.Optional;

public interface ReportStore {
    TestReport save(TestReport report);

    Optional<TestReport> findById(String id);
}
