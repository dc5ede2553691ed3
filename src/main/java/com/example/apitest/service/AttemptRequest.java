package com.example.apitest.service;

import com.example.apitest.assertion.AssertionDefinition;
import com.example.apitest.context.ExecutionContext;
import com.example.apitest.policy.PolicyRuntime;
import com.example.apitest.runner.RequestSpec;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class AttemptRequest {
    String reportId;
    /** Set for suite steps only. */
    String stepAlias;
    RequestSpec spec;
    List<AssertionDefinition> assertions;
    ExecutionContext context;
    PolicyRuntime runtime;
    Duration timeout;
}
