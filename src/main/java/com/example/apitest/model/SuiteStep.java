package com.example.apitest.model;

import com.example.apitest.assertion.AssertionDefinition;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class SuiteStep {
    String alias;
    TestCaseDefinition testCase;
    /** Overrides merged onto the case inputs, nested maps key by key. */
    @Singular("input")
    Map<String, Object> inputs;
    /** Rendered against the shared context and stored as variables before the step runs. */
    @Singular
    Map<String, Object> variables;
    @Singular
    List<AssertionDefinition> assertions;
}
