package com.example.apitest.model;

import com.example.apitest.assertion.AssertionDefinition;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A stored test case: request inputs ({@code method, url, headers, params, json|body}),
 * its assertions and tags.
 */
@Value
@Builder(toBuilder = true)
public class TestCaseDefinition {
    String id;
    String name;
    @Singular("input")
    Map<String, Object> inputs;
    @Singular
    List<AssertionDefinition> assertions;
    @Singular
    List<String> tags;
}
