package com.example.apitest.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class SuiteDefinition {
    String id;
    String name;
    @Singular
    Map<String, Object> variables;
    @Singular
    List<SuiteStep> steps;
}
