package com.example.apitest.runner;

import lombok.Value;

import java.util.Map;

@Value
public class StepResult {
    Map<String, Object> requestPayload;
    Map<String, Object> responsePayload;
    Map<String, Object> metrics;
    Map<String, Object> contextData;
}
