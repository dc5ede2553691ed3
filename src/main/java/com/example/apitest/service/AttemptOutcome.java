package com.example.apitest.service;

import com.example.apitest.assertion.AssertionEngine;
import com.example.apitest.runner.StepResult;
import com.example.apitest.runner.TransportException;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What the attempt loop ended with. {@code result} and {@code error} hold whichever was captured
 * last, so a circuit that stays open after a transport failure still carries that failure.
 */
@Value
@Builder
public class AttemptOutcome {
    public enum Kind { PASSED, FAILED, TRANSPORT_ERROR, CIRCUIT_OPEN }

    Kind kind;
    int attempts;
    String host;
    long durationMs;
    StepResult result;
    TransportException error;
    AssertionEngine.Evaluation evaluation;
    double cooldownRemaining;
    List<Map<String, Object>> history;

    public boolean isError() {
        return kind == Kind.TRANSPORT_ERROR || kind == Kind.CIRCUIT_OPEN;
    }
}
