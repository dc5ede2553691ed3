package com.example.apitest.runner;

import com.example.apitest.context.ExecutionContext;

import java.time.Duration;

public interface StepExecutor {

    /**
     * Executes one request. Any HTTP status counts as a result; only transport failures throw.
     */
    StepResult execute(RequestSpec spec, ExecutionContext context, Duration timeout)
            throws TransportException, InterruptedException;
}
