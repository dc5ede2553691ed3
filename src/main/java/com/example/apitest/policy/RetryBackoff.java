package com.example.apitest.policy;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RetryBackoff {
    BackoffStrategy strategy;
    double baseSeconds;
    double maxSeconds;
    double jitterRatio;
    boolean retryOnAssertions;
    double cooldownSeconds;
}
