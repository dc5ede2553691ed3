package com.example.apitest.config;

import com.example.apitest.policy.BackoffStrategy;
import com.example.apitest.policy.PolicySnapshot;
import com.example.apitest.policy.PolicySnapshotFactory;
import com.example.apitest.policy.RetryBackoff;
import com.example.apitest.runner.HttpStepExecutor;
import com.example.apitest.runner.PayloadRedactor;
import com.example.apitest.runner.StepExecutor;
import com.example.apitest.service.InMemoryReportStore;
import com.example.apitest.service.LoggingProgressPublisher;
import com.example.apitest.service.ProgressPublisher;
import com.example.apitest.service.ReportStore;
import com.example.apitest.util.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@Configuration
@Slf4j
public class EngineConfig {

    @Value("${REQUEST_TIMEOUT_SECONDS:30}")
    private int requestTimeoutSeconds;

    @Value("${MAX_RESPONSE_SIZE_BYTES:1048576}")
    private int maxResponseSizeBytes;

    @Value("${REDACT_FIELDS:authorization,password,token,api_key,secret,cookie,set-cookie}")
    private String redactFields;

    @Value("${REDACTION_PLACEHOLDER:***}")
    private String redactionPlaceholder;

    @Value("${HTTP_RETRY_ATTEMPTS:3}")
    private int httpRetryAttempts;

    @Value("${HTTP_RETRY_BACKOFF_FACTOR:0.5}")
    private double httpRetryBackoffFactor;

    @Value("${HTTP_RETRY_STATUSES:429,502,503,504}")
    private String httpRetryStatuses;

    @Value("${HTTP_RETRY_METHODS:GET,HEAD,OPTIONS,PUT,DELETE}")
    private String httpRetryMethods;

    @Value("${DEFAULT_RETRY_MAX_ATTEMPTS:3}")
    private int defaultRetryMaxAttempts;

    @Value("${DEFAULT_BACKOFF_BASE_SECONDS:1.5}")
    private double defaultBackoffBaseSeconds;

    @Value("${DEFAULT_BACKOFF_MAX_SECONDS:30}")
    private double defaultBackoffMaxSeconds;

    @Value("${DEFAULT_CIRCUIT_THRESHOLD:5}")
    private int defaultCircuitThreshold;

    @Value("${DEFAULT_CIRCUIT_WINDOW_SECONDS:60}")
    private int defaultCircuitWindowSeconds;

    @Value("${DEFAULT_COOLDOWN_SECONDS:30}")
    private double defaultCooldownSeconds;

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(requestTimeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(requestTimeoutSeconds, TimeUnit.SECONDS)
                .writeTimeout(requestTimeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Bean
    public PayloadRedactor payloadRedactor() {
        return new PayloadRedactor(splitCsv(redactFields), redactionPlaceholder);
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public StepExecutor stepExecutor(OkHttpClient okHttpClient, ObjectMapper objectMapper,
                                     PayloadRedactor payloadRedactor, Sleeper sleeper) {
        HttpStepExecutor.Settings settings = HttpStepExecutor.Settings.builder()
                .maxResponseSizeBytes(maxResponseSizeBytes)
                .retryAttempts(httpRetryAttempts)
                .retryBackoffFactor(Math.max(0.1, httpRetryBackoffFactor))
                .retryStatuses(splitCsv(httpRetryStatuses).stream().map(Integer::valueOf).collect(Collectors.toSet()))
                .retryMethods(splitCsv(httpRetryMethods).stream().map(m -> m.toUpperCase(Locale.ROOT)).collect(Collectors.toSet()))
                .build();
        log.info("HTTP step executor: max body {} bytes, {} transport attempts, retry statuses {}",
                maxResponseSizeBytes, httpRetryAttempts, settings.getRetryStatuses());
        return new HttpStepExecutor(okHttpClient, objectMapper, payloadRedactor, settings, sleeper);
    }

    @Bean
    public PolicySnapshotFactory policySnapshotFactory() {
        double base = Math.max(0.1, defaultBackoffBaseSeconds);
        PolicySnapshot defaults = PolicySnapshot.builder()
                .name("default")
                .priority(0)
                .retryMaxAttempts(Math.max(1, Math.min(defaultRetryMaxAttempts, PolicySnapshotFactory.MAX_RETRY_ATTEMPTS)))
                .retryBackoff(RetryBackoff.builder()
                        .strategy(BackoffStrategy.EXPONENTIAL)
                        .baseSeconds(base)
                        .maxSeconds(Math.max(base, defaultBackoffMaxSeconds))
                        .jitterRatio(0.0)
                        .retryOnAssertions(false)
                        .cooldownSeconds(Math.max(1.0, defaultCooldownSeconds))
                        .build())
                .timeoutSeconds(Math.max(1, requestTimeoutSeconds))
                .circuitBreakerThreshold(Math.max(0, defaultCircuitThreshold))
                .circuitBreakerWindowSeconds(Math.max(0, defaultCircuitWindowSeconds))
                .enabled(true)
                .build();
        return new PolicySnapshotFactory(defaults);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReportStore reportStore() {
        return new InMemoryReportStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProgressPublisher progressPublisher(ObjectMapper objectMapper) {
        return new LoggingProgressPublisher(objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static List<String> splitCsv(String raw) {
        if (raw == null) {
            return List.of();
        }
        Set<String> values = Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return List.copyOf(values);
    }
}
