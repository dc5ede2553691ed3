package com.example.apitest.service;

import com.example.apitest.model.ProgressEvent;
import com.example.apitest.model.ProgressEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Stamps, bounds and publishes progress events. Publishing is best effort: a failing transport is
 * logged and never fails the run.
 */
@Slf4j
@Service
public class ProgressEmitter {
    private final ProgressPublisher publisher;
    private final ProgressEventSanitizer sanitizer;
    private final Clock clock;

    public ProgressEmitter(ProgressPublisher publisher, ProgressEventSanitizer sanitizer, Clock clock) {
        this.publisher = publisher;
        this.sanitizer = sanitizer;
        this.clock = clock;
    }

    public void emit(ProgressEventType type, String reportId, String stepAlias, Map<String, Object> payload) {
        ProgressEvent event = ProgressEvent.builder()
                .type(type)
                .reportId(reportId)
                .stepAlias(stepAlias)
                .timestamp(Instant.now(clock).toString())
                .payload(payload)
                .build();
        try {
            publisher.publish(sanitizer.sanitize(event));
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} event for report {}: {}", type.getValue(), reportId, e.toString());
        }
    }
}
