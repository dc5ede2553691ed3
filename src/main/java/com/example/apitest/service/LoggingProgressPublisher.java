package com.example.apitest.service;

import com.example.apitest.model.ProgressEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes each event as one JSON line to the log.
 */
@Slf4j
@RequiredArgsConstructor
public class LoggingProgressPublisher implements ProgressPublisher {
    private final ObjectMapper objectMapper;

    @Override
    public void publish(ProgressEvent event) {
        try {
            log.info("progress {}", objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.warn("Could not encode {} event for report {}: {}", event.getType(), event.getReportId(), e.getOriginalMessage());
        }
    }
}
