package com.example.apitest.service;

import com.example.apitest.model.ProgressEvent;
import com.example.apitest.model.ProgressEventType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ProgressEmitterTest {
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    @Test
    void stampsAndPublishesEvents() {
        RecordingProgressPublisher publisher = new RecordingProgressPublisher();
        ProgressEmitter emitter = new ProgressEmitter(publisher, new ProgressEventSanitizer(new ObjectMapper()), clock);

        emitter.emit(ProgressEventType.BLOCKED, "report-1", "login", Map.of("host", "api.test"));

        ProgressEvent event = publisher.events().get(0);
        assertThat(event.getType()).isEqualTo(ProgressEventType.BLOCKED);
        assertThat(event.getReportId()).isEqualTo("report-1");
        assertThat(event.getStepAlias()).isEqualTo("login");
        assertThat(event.getTimestamp()).isEqualTo("2026-03-01T10:15:30Z");
        assertThat(event.getPayload()).containsEntry("host", "api.test");
    }

    @Test
    void publisherFailuresNeverReachTheRun() {
        ProgressEmitter emitter = new ProgressEmitter(event -> {
            throw new IllegalStateException("broker down");
        }, new ProgressEventSanitizer(new ObjectMapper()), clock);

        assertThatCode(() -> emitter.emit(ProgressEventType.FINISHED, "report-1", null, Map.of()))
                .doesNotThrowAnyException();
    }

    @Test
    void serializedEventOmitsNullsAndUsesSnakeCase() throws Exception {
        ProgressEvent event = ProgressEvent.builder()
                .type(ProgressEventType.STEP_PROGRESS)
                .reportId("r")
                .timestamp("t")
                .payload(Map.of("attempt", 1))
                .build();

        String json = new ObjectMapper().writeValueAsString(event);

        assertThat(json).isEqualTo("{\"type\":\"step_progress\",\"report_id\":\"r\",\"timestamp\":\"t\",\"payload\":{\"attempt\":1}}");
    }
}
