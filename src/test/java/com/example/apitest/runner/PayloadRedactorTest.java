package com.example.apitest.runner;

import com.example.apitest.context.ExecutionContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PayloadRedactorTest {
    private final PayloadRedactor redactor = new PayloadRedactor(List.of("Authorization", "password"), "[redacted]");

    @Test
    void masksConfiguredKeysAtAnyDepthIgnoringCase() {
        Map<String, Object> payload = Map.of(
                "headers", Map.of("authorization", "Bearer abc"),
                "json", Map.of("users", List.of(Map.of("name", "ada", "PASSWORD", "pw"))));

        Map<String, Object> redacted = redactor.redactMap(payload, Set.of());

        assertThat(redacted).containsEntry("headers", Map.of("authorization", "[redacted]"))
                .containsEntry("json", Map.of("users", List.of(Map.of("name", "ada", "PASSWORD", "[redacted]"))));
    }

    @Test
    void masksSecretTemplatesAndLiteralSecretValues() {
        ExecutionContext context = new ExecutionContext(Map.of(), Map.of(), Map.of("api", Map.of("key", "k-123")));

        Object redacted = redactor.redact(
                List.of("{{ secret.api.key }}", "url?key=k-123", 42), PayloadRedactor.secretValues(context));

        assertThat(redacted).isEqualTo(List.of("[redacted]", "url?key=[redacted]", 42));
    }

    @Test
    void emptySecretValuesAreIgnored() {
        ExecutionContext context = new ExecutionContext(Map.of(), Map.of(), Map.of("blank", ""));

        assertThat(PayloadRedactor.secretValues(context)).isEmpty();
        assertThat(redactor.redact("plain", PayloadRedactor.secretValues(context))).isEqualTo("plain");
    }
}
