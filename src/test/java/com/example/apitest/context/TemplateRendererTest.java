package com.example.apitest.context;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRendererTest {
    private final TemplateRenderer renderer = new TemplateRenderer();
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        context = new ExecutionContext(
                Map.of("user", Map.of("id", 42, "name", "ada"), "base", "https://api.test"),
                Map.of("region", "eu"),
                Map.of("token", "s3cr3t"));
        context.rememberStep("login", Map.of(
                "status_code", 200,
                "json", Map.of("token", "abc", "items", List.of(Map.of("id", 1), Map.of("id", 2)))));
    }

    @Test
    @DisplayName("A lone placeholder keeps the resolved type")
    void singlePlaceholderKeepsType() {
        assertThat(renderer.render("{{ variables.user.id }}", context)).isEqualTo(42);
        assertThat(renderer.render("{{user.name}}", context)).isEqualTo("ada");
    }

    @Test
    void embeddedPlaceholdersAreStringified() {
        Object rendered = renderer.render("{{base}}/users/{{variables.user.id}}?r={{env.region}}", context);

        assertThat(rendered).isEqualTo("https://api.test/users/42?r=eu");
    }

    @Test
    void unresolvedPlaceholdersStayLiteral() {
        assertThat(renderer.render("{{variables.missing}}", context)).isEqualTo("{{variables.missing}}");
        assertThat(renderer.render("id={{user.nope}}&r={{env.region}}", context)).isEqualTo("id={{user.nope}}&r=eu");
    }

    @Test
    void resolvesSecretsAndPreviousSteps() {
        assertThat(renderer.render("Bearer {{secret.token}}", context)).isEqualTo("Bearer s3cr3t");
        assertThat(renderer.render("{{prev.login.json.token}}", context)).isEqualTo("abc");
        assertThat(renderer.render("{{steps.login.status_code}}", context)).isEqualTo(200);
        assertThat(renderer.render("{{prev.login.json.items.-1.id}}", context)).isEqualTo(2);
    }

    @Test
    @DisplayName("jsonpath segments evaluate against the json body")
    void evaluatesJsonPathSegments() {
        assertThat(renderer.render("{{prev.login.jsonpath('$.items[0].id')}}", context)).isEqualTo(1);
        assertThat(renderer.render("{{prev.login.jsonpath('$.items[*].id')}}", context)).isEqualTo(List.of(1, 2));
    }

    @Test
    void invalidJsonPathLeavesPlaceholder() {
        String template = "{{prev.login.jsonpath('$.items[')}}";

        assertThat(renderer.render(template, context)).isEqualTo(template);
    }

    @Test
    void resolvesCurrentResponse() {
        context.setCurrentResponse(Map.of("status_code", 201, "headers", Map.of("location", "/users/7")));

        assertThat(renderer.render("{{response.headers.location}}", context)).isEqualTo("/users/7");
    }

    @Test
    void rendersNestedStructures() {
        Map<String, Object> rendered = renderer.renderMap(Map.of(
                "headers", Map.of("X-User", "{{user.name}}"),
                "ids", List.of("{{user.id}}", 7)), context);

        assertThat(rendered).containsEntry("headers", Map.of("X-User", "ada"))
                .containsEntry("ids", List.of(42, 7));
        assertThat(renderer.renderMap(null, context)).isEmpty();
    }
}
