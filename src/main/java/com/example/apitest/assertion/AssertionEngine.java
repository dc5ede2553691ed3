package com.example.apitest.assertion;

import com.example.apitest.context.ExecutionContext;
import com.example.apitest.context.TemplateRenderer;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Evaluates declarative assertions against a captured response. Evaluation is total: unknown
 * operators, malformed definitions and handler errors all become failing results.
 */
@Slf4j
@Component
public class AssertionEngine {
    private final TemplateRenderer renderer;

    public AssertionEngine(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * Accepts the loose shapes stored on test cases, see {@link AssertionDefinition#normalize}.
     */
    public Evaluation evaluate(Object rawAssertions, Map<String, Object> responseContext, ExecutionContext context) {
        return evaluate(AssertionDefinition.normalize(rawAssertions), responseContext, context);
    }

    public Evaluation evaluate(List<AssertionDefinition> assertions, Map<String, Object> responseContext,
                               ExecutionContext context) {
        if (assertions == null || assertions.isEmpty()) {
            return new Evaluation(true, List.of());
        }
        if (responseContext != null) {
            context.setCurrentResponse(responseContext);
        }
        UnaryOperator<Object> render = value -> renderer.render(value, context);
        List<AssertionResult> results = new ArrayList<>();
        boolean passed = true;
        for (int i = 0; i < assertions.size(); i++) {
            AssertionResult result = evaluateOne(assertions.get(i), i, render, context.getCurrentResponse());
            passed &= result.isPassed();
            results.add(result);
        }
        return new Evaluation(passed, List.copyOf(results));
    }

    private AssertionResult evaluateOne(AssertionDefinition definition, int index, UnaryOperator<Object> render,
                                        Map<String, Object> response) {
        String name = definition.getName() != null && !definition.getName().isBlank()
                ? definition.getName() : "assertion_" + index;
        String rawOperator = definition.getOperator() == null ? "" : definition.getOperator().trim().toLowerCase(Locale.ROOT);

        if (!definition.isEnabled()) {
            return AssertionResult.builder()
                    .name(name).operator(rawOperator).passed(true)
                    .expected(definition.getExpected()).actual(definition.getActual())
                    .message("Assertion disabled; skipped")
                    .build();
        }
        if (rawOperator.isEmpty()) {
            return failure(name, "unknown", "Assertion operator is required");
        }
        Optional<AssertionOperator> operator = AssertionOperator.fromName(rawOperator);
        if (operator.isEmpty()) {
            return failure(name, rawOperator, "Unsupported assertion operator '" + rawOperator + "'");
        }

        AssertionOperator.Outcome outcome;
        try {
            outcome = operator.get().apply(definition, render, response);
        } catch (RuntimeException e) {
            log.debug("Assertion {} ({}) raised {}", name, rawOperator, e.toString());
            return failure(name, rawOperator, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }

        AssertionResult.AssertionResultBuilder result = AssertionResult.builder()
                .name(name)
                .operator(rawOperator)
                .passed(outcome.isPassed())
                .actual(outcome.getActual())
                .expected(outcome.getExpected())
                .path(outcome.getPath());
        if (!outcome.isPassed()) {
            String message = definition.getMessage() != null && !definition.getMessage().isBlank()
                    ? definition.getMessage() : outcome.getFailureMessage();
            List<JsonDiffEntry> diff = JsonDiff.diff(outcome.getExpected(), outcome.getActual());
            result.message(message);
            if (!diff.isEmpty()) {
                result.diff(diff).diffText(JsonDiff.format(diff));
            }
        }
        return result.build();
    }

    private static AssertionResult failure(String name, String operator, String message) {
        return AssertionResult.builder()
                .name(name)
                .operator(operator)
                .passed(false)
                .message(message)
                .build();
    }

    @Value
    public static class Evaluation {
        boolean passed;
        List<AssertionResult> results;
    }
}
