package com.example.apitest.assertion;

import com.example.apitest.util.JsonPathUtil;
import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Closed catalog of assertion operators. Each constant resolves its own operands and decides
 * pass or fail; the engine adds naming, custom messages and diffs.
 */
public enum AssertionOperator {
    STATUS_CODE("status_code") {
        @Override
        Outcome apply(AssertionDefinition definition, UnaryOperator<Object> render, Map<String, Object> response) {
            Object expected = render.apply(definition.getExpected());
            Object actual = response == null ? null : response.get("status_code");
            // strict: "200" and 200.0 are not status codes
            if (!isIntegral(expected)) {
                return Outcome.fail(actual, expected, "Expected status code must be an integer");
            }
            int expectedCode = ((Number) expected).intValue();
            boolean passed = isIntegral(actual) && ((Number) actual).intValue() == expectedCode;
            return new Outcome(actual, expectedCode, null, passed, "Status code did not match");
        }
    },
    EQUALS("equals") {
        @Override
        Outcome apply(AssertionDefinition definition, UnaryOperator<Object> render, Map<String, Object> response) {
            Object actual = render.apply(definition.getActual());
            Object expected = render.apply(definition.getExpected());
            return new Outcome(actual, expected, null, ValueComparison.valuesEqual(actual, expected), "Values are not equal");
        }
    },
    NOT_EQUALS("not_equals") {
        @Override
        Outcome apply(AssertionDefinition definition, UnaryOperator<Object> render, Map<String, Object> response) {
            Object actual = render.apply(definition.getActual());
            Object expected = render.apply(definition.getExpected());
            return new Outcome(actual, expected, null, !ValueComparison.valuesEqual(actual, expected), "Values are equal");
        }
    },
    CONTAINS("contains") {
        @Override
        Outcome apply(AssertionDefinition definition, UnaryOperator<Object> render, Map<String, Object> response) {
            Object actual = render.apply(definition.getActual());
            Object expected = render.apply(definition.getExpected());
            return new Outcome(actual, expected, null, ValueComparison.contains(actual, expected), "Expected value not found");
        }
    },
    NOT_CONTAINS("not_contains") {
        @Override
        Outcome apply(AssertionDefinition definition, UnaryOperator<Object> render, Map<String, Object> response) {
            Object actual = render.apply(definition.getActual());
            Object expected = render.apply(definition.getExpected());
            return new Outcome(actual, expected, null, !ValueComparison.contains(actual, expected), "Unexpected value present");
        }
    },
    REGEX("regex", "regex_match") {
        @Override
        Outcome apply(AssertionDefinition definition, UnaryOperator<Object> render, Map<String, Object> response) {
            Object actual = render.apply(definition.getActual());
            Object pattern = render.apply(definition.getExpected());
            if (!(actual instanceof String) || !(pattern instanceof String)) {
                return Outcome.fail(actual, pattern, "Regex requires string actual and expected values");
            }
            try {
                boolean found = Pattern.compile((String) pattern).matcher((String) actual).find();
                return new Outcome(actual, pattern, null, found, "Pattern did not match");
            } catch (PatternSyntaxException e) {
                return Outcome.fail(actual, pattern, "Invalid regex pattern: " + e.getDescription());
            }
        }
    },
    LENGTH("length") {
        @Override
        Outcome apply(AssertionDefinition definition, UnaryOperator<Object> render, Map<String, Object> response) {
            Object actual = render.apply(definition.getActual());
            Object expected = render.apply(definition.getExpected());
            Optional<Integer> length = ValueComparison.lengthOf(actual);
            if (length.isEmpty()) {
                return Outcome.fail(actual, expected,
                        "Length requires a string, list or object actual value, got " + ValueComparison.typeName(actual));
            }
            Optional<Integer> expectedLength = ValueComparison.toInteger(expected);
            if (expectedLength.isEmpty()) {
                return Outcome.fail(length.get(), expected, "Expected length must be an integer, got '" + expected + "'");
            }
            return new Outcome(length.get(), expectedLength.get(), null,
                    length.get().equals(expectedLength.get()), "Length did not match");
        }
    },
    GT("gt") {
        @Override
        Outcome apply(AssertionDefinition definition, UnaryOperator<Object> render, Map<String, Object> response) {
            return compareNumbers(this, definition, render, 1);
        }
    },
    LT("lt") {
        @Override
        Outcome apply(AssertionDefinition definition, UnaryOperator<Object> render, Map<String, Object> response) {
            return compareNumbers(this, definition, render, -1);
        }
    },
    JSONPATH_EQUALS("jsonpath_equals") {
        @Override
        Outcome apply(AssertionDefinition definition, UnaryOperator<Object> render, Map<String, Object> response) {
            String path = renderPath(definition, render);
            Object expected = render.apply(definition.getExpected());
            Object actual = JsonPathUtil.evaluate(jsonBody(response), path);
            return new Outcome(actual, expected, path, ValueComparison.valuesEqual(actual, expected),
                    "JSONPath equality assertion failed");
        }
    },
    JSONPATH_CONTAINS("jsonpath_contains") {
        @Override
        Outcome apply(AssertionDefinition definition, UnaryOperator<Object> render, Map<String, Object> response) {
            String path = renderPath(definition, render);
            Object expected = render.apply(definition.getExpected());
            Object actual = JsonPathUtil.evaluate(jsonBody(response), path);
            return new Outcome(actual, expected, path, ValueComparison.contains(actual, expected),
                    "Expected value not present in JSONPath result");
        }
    };

    private final List<String> names;

    AssertionOperator(String... names) {
        this.names = List.of(names);
    }

    public String getValue() {
        return names.get(0);
    }

    abstract Outcome apply(AssertionDefinition definition, UnaryOperator<Object> render, Map<String, Object> response);

    public static Optional<AssertionOperator> fromName(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AssertionOperator operator : values()) {
            if (operator.names.contains(normalized)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger;
    }

    private static Outcome compareNumbers(AssertionOperator operator, AssertionDefinition definition,
                                          UnaryOperator<Object> render, int wanted) {
        Object actual = render.apply(definition.getActual());
        Object expected = render.apply(definition.getExpected());
        if (actual instanceof Boolean || expected instanceof Boolean) {
            return Outcome.fail(actual, expected,
                    operator.getValue() + " requires numeric operands; booleans are not numbers");
        }
        Optional<BigDecimal> left = ValueComparison.toDecimal(actual);
        Optional<BigDecimal> right = ValueComparison.toDecimal(expected);
        if (left.isEmpty() || right.isEmpty()) {
            return Outcome.fail(actual, expected, operator.getValue() + " requires numeric operands, got "
                    + ValueComparison.typeName(actual) + " and " + ValueComparison.typeName(expected));
        }
        boolean passed = Integer.signum(left.get().compareTo(right.get())) == wanted;
        String message = wanted > 0 ? "Actual value is not greater than expected" : "Actual value is not less than expected";
        return new Outcome(collapse(left.get()), collapse(right.get()), null, passed, message);
    }

    private static Number collapse(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            try {
                return stripped.longValueExact();
            } catch (ArithmeticException e) {
                return stripped;
            }
        }
        return value.doubleValue();
    }

    private static String renderPath(AssertionDefinition definition, UnaryOperator<Object> render) {
        Object path = render.apply(definition.getPath());
        if (!(path instanceof String) || ((String) path).isBlank()) {
            throw new IllegalArgumentException("JSONPath expression is required");
        }
        return (String) path;
    }

    private static Object jsonBody(Map<String, Object> response) {
        if (response != null && response.get("json") != null) {
            return response.get("json");
        }
        return Map.of();
    }

    @Value
    static class Outcome {
        Object actual;
        Object expected;
        String path;
        boolean passed;
        String failureMessage;

        static Outcome fail(Object actual, Object expected, String message) {
            return new Outcome(actual, expected, null, false, message);
        }
    }
}
