package com.example.apitest.assertion;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Coercion and comparison rules shared by the assertion operators. Booleans are never treated as
 * numbers, and numbers compare by value regardless of their Java type.
 */
public final class ValueComparison {

    private ValueComparison() {
    }

    public static boolean valuesEqual(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            return left.equals(right);
        }
        if (left instanceof Number && right instanceof Number) {
            Optional<BigDecimal> a = toDecimal(left);
            Optional<BigDecimal> b = toDecimal(right);
            if (a.isPresent() && b.isPresent()) {
                return a.get().compareTo(b.get()) == 0;
            }
            return left.equals(right);
        }
        if (left instanceof Map && right instanceof Map) {
            Map<?, ?> a = (Map<?, ?>) left;
            Map<?, ?> b = (Map<?, ?>) right;
            if (a.size() != b.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : a.entrySet()) {
                if (!b.containsKey(entry.getKey()) || !valuesEqual(entry.getValue(), b.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof List && right instanceof List) {
            List<?> a = (List<?>) left;
            List<?> b = (List<?>) right;
            if (a.size() != b.size()) {
                return false;
            }
            Iterator<?> ia = a.iterator();
            Iterator<?> ib = b.iterator();
            while (ia.hasNext()) {
                if (!valuesEqual(ia.next(), ib.next())) {
                    return false;
                }
            }
            return true;
        }
        return left.equals(right);
    }

    /**
     * Substring test for strings, membership for collections, equality otherwise.
     */
    public static boolean contains(Object actual, Object expected) {
        if (actual == null) {
            return expected == null;
        }
        if (actual instanceof String) {
            return ((String) actual).contains(String.valueOf(expected));
        }
        if (actual instanceof Collection) {
            for (Object item : (Collection<?>) actual) {
                if (valuesEqual(item, expected)) {
                    return true;
                }
            }
            return false;
        }
        return valuesEqual(actual, expected);
    }

    /**
     * Numeric view of a value. Booleans, blanks and non-numeric text yield empty.
     */
    public static Optional<BigDecimal> toDecimal(Object value) {
        if (value == null || value instanceof Boolean) {
            return Optional.empty();
        }
        if (value instanceof BigDecimal) {
            return Optional.of((BigDecimal) value);
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        if (!(value instanceof Number) && !(value instanceof CharSequence)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Integral view of a value, accepting {@code 3}, {@code "3"} and {@code "3.0"} but not
     * {@code "3.5"} or booleans.
     */
    public static Optional<Integer> toInteger(Object value) {
        Optional<BigDecimal> decimal = toDecimal(value);
        if (decimal.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(decimal.get().stripTrailingZeros().intValueExact());
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }

    /**
     * Length of strings, collections, maps and arrays; empty for anything else.
     */
    public static Optional<Integer> lengthOf(Object value) {
        if (value instanceof CharSequence) {
            return Optional.of(((CharSequence) value).length());
        }
        if (value instanceof Collection) {
            return Optional.of(((Collection<?>) value).size());
        }
        if (value instanceof Map) {
            return Optional.of(((Map<?, ?>) value).size());
        }
        if (value != null && value.getClass().isArray()) {
            return Optional.of(Array.getLength(value));
        }
        return Optional.empty();
    }

    public static String typeName(Object value) {
        return JsonDiff.describeType(value);
    }
}
