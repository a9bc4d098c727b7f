package com.toolgraph.engine.guard;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value semantics of the guard language: truthiness, numeric coercion,
 * comparison and arithmetic. All numbers are handled as BigDecimal, so an
 * Integer from one tool compares equal to a Double from another.
 */
final class GuardValues {

    private GuardValues() {}

    static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number) return toDecimal(value).signum() != 0;
        if (value instanceof CharSequence s) return !s.isEmpty();
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal d) return d;
        if (value instanceof BigInteger i) return new BigDecimal(i);
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new GuardEvaluationException("Cannot use non-finite number " + d);
            }
            return BigDecimal.valueOf(d);
        }
        throw new GuardEvaluationException("Expected a number but got " + describe(value));
    }

    static boolean valuesEqual(Object left, Object right) {
        if (isNumber(left) && isNumber(right)) {
            return toDecimal(left).compareTo(toDecimal(right)) == 0;
        }
        return Objects.equals(left, right);
    }

    static int compare(Object left, Object right) {
        if (isNumber(left) && isNumber(right)) {
            return toDecimal(left).compareTo(toDecimal(right));
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        throw new GuardEvaluationException(
                "Cannot order " + describe(left) + " and " + describe(right));
    }

    static boolean contains(Object container, Object element) {
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(element);
        }
        if (container instanceof Collection<?> c) {
            return c.stream().anyMatch(e -> valuesEqual(e, element));
        }
        if (container instanceof String s) {
            if (!(element instanceof String e)) {
                throw new GuardEvaluationException("'in <string>' requires a string but got " + describe(element));
            }
            return s.contains(e);
        }
        throw new GuardEvaluationException("Cannot test membership in " + describe(container));
    }

    static Object arithmetic(String op, Object left, Object right) {
        if (op.equals("+") && left instanceof String l && right instanceof String r) {
            return l + r;
        }
        BigDecimal a = toDecimal(left);
        BigDecimal b = toDecimal(right);
        return switch (op) {
            case "+" -> a.add(b);
            case "-" -> a.subtract(b);
            case "*" -> a.multiply(b);
            case "/" -> {
                requireNonZero(b);
                yield a.divide(b, MathContext.DECIMAL64);
            }
            case "%" -> {
                requireNonZero(b);
                yield a.remainder(b);
            }
            default -> throw new IllegalArgumentException("Unknown arithmetic operator: " + op);
        };
    }

    static Object negate(Object value) {
        return toDecimal(value).negate();
    }

    static Object index(Object target, Object key) {
        if (target instanceof Map<?, ?> map) {
            if (!map.containsKey(key)) {
                throw new GuardEvaluationException("Key not found: " + describe(key));
            }
            return map.get(key);
        }
        if (target instanceof List<?> list) {
            int size = list.size();
            int i;
            try {
                i = toDecimal(key).intValueExact();
            } catch (ArithmeticException e) {
                throw new GuardEvaluationException("List index must be an integer but got " + describe(key));
            }
            int idx = i < 0 ? size + i : i;
            if (idx < 0 || idx >= size) {
                throw new GuardEvaluationException("Index " + i + " out of range for list of size " + size);
            }
            return list.get(idx);
        }
        throw new GuardEvaluationException("Cannot index into " + describe(target));
    }

    static Object length(Object value) {
        if (value instanceof CharSequence s) return s.length();
        if (value instanceof Collection<?> c) return c.size();
        if (value instanceof Map<?, ?> m) return m.size();
        throw new GuardEvaluationException("len() is not defined for " + describe(value));
    }

    static String describe(Object value) {
        if (value == null) return "null";
        if (value instanceof String s) return "'" + s + "'";
        return value.getClass().getSimpleName() + "(" + value + ")";
    }

    private static void requireNonZero(BigDecimal divisor) {
        if (divisor.signum() == 0) {
            throw new GuardEvaluationException("Division by zero");
        }
    }
}
