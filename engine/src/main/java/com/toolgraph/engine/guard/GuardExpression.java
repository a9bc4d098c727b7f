package com.toolgraph.engine.guard;

import java.util.List;
import java.util.Map;

/**
 * Node of a parsed guard expression.
 *
 * The node set is closed: literals, reads from the run state, arithmetic,
 * comparison, membership and boolean logic. There is no way to name a class,
 * call a method or reach anything outside the state map.
 */
public interface GuardExpression {

    /**
     * @throws GuardEvaluationException if the expression cannot be evaluated
     *                                  against {@code state}
     */
    Object evaluate(Map<String, Object> state);

    record Literal(Object value) implements GuardExpression {
        @Override
        public Object evaluate(Map<String, Object> state) {
            return value;
        }
    }

    /** The bare {@code state} name. */
    record StateRef() implements GuardExpression {
        @Override
        public Object evaluate(Map<String, Object> state) {
            return state;
        }
    }

    /** {@code target[key]} and {@code target.key}; a missing key is an error. */
    record Index(GuardExpression target, GuardExpression key) implements GuardExpression {
        @Override
        public Object evaluate(Map<String, Object> state) {
            return GuardValues.index(target.evaluate(state), key.evaluate(state));
        }
    }

    /** {@code target.get(key[, fallback])}; a missing key yields the fallback. */
    record MapGet(GuardExpression target, GuardExpression key, GuardExpression fallback)
            implements GuardExpression {
        @Override
        public Object evaluate(Map<String, Object> state) {
            Object t = target.evaluate(state);
            if (!(t instanceof Map<?, ?> map)) {
                throw new GuardEvaluationException("get() requires a map but got " + GuardValues.describe(t));
            }
            Object k = key.evaluate(state);
            if (map.containsKey(k)) {
                return map.get(k);
            }
            return fallback == null ? null : fallback.evaluate(state);
        }
    }

    record Length(GuardExpression argument) implements GuardExpression {
        @Override
        public Object evaluate(Map<String, Object> state) {
            return GuardValues.length(argument.evaluate(state));
        }
    }

    record Negate(GuardExpression operand) implements GuardExpression {
        @Override
        public Object evaluate(Map<String, Object> state) {
            return GuardValues.negate(operand.evaluate(state));
        }
    }

    record Not(GuardExpression operand) implements GuardExpression {
        @Override
        public Object evaluate(Map<String, Object> state) {
            return !GuardValues.truthy(operand.evaluate(state));
        }
    }

    record Arithmetic(String operator, GuardExpression left, GuardExpression right)
            implements GuardExpression {
        @Override
        public Object evaluate(Map<String, Object> state) {
            return GuardValues.arithmetic(operator, left.evaluate(state), right.evaluate(state));
        }
    }

    /**
     * {@code and} / {@code or}, short-circuiting. The result is the operand
     * that decided the outcome, not a coerced boolean, so
     * {@code state.get('limit') or 10} yields 10 when the key is absent.
     */
    record Logical(boolean conjunction, GuardExpression left, GuardExpression right)
            implements GuardExpression {
        @Override
        public Object evaluate(Map<String, Object> state) {
            Object l = left.evaluate(state);
            boolean truthy = GuardValues.truthy(l);
            if (conjunction ? !truthy : truthy) {
                return l;
            }
            return right.evaluate(state);
        }
    }

    /**
     * A comparison chain: {@code a < b <= c} means {@code a < b and b <= c},
     * each operand evaluated at most once.
     */
    record Comparison(List<GuardExpression> operands, List<String> operators)
            implements GuardExpression {

        public Comparison {
            operands  = List.copyOf(operands);
            operators = List.copyOf(operators);
        }

        @Override
        public Object evaluate(Map<String, Object> state) {
            Object left = operands.get(0).evaluate(state);
            for (int i = 0; i < operators.size(); i++) {
                Object right = operands.get(i + 1).evaluate(state);
                if (!test(operators.get(i), left, right)) {
                    return false;
                }
                left = right;
            }
            return true;
        }

        private static boolean test(String op, Object left, Object right) {
            return switch (op) {
                case "==" -> GuardValues.valuesEqual(left, right);
                case "!=" -> !GuardValues.valuesEqual(left, right);
                case "<"  -> GuardValues.compare(left, right) < 0;
                case "<=" -> GuardValues.compare(left, right) <= 0;
                case ">"  -> GuardValues.compare(left, right) > 0;
                case ">=" -> GuardValues.compare(left, right) >= 0;
                case "in" -> GuardValues.contains(right, left);
                case "not in" -> !GuardValues.contains(right, left);
                default -> throw new IllegalArgumentException("Unknown comparison operator: " + op);
            };
        }
    }
}
