package com.toolgraph.engine.guard;

import java.util.Map;

/**
 * A compiled edge guard.
 *
 * @param source     the expression as written on the edge
 * @param expression its parsed form
 */
public record Guard(String source, GuardExpression expression) {

    /**
     * @throws GuardSyntaxException if {@code source} is not a valid guard
     */
    public static Guard compile(String source) {
        return new Guard(source, GuardParser.parse(source));
    }

    /**
     * Evaluate against {@code state} and apply truthiness to the result.
     *
     * @throws GuardEvaluationException if evaluation fails
     */
    public boolean test(Map<String, Object> state) {
        return GuardValues.truthy(expression.evaluate(state));
    }
}
