package com.toolgraph.engine.guard;

/**
 * A guard expression is not part of the restricted grammar. Raised at graph
 * registration time so a bad guard never reaches a run.
 */
public class GuardSyntaxException extends RuntimeException {

    public GuardSyntaxException(String message) {
        super(message);
    }
}
