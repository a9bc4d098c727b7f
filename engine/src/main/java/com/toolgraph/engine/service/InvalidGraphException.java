package com.toolgraph.engine.service;

import java.util.List;

/**
 * A graph definition was rejected at registration. Carries every problem
 * found, not just the first.
 */
public class InvalidGraphException extends RuntimeException {

    private final List<String> problems;

    public InvalidGraphException(List<String> problems) {
        super("Invalid graph: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() { return problems; }
}
