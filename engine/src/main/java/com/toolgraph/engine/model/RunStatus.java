package com.toolgraph.engine.model;

/**
 * Lifecycle of a single graph run.
 *
 * Transitions:
 *   PENDING → RUNNING   (engine starts stepping)
 *   RUNNING → COMPLETED (a node had no matching outgoing edge)
 *   RUNNING → FAILED    (missing node, tool failure or step limit, see FailureReason)
 *   RUNNING → CANCELLED (cancellation signal observed between steps)
 *
 * COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
