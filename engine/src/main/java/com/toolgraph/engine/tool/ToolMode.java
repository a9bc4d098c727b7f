package com.toolgraph.engine.tool;

/**
 * How a tool's run() produces its result.
 *
 * IMMEDIATE: computes on the calling thread; the returned stage is already
 * complete. Used for pure in-memory work such as the code-review heuristics.
 *
 * SUSPENDING: returns a stage that completes later, typically after I/O on
 * another thread. The engine waits for it on the run's own worker thread, so
 * other runs keep progressing.
 */
public enum ToolMode {
    IMMEDIATE,
    SUSPENDING
}
