package com.toolgraph.engine.tool;

/**
 * Thrown by ToolRegistry.run() when a tool invocation does not yield a usable
 * state update.
 *
 * Unchecked: the engine catches it at the step boundary and turns it into a
 * FAILED run; nothing else needs to.
 */
public class ToolException extends RuntimeException {

    public enum Kind { EXECUTION_ERROR, TIMEOUT, INVALID_RESULT, INTERRUPTED }

    private final String toolName;
    private final Kind   kind;

    public ToolException(String toolName, Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.toolName = toolName;
        this.kind     = kind;
    }

    public ToolException(String toolName, Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.toolName = toolName;
        this.kind     = kind;
    }

    public String getToolName() { return toolName; }
    public Kind   getKind()     { return kind; }
}
