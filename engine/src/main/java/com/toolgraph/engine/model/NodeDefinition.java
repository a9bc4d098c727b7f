package com.toolgraph.engine.model;

import java.util.Map;

/**
 * One unit of work in a graph: a node bound to a named tool.
 *
 * @param id       Unique identifier within the owning graph.
 * @param toolName Name the tool is registered under in the ToolRegistry.
 * @param config   Opaque per-node configuration; never interpreted by the engine.
 */
public record NodeDefinition(String id, String toolName, Map<String, Object> config) {

    public NodeDefinition {
        config = config == null ? Map.of() : StateCopier.freeze(config);
    }

    public NodeDefinition(String id, String toolName) {
        this(id, toolName, Map.of());
    }
}
