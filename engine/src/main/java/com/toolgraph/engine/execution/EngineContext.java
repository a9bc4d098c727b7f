package com.toolgraph.engine.execution;

import com.toolgraph.engine.store.GraphStore;
import com.toolgraph.engine.store.RunStore;
import com.toolgraph.engine.tool.ToolRegistry;

import java.util.Objects;

/**
 * Collaborators an engine execution works against, passed in per call so
 * tests can run the engine over private stores and registries.
 */
public record EngineContext(GraphStore graphStore, RunStore runStore, ToolRegistry toolRegistry) {

    public EngineContext {
        Objects.requireNonNull(graphStore, "graphStore");
        Objects.requireNonNull(runStore, "runStore");
        Objects.requireNonNull(toolRegistry, "toolRegistry");
    }
}
