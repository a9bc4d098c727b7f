package com.toolgraph.engine.store;

import com.toolgraph.engine.model.GraphDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Keyed storage of graph definitions.
 *
 * Graphs are immutable, so a stored graph can be shared by any number of
 * concurrent runs. Writes to one id are atomic.
 */
public interface GraphStore {

    /**
     * @throws GraphNotFoundException if no graph is stored under {@code graphId}
     */
    GraphDefinition get(String graphId);

    Optional<GraphDefinition> find(String graphId);

    /** Store (or replace) {@code graph} under its own id and return that id. */
    String put(GraphDefinition graph);

    /** Ids of all stored graphs (sorted). */
    List<String> ids();
}
