package com.toolgraph.engine.store;

import com.toolgraph.engine.model.NotFoundException;

public class GraphNotFoundException extends NotFoundException {
    public GraphNotFoundException(String graphId) {
        super("Graph not found: '" + graphId + "'");
    }
}
