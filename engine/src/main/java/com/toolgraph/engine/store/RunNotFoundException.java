package com.toolgraph.engine.store;

import com.toolgraph.engine.model.NotFoundException;

public class RunNotFoundException extends NotFoundException {
    public RunNotFoundException(String runId) {
        super("Run not found: '" + runId + "'");
    }
}
