package com.toolgraph.engine.service;

import com.toolgraph.engine.model.RunStatus;

public class RunAlreadyFinishedException extends RuntimeException {
    public RunAlreadyFinishedException(String runId, RunStatus status) {
        super("Run '" + runId + "' already finished with status " + status);
    }
}
