package com.toolgraph.engine.model;

/**
 * Base for every keyed lookup miss (graph, run, tool). The HTTP layer maps
 * these to 404.
 */
public abstract class NotFoundException extends RuntimeException {

    protected NotFoundException(String message) {
        super(message);
    }
}
