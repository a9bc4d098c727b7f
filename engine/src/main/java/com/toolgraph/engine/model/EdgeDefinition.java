package com.toolgraph.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Directed transition between two nodes.
 *
 * @param source    Node id the edge leaves from.
 * @param target    Node id the edge leads to.
 * @param condition Optional guard expression over run state, e.g.
 *                  {@code state.get('quality_score', 0) < state.get('threshold', 80)}.
 *                  Null or blank means the edge is an unconditional default.
 */
public record EdgeDefinition(String source, String target, String condition) {

    public EdgeDefinition {
        if (condition != null && condition.isBlank()) condition = null;
    }

    public EdgeDefinition(String source, String target) {
        this(source, target, null);
    }

    @JsonIgnore
    public boolean isUnconditional() { return condition == null; }
}
