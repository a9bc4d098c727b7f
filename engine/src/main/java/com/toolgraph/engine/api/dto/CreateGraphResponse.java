package com.toolgraph.engine.api.dto;

/** Response body for POST /graph/create. */
public record CreateGraphResponse(String graphId) {}
