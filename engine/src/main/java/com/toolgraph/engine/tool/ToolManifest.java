package com.toolgraph.engine.tool;

/**
 * Identity and documentation for a tool shipped with the application.
 *
 * @param name        Registry key; what a node's toolName refers to (e.g. "check_complexity").
 * @param version     Semantic version of the tool's behaviour.
 * @param description One sentence listing the state keys read and written.
 */
public record ToolManifest(String name, String version, String description) {}
