package com.toolgraph.engine.tool;

/**
 * A tool declared as a Spring bean. ToolRegistry collects every BuiltinTool
 * at startup and registers it under its manifest name.
 */
public interface BuiltinTool extends Tool {

    ToolManifest manifest();
}
