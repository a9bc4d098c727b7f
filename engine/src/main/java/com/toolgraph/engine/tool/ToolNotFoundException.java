package com.toolgraph.engine.tool;

import com.toolgraph.engine.model.NotFoundException;

public class ToolNotFoundException extends NotFoundException {
    public ToolNotFoundException(String name) {
        super("No tool registered with name: '" + name + "'");
    }
}
