package com.containerkit.engine.error;

public class ToolNotFoundException extends EngineException {
    public ToolNotFoundException(String name) {
        super(Kind.NOT_FOUND, "No tool registered with name: '" + name + "'");
    }
}
