package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class ArrayNode extends Node {
    private final Arguments arguments;

    public ArrayNode(Location location, Arguments arguments) {
        super(location);
        this.arguments = arguments;
    }

    public Arguments arguments() {
        return arguments;
    }

    @Override
    protected String describe() {
        return "[" + arguments.positional().size() + "]";
    }
}
