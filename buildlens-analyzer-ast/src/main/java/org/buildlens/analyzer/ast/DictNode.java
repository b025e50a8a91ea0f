package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class DictNode extends Node {
    private final Arguments arguments;

    public DictNode(Location location, Arguments arguments) {
        super(location);
        this.arguments = arguments;
    }

    // only keywords are used
    public Arguments arguments() {
        return arguments;
    }

    @Override
    protected String describe() {
        return "{" + arguments.keywords().size() + "}";
    }
}
