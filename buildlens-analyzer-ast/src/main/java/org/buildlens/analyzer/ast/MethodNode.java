package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class MethodNode extends Node {
    private final Node sourceObject;
    private final String name;
    private final Arguments arguments;

    public MethodNode(Location location, Node sourceObject, String name, Arguments arguments) {
        super(location);
        this.sourceObject = sourceObject;
        this.name = name;
        this.arguments = arguments;
    }

    public Node sourceObject() {
        return sourceObject;
    }

    public String name() {
        return name;
    }

    public Arguments arguments() {
        return arguments;
    }

    @Override
    protected String describe() {
        return "." + name + "()";
    }
}
