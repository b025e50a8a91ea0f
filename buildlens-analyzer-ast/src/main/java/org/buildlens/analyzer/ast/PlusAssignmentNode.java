package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class PlusAssignmentNode extends Node {
    private final String variableName;
    private final Node value;

    public PlusAssignmentNode(Location location, String variableName, Node value) {
        super(location);
        this.variableName = variableName;
        this.value = value;
    }

    public String variableName() {
        return variableName;
    }

    public Node value() {
        return value;
    }

    @Override
    protected String describe() {
        return variableName + " +=";
    }
}
