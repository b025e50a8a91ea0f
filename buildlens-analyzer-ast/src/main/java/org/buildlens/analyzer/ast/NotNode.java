package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class NotNode extends Node {
    private final Node value;

    public NotNode(Location location, Node value) {
        super(location);
        this.value = value;
    }

    public Node value() {
        return value;
    }

    @Override
    protected String describe() {
        return "not";
    }
}
