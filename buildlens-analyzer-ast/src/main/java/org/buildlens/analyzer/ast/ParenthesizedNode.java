package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class ParenthesizedNode extends Node {
    private final Node inner;

    public ParenthesizedNode(Location location, Node inner) {
        super(location);
        this.inner = inner;
    }

    public Node inner() {
        return inner;
    }

    @Override
    protected String describe() {
        return "()";
    }
}
