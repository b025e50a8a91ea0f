package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class OrNode extends Node {
    private final Node left;
    private final Node right;

    public OrNode(Location location, Node left, Node right) {
        super(location);
        this.left = left;
        this.right = right;
    }

    public Node left() {
        return left;
    }

    public Node right() {
        return right;
    }

    @Override
    protected String describe() {
        return "or";
    }
}
