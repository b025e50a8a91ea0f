package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class AndNode extends Node {
    private final Node left;
    private final Node right;

    public AndNode(Location location, Node left, Node right) {
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
        return "and";
    }
}
