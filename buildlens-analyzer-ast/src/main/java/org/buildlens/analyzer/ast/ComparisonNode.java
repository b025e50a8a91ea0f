package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class ComparisonNode extends Node {
    private final ComparisonOperator operator;
    private final Node left;
    private final Node right;

    public ComparisonNode(Location location, ComparisonOperator operator, Node left, Node right) {
        super(location);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public ComparisonOperator operator() {
        return operator;
    }

    public Node left() {
        return left;
    }

    public Node right() {
        return right;
    }

    @Override
    protected String describe() {
        return operator.symbol();
    }
}
