package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class ArithmeticNode extends Node {
    private final ArithmeticOperator operator;
    private final Node left;
    private final Node right;

    public ArithmeticNode(Location location, ArithmeticOperator operator, Node left, Node right) {
        super(location);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public ArithmeticOperator operator() {
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
