package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class TernaryNode extends Node {
    private final Node condition;
    private final Node trueBlock;
    private final Node falseBlock;

    public TernaryNode(Location location, Node condition, Node trueBlock, Node falseBlock) {
        super(location);
        this.condition = condition;
        this.trueBlock = trueBlock;
        this.falseBlock = falseBlock;
    }

    public Node condition() {
        return condition;
    }

    public Node trueBlock() {
        return trueBlock;
    }

    public Node falseBlock() {
        return falseBlock;
    }

    @Override
    protected String describe() {
        return "?:";
    }
}
