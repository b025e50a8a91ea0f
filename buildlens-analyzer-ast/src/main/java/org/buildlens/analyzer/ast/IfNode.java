package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

/**
 * One arm of an {@link IfClauseNode}: the condition and the block executed when it holds.
 */
public final class IfNode extends Node {
    private final Node condition;
    private final CodeBlockNode block;

    public IfNode(Location location, Node condition, CodeBlockNode block) {
        super(location);
        this.condition = condition;
        this.block = block;
    }

    public Node condition() {
        return condition;
    }

    public CodeBlockNode block() {
        return block;
    }

    @Override
    protected String describe() {
        return "if";
    }
}
