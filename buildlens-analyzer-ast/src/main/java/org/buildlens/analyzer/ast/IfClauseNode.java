package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

import java.util.List;

public final class IfClauseNode extends Node {
    private final List<IfNode> ifs;
    private final CodeBlockNode elseBlock;

    public IfClauseNode(Location location, List<IfNode> ifs, CodeBlockNode elseBlock) {
        super(location);
        if (ifs.isEmpty()) throw new IllegalArgumentException("An if clause needs at least one arm");
        this.ifs = List.copyOf(ifs);
        this.elseBlock = elseBlock;
    }

    // the if arm followed by the elif arms
    public List<IfNode> ifs() {
        return ifs;
    }

    /**
     * @return the else block, or <code>null</code> when there is no else arm
     */
    public CodeBlockNode elseBlock() {
        return elseBlock;
    }

    @Override
    protected String describe() {
        return "if[" + ifs.size() + (elseBlock == null ? "" : "+else") + "]";
    }
}
