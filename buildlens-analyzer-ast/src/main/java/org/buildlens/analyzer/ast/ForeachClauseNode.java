package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

import java.util.List;

public final class ForeachClauseNode extends Node {
    private final List<String> variableNames;
    private final Node items;
    private final CodeBlockNode block;

    public ForeachClauseNode(Location location, List<String> variableNames, Node items, CodeBlockNode block) {
        super(location);
        this.variableNames = List.copyOf(variableNames);
        this.items = items;
        this.block = block;
    }

    // one name when iterating over a list, two (key, value) for a dict
    public List<String> variableNames() {
        return variableNames;
    }

    public Node items() {
        return items;
    }

    public CodeBlockNode block() {
        return block;
    }

    @Override
    protected String describe() {
        return "foreach " + String.join(", ", variableNames);
    }
}
