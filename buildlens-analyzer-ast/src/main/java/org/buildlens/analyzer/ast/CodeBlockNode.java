package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

import java.util.List;

public final class CodeBlockNode extends Node {
    private final List<Node> lines;

    public CodeBlockNode(Location location, List<Node> lines) {
        super(location);
        this.lines = List.copyOf(lines);
    }

    public List<Node> lines() {
        return lines;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    @Override
    protected String describe() {
        return "block[" + lines.size() + "]";
    }
}
