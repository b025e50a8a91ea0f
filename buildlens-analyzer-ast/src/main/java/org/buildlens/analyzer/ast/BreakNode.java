package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class BreakNode extends Node {

    public BreakNode(Location location) {
        super(location);
    }

    @Override
    protected String describe() {
        return "break";
    }
}
