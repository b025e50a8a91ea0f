package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class ContinueNode extends Node {

    public ContinueNode(Location location) {
        super(location);
    }

    @Override
    protected String describe() {
        return "continue";
    }
}
