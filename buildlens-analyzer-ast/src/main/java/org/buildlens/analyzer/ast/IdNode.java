package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class IdNode extends Node {
    private final String name;

    public IdNode(Location location, String name) {
        super(location);
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    protected String describe() {
        return name;
    }
}
