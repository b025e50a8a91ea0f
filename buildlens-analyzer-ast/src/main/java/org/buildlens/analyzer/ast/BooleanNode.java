package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class BooleanNode extends Node {
    private final boolean value;

    public BooleanNode(Location location, boolean value) {
        super(location);
        this.value = value;
    }

    public boolean value() {
        return value;
    }

    @Override
    protected String describe() {
        return Boolean.toString(value);
    }
}
