package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class NumberNode extends Node {
    private final long value;

    public NumberNode(Location location, long value) {
        super(location);
        this.value = value;
    }

    public long value() {
        return value;
    }

    @Override
    protected String describe() {
        return Long.toString(value);
    }
}
