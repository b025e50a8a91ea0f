package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class StringNode extends Node {
    private final String value;

    public StringNode(Location location, String value) {
        super(location);
        this.value = value;
    }

    public String value() {
        return value;
    }

    @Override
    protected String describe() {
        return "'" + value + "'";
    }
}
