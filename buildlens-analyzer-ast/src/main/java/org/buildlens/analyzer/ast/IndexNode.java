package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class IndexNode extends Node {
    private final Node iobject;
    private final Node index;

    public IndexNode(Location location, Node iobject, Node index) {
        super(location);
        this.iobject = iobject;
        this.index = index;
    }

    public Node iobject() {
        return iobject;
    }

    public Node index() {
        return index;
    }

    @Override
    protected String describe() {
        return "[]";
    }
}
