package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

/**
 * <code>f'...@var@...'</code>; the placeholders are substituted at configure time only.
 */
public final class FormatStringNode extends Node {
    private final String value;

    public FormatStringNode(Location location, String value) {
        super(location);
        this.value = value;
    }

    public String value() {
        return value;
    }

    @Override
    protected String describe() {
        return "f'" + value + "'";
    }
}
