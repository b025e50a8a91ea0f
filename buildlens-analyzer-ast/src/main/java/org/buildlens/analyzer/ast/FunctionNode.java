package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

public final class FunctionNode extends Node {
    private final String name;
    private final Arguments arguments;
    private final int conditionLevel;

    public FunctionNode(Location location, String name, Arguments arguments, int conditionLevel) {
        super(location);
        this.name = name;
        this.arguments = arguments;
        this.conditionLevel = conditionLevel;
    }

    public String name() {
        return name;
    }

    public Arguments arguments() {
        return arguments;
    }

    /**
     * @return the number of <code>if</code> and <code>foreach</code> blocks enclosing this call
     */
    public int conditionLevel() {
        return conditionLevel;
    }

    @Override
    protected String describe() {
        return name + "()";
    }
}
