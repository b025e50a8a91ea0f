package org.buildlens.analyzer.interpreter.value;

import org.buildlens.analyzer.ast.FlowVertex;

/**
 * A value that exists at runtime but cannot be determined statically. Every instance is a distinct
 * vertex in the value-flow graph: a merge of definitions at a control-flow join is a fresh instance.
 */
public final class UnknownValue implements RuntimeValue, FlowVertex {

    @Override
    public String typeName() {
        return "unknown";
    }

    @Override
    public boolean isUnknown() {
        return true;
    }

    @Override
    public String toString() {
        return "Unknown#" + Integer.toHexString(System.identityHashCode(this));
    }
}
