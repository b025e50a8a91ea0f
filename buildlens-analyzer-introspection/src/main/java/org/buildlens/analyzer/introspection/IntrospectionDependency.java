package org.buildlens.analyzer.introspection;

import org.buildlens.analyzer.ast.FunctionNode;
import org.buildlens.analyzer.interpreter.value.AnalysisRecord;
import org.buildlens.analyzer.interpreter.value.RuntimeValue;

import java.util.List;

/**
 * A call to <code>dependency()</code> whose name is known.
 *
 * @param required    a bool, or unknown when computed at runtime
 * @param conditional whether the call is inside an <code>if</code> or <code>foreach</code>
 */
public record IntrospectionDependency(String name,
                                      RuntimeValue required,
                                      List<RuntimeValue> versionConstraints,
                                      boolean hasFallback,
                                      boolean conditional,
                                      FunctionNode node) implements AnalysisRecord {

    public IntrospectionDependency {
        versionConstraints = List.copyOf(versionConstraints);
    }

    @Override
    public String typeName() {
        return "dep";
    }

    @Override
    public String toString() {
        return "dependency(" + name + ")";
    }
}
