package org.buildlens.analyzer.introspection;

import org.buildlens.analyzer.ast.FunctionNode;
import org.buildlens.analyzer.ast.Node;
import org.buildlens.analyzer.interpreter.value.AnalysisRecord;
import org.buildlens.analyzer.interpreter.value.RuntimeValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A declared build target. Next to what is known about it, it holds the nodes of the declaration, so that tools
 * can find, and edit, the sources of the target.
 *
 * @param sourceNodes the positional arguments after the name, followed by the value of <code>sources:</code>
 * @param extraFiles  the value of <code>extra_files:</code>, or <code>null</code>
 */
public record IntrospectionBuildTarget(String name,
                                       String id,
                                       TargetType type,
                                       String definedIn,
                                       String subdir,
                                       boolean buildByDefault,
                                       boolean installed,
                                       List<String> outputs,
                                       List<Node> sourceNodes,
                                       Node extraFiles,
                                       Map<String, RuntimeValue> kwargs,
                                       FunctionNode node) implements AnalysisRecord {

    public IntrospectionBuildTarget {
        outputs = List.copyOf(outputs);
        sourceNodes = List.copyOf(sourceNodes);
        kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    @Override
    public String typeName() {
        return "build_tgt";
    }

    @Override
    public String toString() {
        return type.typename() + "(" + name + ")";
    }
}
