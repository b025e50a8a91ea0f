package org.buildlens.analyzer.interpreter;

import org.buildlens.analyzer.ast.FunctionNode;
import org.buildlens.analyzer.interpreter.value.RuntimeValue;

import java.util.List;
import java.util.Map;

/**
 * Handler for a function of the build language.
 */
@FunctionalInterface
public interface FunctionHandler {

    /**
     * @param node   the call being evaluated; its arguments have been evaluated already
     * @param args   resolved positional arguments, with nested lists flattened
     * @param kwargs resolved keyword arguments, in declaration order
     * @return the value of the call; <code>null</code> is read as unknown
     */
    RuntimeValue call(FunctionNode node, List<RuntimeValue> args, Map<String, RuntimeValue> kwargs);
}
