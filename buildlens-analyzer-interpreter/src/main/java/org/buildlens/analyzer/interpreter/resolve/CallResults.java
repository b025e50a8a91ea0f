package org.buildlens.analyzer.interpreter.resolve;

import org.buildlens.analyzer.ast.FlowVertex;
import org.buildlens.analyzer.ast.Node;
import org.buildlens.analyzer.interpreter.value.RuntimeValue;

import java.util.HashMap;
import java.util.Map;

/*
Results of the function and method calls evaluated so far. A call can either have produced a value,
or forward to another vertex whose value it passes through (get_variable).
 */
public class CallResults {
    private final Map<Node, RuntimeValue> values = new HashMap<>();
    private final Map<Node, FlowVertex> forwards = new HashMap<>();

    public void put(Node call, RuntimeValue value) {
        values.put(call, value);
    }

    public void forward(Node call, FlowVertex target) {
        forwards.put(call, target);
    }

    public RuntimeValue value(Node call) {
        return values.get(call);
    }

    public FlowVertex forwardTarget(Node call) {
        return forwards.get(call);
    }

    public boolean isEvaluated(Node call) {
        return values.containsKey(call) || forwards.containsKey(call);
    }
}
