package org.buildlens.analyzer.interpreter.resolve;

import org.buildlens.analyzer.ast.*;
import org.buildlens.analyzer.common.AnalysisBugException;
import org.buildlens.analyzer.common.InvalidCodeException;
import org.buildlens.analyzer.interpreter.graph.DataflowGraph;
import org.buildlens.analyzer.interpreter.value.*;

import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the runtime value of a vertex of the value-flow graph. Identifiers are resolved through their single
 * incoming edge, calls through the results recorded when they were evaluated. Only vertices that have been
 * evaluated can be resolved.
 */
public class ValueResolver {

    private final DataflowGraph graph;
    private final CallResults callResults;
    // one unknown per vertex, so that resolving twice gives equal results
    private final Map<FlowVertex, UnknownValue> synthesized = new IdentityHashMap<>();

    public ValueResolver(DataflowGraph graph, CallResults callResults) {
        this.graph = graph;
        this.callResults = callResults;
    }

    public RuntimeValue resolve(FlowVertex vertex) {
        if (vertex instanceof UnknownValue unknown) return unknown;
        if (vertex instanceof StringNode sn) return new StringValue(sn.value());
        if (vertex instanceof NumberNode nn) return new IntValue(nn.value());
        if (vertex instanceof BooleanNode bn) return BoolValue.of(bn.value());
        if (vertex instanceof FormatStringNode) return unknownFor(vertex);
        if (vertex instanceof IdNode id) return resolveIdentifier(id);
        if (vertex instanceof FunctionNode || vertex instanceof MethodNode) return resolveCall((Node) vertex);
        if (vertex instanceof ArrayNode an) {
            return new ListValue(an.arguments().positional().stream().map(this::resolve).toList());
        }
        if (vertex instanceof DictNode dn) {
            Map<RuntimeValue, RuntimeValue> map = new LinkedHashMap<>();
            for (Arguments.KeywordArgument ka : dn.arguments().keywords()) {
                map.put(resolve(ka.key()), resolve(ka.value()));
            }
            return new DictValue(map);
        }
        if (vertex instanceof ParenthesizedNode pn) return resolve(pn.inner());
        if (vertex instanceof ArithmeticNode an) {
            return stable(an, Operators.arithmetic(an.operator(), resolve(an.left()), resolve(an.right()),
                    an.location()));
        }
        if (vertex instanceof ComparisonNode cn) {
            return stable(cn, Operators.comparison(cn.operator(), resolve(cn.left()), resolve(cn.right()),
                    cn.location()));
        }
        if (vertex instanceof AndNode an) {
            return stable(an, Operators.and(resolve(an.left()), resolve(an.right()), an.location()));
        }
        if (vertex instanceof OrNode on) {
            return stable(on, Operators.or(resolve(on.left()), resolve(on.right()), on.location()));
        }
        if (vertex instanceof NotNode nn) return stable(nn, Operators.not(resolve(nn.value()), nn.location()));
        if (vertex instanceof UMinusNode un) return stable(un, Operators.negate(resolve(un.value()), un.location()));
        if (vertex instanceof TernaryNode tn) {
            RuntimeValue condition = resolve(tn.condition());
            if (condition.isUnknown()) return unknownFor(tn);
            if (condition instanceof Disabler) return Disabler.INSTANCE;
            if (condition instanceof BoolValue b) return resolve(b.value() ? tn.trueBlock() : tn.falseBlock());
            throw new InvalidCodeException("Ternary condition must be a bool, not "
                    + condition.typeName(), tn.location());
        }
        if (vertex instanceof IndexNode in) {
            return stable(in, Operators.index(resolve(in.iobject()), resolve(in.index()), in.location()));
        }
        throw new AnalysisBugException("Cannot resolve " + vertex);
    }

    private UnknownValue unknownFor(FlowVertex vertex) {
        return synthesized.computeIfAbsent(vertex, v -> new UnknownValue());
    }

    private RuntimeValue stable(FlowVertex vertex, RuntimeValue value) {
        return value instanceof UnknownValue ? unknownFor(vertex) : value;
    }

    /*
    flattened values of a list of nodes, as passed to functions
     */
    public List<RuntimeValue> resolveFlattened(List<Node> nodes) {
        return ListValue.flatten(nodes.stream().map(this::resolve).toList());
    }

    private RuntimeValue resolveIdentifier(IdNode id) {
        Set<FlowVertex> sources = graph.sources(id);
        if (sources.size() != 1) {
            throw new AnalysisBugException("Identifier " + id + " has " + sources.size()
                                           + " incoming edges, expected exactly one");
        }
        return resolve(sources.iterator().next());
    }

    private RuntimeValue resolveCall(Node call) {
        FlowVertex forward = callResults.forwardTarget(call);
        if (forward != null) return resolve(forward);
        RuntimeValue value = callResults.value(call);
        if (value == null) throw new AnalysisBugException("Call " + call + " has not been evaluated");
        return value;
    }
}
