package org.buildlens.analyzer.interpreter.scope;

import org.buildlens.analyzer.ast.*;
import org.buildlens.analyzer.common.AnalysisBugException;

import java.util.LinkedHashSet;
import java.util.Set;

/*
Syntactic scan for the variables a subtree may assign: assignment targets and loop variables, at any depth.
Calls to set_variable() are not seen; their name is only known after evaluation.
 */
public final class PotentialWrites {

    private PotentialWrites() {
    }

    public static Set<String> of(Node node) {
        Set<String> result = new LinkedHashSet<>();
        collect(node, result);
        return result;
    }

    private static void collect(Node node, Set<String> result) {
        if (node == null) return;
        if (node instanceof AssignmentNode a) {
            result.add(a.variableName());
            collect(a.value(), result);
        } else if (node instanceof PlusAssignmentNode pa) {
            result.add(pa.variableName());
            collect(pa.value(), result);
        } else if (node instanceof ForeachClauseNode f) {
            result.addAll(f.variableNames());
            collect(f.block(), result);
        } else if (node instanceof CodeBlockNode b) {
            b.lines().forEach(l -> collect(l, result));
        } else if (node instanceof IfClauseNode ic) {
            ic.ifs().forEach(i -> collect(i, result));
            collect(ic.elseBlock(), result);
        } else if (node instanceof IfNode i) {
            collect(i.condition(), result);
            collect(i.block(), result);
        } else if (node instanceof FunctionNode fn) {
            collectArguments(fn.arguments(), result);
        } else if (node instanceof MethodNode mn) {
            collect(mn.sourceObject(), result);
            collectArguments(mn.arguments(), result);
        } else if (node instanceof ArrayNode an) {
            collectArguments(an.arguments(), result);
        } else if (node instanceof DictNode dn) {
            collectArguments(dn.arguments(), result);
        } else if (node instanceof ArithmeticNode an) {
            collect(an.left(), result);
            collect(an.right(), result);
        } else if (node instanceof ComparisonNode cn) {
            collect(cn.left(), result);
            collect(cn.right(), result);
        } else if (node instanceof AndNode an) {
            collect(an.left(), result);
            collect(an.right(), result);
        } else if (node instanceof OrNode on) {
            collect(on.left(), result);
            collect(on.right(), result);
        } else if (node instanceof NotNode nn) {
            collect(nn.value(), result);
        } else if (node instanceof UMinusNode un) {
            collect(un.value(), result);
        } else if (node instanceof ParenthesizedNode pn) {
            collect(pn.inner(), result);
        } else if (node instanceof TernaryNode tn) {
            collect(tn.condition(), result);
            collect(tn.trueBlock(), result);
            collect(tn.falseBlock(), result);
        } else if (node instanceof IndexNode in) {
            collect(in.iobject(), result);
            collect(in.index(), result);
        } else if (!(node instanceof IdNode || node instanceof StringNode || node instanceof NumberNode
                     || node instanceof BooleanNode || node instanceof FormatStringNode
                     || node instanceof BreakNode || node instanceof ContinueNode)) {
            throw new AnalysisBugException("Unhandled node type " + node.getClass().getSimpleName());
        }
    }

    private static void collectArguments(Arguments arguments, Set<String> result) {
        arguments.valueStream().forEach(n -> collect(n, result));
    }
}
