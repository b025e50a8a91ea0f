package org.buildlens.analyzer.ast;

import org.buildlens.analyzer.common.Location;

import java.util.Objects;

/**
 * Closed hierarchy of the nodes of a build file. Nodes are immutable, and compared by identity:
 * two identical literals at different positions are different nodes.
 */
public abstract sealed class Node implements FlowVertex
        permits AndNode, ArithmeticNode, ArrayNode, AssignmentNode, BooleanNode, BreakNode, CodeBlockNode,
        ComparisonNode, ContinueNode, DictNode, ForeachClauseNode, FormatStringNode, FunctionNode, IdNode,
        IfClauseNode, IfNode, IndexNode, MethodNode, NotNode, NumberNode, OrNode, ParenthesizedNode,
        PlusAssignmentNode, StringNode, TernaryNode, UMinusNode {

    private final Location location;

    protected Node(Location location) {
        this.location = Objects.requireNonNull(location);
    }

    public Location location() {
        return location;
    }

    /*
    short description, used in log messages and in the toString of the graph
     */
    protected abstract String describe();

    @Override
    public final String toString() {
        return describe() + "@" + location.compact();
    }
}
