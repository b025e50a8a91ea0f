package org.buildlens.analyzer.interpreter.graph;

import org.buildlens.analyzer.ast.FlowVertex;

import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Directed value-flow graph: an edge <code>a -&gt; b</code> means that the value of <code>b</code> depends on,
 * or is obtained from, <code>a</code>. Vertices are syntax nodes and unknown values, both compared by identity.
 * Edges are never removed.
 */
public interface DataflowGraph {

    int size();

    boolean isEmpty();

    void addEdge(FlowVertex source, FlowVertex target);

    Set<FlowVertex> sources(FlowVertex target);

    Set<FlowVertex> targets(FlowVertex source);

    void visit(BiConsumer<FlowVertex, Set<FlowVertex>> consumer);

    /**
     * The seeds, plus all vertices reachable from them. In the forward direction, the search does not continue
     * past a call that is opaque to value flow; in the reverse direction, such calls are not entered at all.
     *
     * @param seeds   start vertices; they are always part of the result
     * @param reverse follow the edges backwards
     */
    Set<FlowVertex> reachable(Set<FlowVertex> seeds, boolean reverse);

    /**
     * All simple paths from source to target, each including both end points. Like forward reachability, paths
     * do not continue past an opaque call.
     */
    List<List<FlowVertex>> findAllPaths(FlowVertex source, FlowVertex target);
}
