package org.buildlens.analyzer.interpreter.graph;

import org.buildlens.analyzer.ast.*;
import org.buildlens.analyzer.common.Location;
import org.buildlens.analyzer.interpreter.graph.impl.DataflowGraphImpl;
import org.buildlens.analyzer.interpreter.value.UnknownValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestDataflowGraph {

    private static FunctionNode call(String name) {
        return new FunctionNode(Location.UNKNOWN, name, Arguments.EMPTY, 0);
    }

    @Test
    public void testEdges() {
        DataflowGraph graph = new DataflowGraphImpl();
        assertTrue(graph.isEmpty());
        UnknownValue a = new UnknownValue();
        UnknownValue b = new UnknownValue();
        graph.addEdge(a, b);
        graph.addEdge(a, b);
        assertEquals(Set.of(b), graph.targets(a));
        assertEquals(Set.of(a), graph.sources(b));
        assertEquals(Set.of(), graph.sources(a));
        assertEquals(2, graph.size());
    }

    @Test
    public void testReachableStopsAtOpaqueCalls() {
        DataflowGraph graph = new DataflowGraphImpl();
        StringNode source = new StringNode(Location.UNKNOWN, "a.c");
        FunctionNode files = call("files");
        FunctionNode opaque = call("executable");
        MethodNode method = new MethodNode(Location.UNKNOWN, source, "strip", Arguments.EMPTY);
        UnknownValue afterOpaque = new UnknownValue();
        UnknownValue afterFiles = new UnknownValue();
        UnknownValue afterMethod = new UnknownValue();
        graph.addEdge(source, files);
        graph.addEdge(files, afterFiles);
        graph.addEdge(afterFiles, opaque);
        graph.addEdge(opaque, afterOpaque);
        graph.addEdge(source, method);
        graph.addEdge(method, afterMethod);

        Set<FlowVertex> forward = graph.reachable(Set.of(source), false);
        assertEquals(Set.of(source, files, afterFiles, opaque, method), forward);

        Set<FlowVertex> backward = graph.reachable(Set.of(afterOpaque), true);
        assertEquals(Set.of(afterOpaque), backward);
        assertEquals(Set.of(afterFiles, files, source), graph.reachable(Set.of(afterFiles), true));

        assertEquals(List.of(List.of(source, files, afterFiles, opaque)), graph.findAllPaths(source, opaque));
        assertTrue(graph.findAllPaths(source, afterOpaque).isEmpty());
        assertTrue(graph.findAllPaths(source, afterMethod).isEmpty());
    }

    @Test
    public void testAllPaths() {
        DataflowGraph graph = new DataflowGraphImpl();
        UnknownValue a = new UnknownValue();
        UnknownValue b = new UnknownValue();
        UnknownValue c = new UnknownValue();
        UnknownValue d = new UnknownValue();
        graph.addEdge(a, b);
        graph.addEdge(a, c);
        graph.addEdge(b, d);
        graph.addEdge(c, d);
        graph.addEdge(d, a); // a cycle must not make the enumeration loop
        List<List<FlowVertex>> paths = graph.findAllPaths(a, d);
        assertEquals(2, paths.size());
        assertTrue(paths.contains(List.of(a, b, d)));
        assertTrue(paths.contains(List.of(a, c, d)));
        assertEquals(List.of(List.of(a)), graph.findAllPaths(a, a));
        assertEquals(List.of(List.of(b, d, a, c)), graph.findAllPaths(b, c));
        assertTrue(graph.findAllPaths(d, new UnknownValue()).isEmpty());
    }
}
