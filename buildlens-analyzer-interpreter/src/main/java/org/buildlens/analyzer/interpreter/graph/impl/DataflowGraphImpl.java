package org.buildlens.analyzer.interpreter.graph.impl;

import org.buildlens.analyzer.ast.FlowVertex;
import org.buildlens.analyzer.ast.FunctionNode;
import org.buildlens.analyzer.ast.MethodNode;
import org.buildlens.analyzer.interpreter.graph.DataflowGraph;

import java.util.*;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

public class DataflowGraphImpl implements DataflowGraph {

    /*
    values flow through files() and get_variable(); any other function or method call produces something new
     */
    public static final Set<String> TRANSPARENT_FUNCTIONS = Set.of("files", "get_variable");
    public static final Predicate<FlowVertex> OPAQUE_CALL = v ->
            v instanceof FunctionNode fn && !TRANSPARENT_FUNCTIONS.contains(fn.name()) || v instanceof MethodNode;

    private final Map<FlowVertex, Set<FlowVertex>> forward = new LinkedHashMap<>();
    private final Map<FlowVertex, Set<FlowVertex>> backward = new LinkedHashMap<>();
    private final Predicate<FlowVertex> boundary;

    public DataflowGraphImpl() {
        this(OPAQUE_CALL);
    }

    public DataflowGraphImpl(Predicate<FlowVertex> boundary) {
        this.boundary = boundary;
    }

    @Override
    public int size() {
        Set<FlowVertex> vertices = new HashSet<>(forward.keySet());
        vertices.addAll(backward.keySet());
        return vertices.size();
    }

    @Override
    public boolean isEmpty() {
        return forward.isEmpty();
    }

    @Override
    public void addEdge(FlowVertex source, FlowVertex target) {
        Objects.requireNonNull(source);
        Objects.requireNonNull(target);
        forward.computeIfAbsent(source, v -> new LinkedHashSet<>()).add(target);
        backward.computeIfAbsent(target, v -> new LinkedHashSet<>()).add(source);
    }

    @Override
    public Set<FlowVertex> sources(FlowVertex target) {
        return Collections.unmodifiableSet(backward.getOrDefault(target, Set.of()));
    }

    @Override
    public Set<FlowVertex> targets(FlowVertex source) {
        return Collections.unmodifiableSet(forward.getOrDefault(source, Set.of()));
    }

    @Override
    public void visit(BiConsumer<FlowVertex, Set<FlowVertex>> consumer) {
        forward.forEach((v, targets) -> consumer.accept(v, Collections.unmodifiableSet(targets)));
    }

    @Override
    public Set<FlowVertex> reachable(Set<FlowVertex> seeds, boolean reverse) {
        Set<FlowVertex> visited = new LinkedHashSet<>(seeds);
        Deque<FlowVertex> toDo = new ArrayDeque<>(seeds);
        while (!toDo.isEmpty()) {
            FlowVertex v = toDo.pop();
            if (reverse) {
                for (FlowVertex source : backward.getOrDefault(v, Set.of())) {
                    if (!boundary.test(source) && visited.add(source)) {
                        toDo.push(source);
                    }
                }
            } else if (!boundary.test(v)) {
                for (FlowVertex target : forward.getOrDefault(v, Set.of())) {
                    if (visited.add(target)) {
                        toDo.push(target);
                    }
                }
            }
        }
        return visited;
    }

    @Override
    public List<List<FlowVertex>> findAllPaths(FlowVertex source, FlowVertex target) {
        List<List<FlowVertex>> result = new ArrayList<>();
        Deque<List<FlowVertex>> stack = new ArrayDeque<>();
        stack.push(List.of(source));
        while (!stack.isEmpty()) {
            List<FlowVertex> path = stack.pop();
            FlowVertex last = path.get(path.size() - 1);
            if (last == target) {
                result.add(path);
                continue;
            }
            if (boundary.test(last)) continue;
            for (FlowVertex next : forward.getOrDefault(last, Set.of())) {
                if (!containsIdentity(path, next)) {
                    List<FlowVertex> extended = new ArrayList<>(path.size() + 1);
                    extended.addAll(path);
                    extended.add(next);
                    stack.push(List.copyOf(extended));
                }
            }
        }
        return result;
    }

    private static boolean containsIdentity(List<FlowVertex> path, FlowVertex v) {
        for (FlowVertex p : path) {
            if (p == v) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return forward.entrySet().stream()
                .map(e -> e.getKey() + " -> " + e.getValue().stream().map(Object::toString)
                        .collect(Collectors.joining(", ", "[", "]")))
                .sorted()
                .collect(Collectors.joining("\n"));
    }
}
