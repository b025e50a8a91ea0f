package org.buildlens.analyzer.interpreter.scope;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Position in the nesting of conditionals: one component per enclosing <code>if</code>, holding the index of
 * the arm being evaluated. A loop body does not add a component.
 */
public record NestingPath(List<Integer> list) {
    public static final NestingPath ROOT = new NestingPath(List.of());

    public NestingPath {
        list = List.copyOf(list);
    }

    public static NestingPath of(Integer... indices) {
        return new NestingPath(List.of(indices));
    }

    public int depth() {
        return list.size();
    }

    public NestingPath push(int index) {
        List<Integer> newList = new ArrayList<>(list.size() + 1);
        newList.addAll(list);
        newList.add(index);
        return new NestingPath(newList);
    }

    public NestingPath pop() {
        if (list.isEmpty()) throw new UnsupportedOperationException("Cannot pop the root");
        return new NestingPath(list.subList(0, list.size() - 1));
    }

    public NestingPath replaceLast(int v) {
        if (list.isEmpty()) throw new UnsupportedOperationException("Root has no last component");
        List<Integer> newList = new ArrayList<>(list);
        newList.set(list.size() - 1, v);
        return new NestingPath(newList);
    }

    public NestingPath incrementLast() {
        return replaceLast(list.get(list.size() - 1) + 1);
    }

    public boolean isPrefixOf(NestingPath other) {
        return list.size() <= other.list.size() && other.list.subList(0, list.size()).equals(list);
    }

    @Override
    public String toString() {
        if (list.isEmpty()) return "-";
        return list.stream().map(Object::toString).collect(Collectors.joining("."));
    }
}
