package org.buildlens.analyzer.interpreter.value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public record ListValue(List<RuntimeValue> elements) implements RuntimeValue {
    public static final ListValue EMPTY = new ListValue(List.of());

    public ListValue {
        elements = List.copyOf(elements);
    }

    public static ListValue of(RuntimeValue... values) {
        return new ListValue(List.of(values));
    }

    public int size() {
        return elements.size();
    }

    public RuntimeValue get(int i) {
        return elements.get(i);
    }

    public ListValue append(RuntimeValue value) {
        return new ListValue(Stream.concat(elements.stream(), Stream.of(value)).toList());
    }

    public ListValue prepend(RuntimeValue value) {
        return new ListValue(Stream.concat(Stream.of(value), elements.stream()).toList());
    }

    public ListValue concat(ListValue other) {
        return new ListValue(Stream.concat(elements.stream(), other.elements.stream()).toList());
    }

    /*
    nested lists are spliced into the result, at any depth; non-list values become a singleton list
     */
    public static List<RuntimeValue> flatten(RuntimeValue value) {
        List<RuntimeValue> result = new ArrayList<>();
        flatten(value, result);
        return result;
    }

    public static List<RuntimeValue> flatten(List<RuntimeValue> values) {
        List<RuntimeValue> result = new ArrayList<>();
        values.forEach(v -> flatten(v, result));
        return result;
    }

    private static void flatten(RuntimeValue value, List<RuntimeValue> result) {
        if (value instanceof ListValue lv) {
            lv.elements.forEach(v -> flatten(v, result));
        } else {
            result.add(value);
        }
    }

    @Override
    public String typeName() {
        return "list";
    }

    @Override
    public boolean isPrimitive() {
        return true;
    }

    @Override
    public String toString() {
        return elements.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
