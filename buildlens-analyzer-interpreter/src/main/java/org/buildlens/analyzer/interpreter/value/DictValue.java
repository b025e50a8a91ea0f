package org.buildlens.analyzer.interpreter.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/*
insertion order is kept for printing; equality does not depend on it
 */
public record DictValue(Map<RuntimeValue, RuntimeValue> entries) implements RuntimeValue {

    public DictValue {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public RuntimeValue get(RuntimeValue key) {
        return entries.get(key);
    }

    public boolean containsKey(RuntimeValue key) {
        return entries.containsKey(key);
    }

    // right-biased: on equal keys, the value of the argument wins
    public DictValue union(DictValue other) {
        Map<RuntimeValue, RuntimeValue> map = new LinkedHashMap<>(entries);
        map.putAll(other.entries);
        return new DictValue(map);
    }

    @Override
    public String typeName() {
        return "dict";
    }

    @Override
    public boolean isPrimitive() {
        return true;
    }

    @Override
    public String toString() {
        return entries.entrySet().stream().map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
