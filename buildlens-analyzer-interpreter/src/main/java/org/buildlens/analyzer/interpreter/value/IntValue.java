package org.buildlens.analyzer.interpreter.value;

public record IntValue(long value) implements RuntimeValue {

    @Override
    public String typeName() {
        return "int";
    }

    @Override
    public boolean isPrimitive() {
        return true;
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
