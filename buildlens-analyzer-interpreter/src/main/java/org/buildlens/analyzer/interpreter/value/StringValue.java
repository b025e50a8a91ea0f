package org.buildlens.analyzer.interpreter.value;

import java.util.Objects;

public record StringValue(String value) implements RuntimeValue {

    public StringValue {
        Objects.requireNonNull(value);
    }

    @Override
    public String typeName() {
        return "str";
    }

    @Override
    public boolean isPrimitive() {
        return true;
    }

    @Override
    public String toString() {
        return "'" + value + "'";
    }
}
