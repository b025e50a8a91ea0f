package org.buildlens.analyzer.interpreter.value;

/**
 * Marker for a disabled feature: any call receiving it as an argument is itself disabled.
 */
public final class Disabler implements RuntimeValue {
    public static final Disabler INSTANCE = new Disabler();

    private Disabler() {
    }

    @Override
    public String typeName() {
        return "disabler";
    }

    @Override
    public String toString() {
        return "Disabler";
    }
}
