package org.buildlens.analyzer.interpreter.value;

/**
 * The value a node would have when the build file is executed, as far as it can be determined statically.
 * Concrete values are compared structurally; {@link UnknownValue} instances by identity.
 */
public sealed interface RuntimeValue
        permits AnalysisRecord, BoolValue, DictValue, Disabler, FileRef, IntValue, ListValue, StringValue, UnknownValue {

    // name of the type in error messages, as the build language calls it
    String typeName();

    default boolean isUnknown() {
        return false;
    }

    /*
    values on which built-in methods can be called directly
     */
    default boolean isPrimitive() {
        return false;
    }
}
