package org.buildlens.analyzer.interpreter.value;

/**
 * Objects produced by the analysis itself (targets, dependencies), returned as the value of the
 * declaration call that created them. They are opaque to operators and built-in methods.
 */
public non-sealed interface AnalysisRecord extends RuntimeValue {
}
