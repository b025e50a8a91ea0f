package org.buildlens.analyzer.ast;

/**
 * Vertex of the value-flow graph. Every node of the source tree is one; the interpreter adds
 * synthesized unknown values. Equality is identity: vertices must never override <code>equals</code>.
 */
public interface FlowVertex {
}
