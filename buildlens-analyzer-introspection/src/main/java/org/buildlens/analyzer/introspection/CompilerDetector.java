package org.buildlens.analyzer.introspection;

/**
 * Finds a compiler for a language declared by a project. The introspection only needs to know whether one exists.
 */
@FunctionalInterface
public interface CompilerDetector {
    CompilerDetector ACCEPT_ALL = (language, machine) -> {
    };

    void detect(String language, MachineChoice machine) throws CompilerDetectionException;
}
