package org.buildlens.analyzer.introspection;

public class CompilerDetectionException extends Exception {
    public CompilerDetectionException(String message) {
        super(message);
    }
}
