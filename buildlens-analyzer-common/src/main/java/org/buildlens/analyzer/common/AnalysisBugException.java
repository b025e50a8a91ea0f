package org.buildlens.analyzer.common;

/*
The analysis ran into a construct it does not model, or into state that should be impossible.
Never caught inside the analysis: the structured records downstream would be corrupt.
 */
public class AnalysisBugException extends RuntimeException {

    public AnalysisBugException(String message) {
        super(message);
    }

    public AnalysisBugException(String message, Throwable cause) {
        super(message, cause);
    }
}
