package org.buildlens.analyzer.common;

public class AnalyzerException extends RuntimeException {
    private final String buildFile;

    public AnalyzerException(String buildFile, Throwable throwable) {
        super("Analysis of " + buildFile + " failed: " + throwable.getMessage(), throwable);
        this.buildFile = buildFile;
    }

    public String getBuildFile() {
        return buildFile;
    }
}
