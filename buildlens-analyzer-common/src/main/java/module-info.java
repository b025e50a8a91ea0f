module org.buildlens.analyzer.common {
    exports org.buildlens.analyzer.common;
}
