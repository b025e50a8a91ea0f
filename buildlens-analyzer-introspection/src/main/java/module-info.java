module org.buildlens.analyzer.introspection {
    requires transitive org.buildlens.analyzer.interpreter;
    requires org.slf4j;

    exports org.buildlens.analyzer.introspection;
}
