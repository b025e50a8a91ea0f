module org.buildlens.analyzer.ast {
    requires transitive org.buildlens.analyzer.common;
    requires org.slf4j;

    exports org.buildlens.analyzer.ast;
    exports org.buildlens.analyzer.ast.parser;
}
