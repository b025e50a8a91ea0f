module org.buildlens.analyzer.interpreter {
    requires transitive org.buildlens.analyzer.ast;
    requires transitive org.buildlens.analyzer.common;
    requires org.slf4j;

    exports org.buildlens.analyzer.interpreter;
    exports org.buildlens.analyzer.interpreter.graph;
    exports org.buildlens.analyzer.interpreter.graph.impl;
    exports org.buildlens.analyzer.interpreter.resolve;
    exports org.buildlens.analyzer.interpreter.scope;
    exports org.buildlens.analyzer.interpreter.value;
}
