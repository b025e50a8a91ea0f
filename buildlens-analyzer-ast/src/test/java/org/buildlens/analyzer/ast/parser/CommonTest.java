package org.buildlens.analyzer.ast.parser;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.buildlens.analyzer.ast.CodeBlockNode;
import org.junit.jupiter.api.BeforeAll;
import org.slf4j.LoggerFactory;

public class CommonTest {

    @BeforeAll
    public static void beforeAll() {
        ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.INFO);
        ((Logger) LoggerFactory.getLogger(Parser.class)).setLevel(Level.DEBUG);
    }

    protected CodeBlockNode parse(String code) {
        return new Parser(code, "meson.build").parse();
    }
}
