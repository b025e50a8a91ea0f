package org.buildlens.analyzer.ast.parser;

public record Token(TokenType type, String value, int line, int column) {

    @Override
    public String toString() {
        return type + (value.isEmpty() ? "" : "(" + value + ")") + "@" + line + ":" + column;
    }
}
