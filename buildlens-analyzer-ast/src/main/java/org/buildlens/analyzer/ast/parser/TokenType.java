package org.buildlens.analyzer.ast.parser;

import java.util.Map;

public enum TokenType {
    ID, STRING, MULTILINE_STRING, FSTRING, MULTILINE_FSTRING, NUMBER,
    TRUE, FALSE, IF, ELIF, ELSE, ENDIF, FOREACH, ENDFOREACH, AND, OR, NOT, IN, BREAK, CONTINUE,
    LPAREN, RPAREN, LBRACKET, RBRACKET, LCURL, RCURL, COMMA, COLON, DOT, QUESTION_MARK,
    ASSIGN, PLUS_ASSIGN, EQUAL, NOT_EQUAL, LT, LE, GT, GE, PLUS, DASH, STAR, SLASH, PERCENT,
    EOL, EOF;

    static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("true", TRUE), Map.entry("false", FALSE),
            Map.entry("if", IF), Map.entry("elif", ELIF), Map.entry("else", ELSE), Map.entry("endif", ENDIF),
            Map.entry("foreach", FOREACH), Map.entry("endforeach", ENDFOREACH),
            Map.entry("and", AND), Map.entry("or", OR), Map.entry("not", NOT), Map.entry("in", IN),
            Map.entry("break", BREAK), Map.entry("continue", CONTINUE));
}
