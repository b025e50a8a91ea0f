package org.buildlens.analyzer.ast.parser;

import org.buildlens.analyzer.common.InvalidCodeException;
import org.buildlens.analyzer.common.Location;

import java.util.ArrayList;
import java.util.List;

/*
Newlines end a statement, except inside parentheses, brackets and braces, where they are skipped.
Consecutive newlines produce a single EOL token.
 */
public class Lexer {
    private final String code;
    private final String fileName;
    private int pos;
    private int line = 1;
    private int lineStart;
    private int nesting;

    public Lexer(String code, String fileName) {
        this.code = code;
        this.fileName = fileName;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (pos < code.length()) {
            char c = code.charAt(pos);
            int column = pos - lineStart + 1;
            if (c == ' ' || c == '\t' || c == '\r') {
                pos++;
            } else if (c == '#') {
                while (pos < code.length() && code.charAt(pos) != '\n') pos++;
            } else if (c == '\\' && pos + 1 < code.length() && code.charAt(pos + 1) == '\n') {
                pos += 2;
                newLine();
            } else if (c == '\n') {
                if (nesting == 0 && !tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.EOL) {
                    tokens.add(new Token(TokenType.EOL, "", line, column));
                }
                pos++;
                newLine();
            } else if (Character.isDigit(c)) {
                tokens.add(number(column));
            } else if (c == 'f' && pos + 1 < code.length() && code.charAt(pos + 1) == '\'') {
                pos++;
                tokens.add(string(column, true));
            } else if (c == '\'') {
                tokens.add(string(column, false));
            } else if (Character.isLetter(c) || c == '_') {
                int start = pos;
                while (pos < code.length() && (Character.isLetterOrDigit(code.charAt(pos)) || code.charAt(pos) == '_')) {
                    pos++;
                }
                String word = code.substring(start, pos);
                TokenType keyword = TokenType.KEYWORDS.get(word);
                tokens.add(new Token(keyword == null ? TokenType.ID : keyword, word, line, column));
            } else {
                tokens.add(operator(c, column));
            }
        }
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.EOL) {
            tokens.add(new Token(TokenType.EOL, "", line, pos - lineStart + 1));
        }
        tokens.add(new Token(TokenType.EOF, "", line, pos - lineStart + 1));
        return tokens;
    }

    private void newLine() {
        line++;
        lineStart = pos;
    }

    private Token operator(char c, int column) {
        char next = pos + 1 < code.length() ? code.charAt(pos + 1) : 0;
        TokenType type;
        int length = 1;
        switch (c) {
            case '(' -> type = TokenType.LPAREN;
            case ')' -> type = TokenType.RPAREN;
            case '[' -> type = TokenType.LBRACKET;
            case ']' -> type = TokenType.RBRACKET;
            case '{' -> type = TokenType.LCURL;
            case '}' -> type = TokenType.RCURL;
            case ',' -> type = TokenType.COMMA;
            case ':' -> type = TokenType.COLON;
            case '.' -> type = TokenType.DOT;
            case '?' -> type = TokenType.QUESTION_MARK;
            case '*' -> type = TokenType.STAR;
            case '/' -> type = TokenType.SLASH;
            case '%' -> type = TokenType.PERCENT;
            case '-' -> type = TokenType.DASH;
            case '+' -> {
                if (next == '=') {
                    type = TokenType.PLUS_ASSIGN;
                    length = 2;
                } else type = TokenType.PLUS;
            }
            case '=' -> {
                if (next == '=') {
                    type = TokenType.EQUAL;
                    length = 2;
                } else type = TokenType.ASSIGN;
            }
            case '!' -> {
                if (next != '=') throw error("Unexpected character '!'", column);
                type = TokenType.NOT_EQUAL;
                length = 2;
            }
            case '<' -> {
                if (next == '=') {
                    type = TokenType.LE;
                    length = 2;
                } else type = TokenType.LT;
            }
            case '>' -> {
                if (next == '=') {
                    type = TokenType.GE;
                    length = 2;
                } else type = TokenType.GT;
            }
            default -> throw error("Unexpected character '" + c + "'", column);
        }
        switch (type) {
            case LPAREN, LBRACKET, LCURL -> nesting++;
            case RPAREN, RBRACKET, RCURL -> nesting = Math.max(0, nesting - 1);
            default -> {
            }
        }
        String value = code.substring(pos, pos + length);
        pos += length;
        return new Token(type, value, line, column);
    }

    private Token number(int column) {
        int start = pos;
        int radix = 10;
        if (code.charAt(pos) == '0' && pos + 1 < code.length()) {
            char p = Character.toLowerCase(code.charAt(pos + 1));
            if (p == 'x') radix = 16;
            else if (p == 'o') radix = 8;
            else if (p == 'b') radix = 2;
            if (radix != 10) pos += 2;
        }
        int digitsStart = pos;
        while (pos < code.length() && Character.digit(code.charAt(pos), radix) >= 0) pos++;
        if (digitsStart == pos) throw error("Invalid number literal", column);
        try {
            long value = Long.parseLong(code.substring(digitsStart, pos), radix);
            return new Token(TokenType.NUMBER, Long.toString(value), line, column);
        } catch (NumberFormatException nfe) {
            throw error("Number out of range: " + code.substring(start, pos), column);
        }
    }

    private Token string(int column, boolean format) {
        int startLine = line;
        if (code.startsWith("'''", pos)) {
            int end = code.indexOf("'''", pos + 3);
            if (end < 0) throw error("Unterminated multiline string", column);
            String value = code.substring(pos + 3, end);
            for (int i = pos; i < end; i++) {
                if (code.charAt(i) == '\n') {
                    line++;
                    lineStart = i + 1;
                }
            }
            pos = end + 3;
            return new Token(format ? TokenType.MULTILINE_FSTRING : TokenType.MULTILINE_STRING, value,
                    startLine, column);
        }
        pos++;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= code.length() || code.charAt(pos) == '\n') {
                throw error("Unterminated string", column);
            }
            char c = code.charAt(pos);
            if (c == '\'') {
                pos++;
                break;
            }
            if (c == '\\' && pos + 1 < code.length()) {
                pos++;
                sb.append(escape(column));
            } else {
                sb.append(c);
                pos++;
            }
        }
        return new Token(format ? TokenType.FSTRING : TokenType.STRING, sb.toString(), startLine, column);
    }

    private String escape(int column) {
        char e = code.charAt(pos++);
        switch (e) {
            case 'n':
                return "\n";
            case 't':
                return "\t";
            case 'r':
                return "\r";
            case '0':
                return "\0";
            case '\\':
                return "\\";
            case '\'':
                return "'";
            case 'x':
                return hex(2, column);
            case 'u':
                return hex(4, column);
            default:
                // unknown escapes are kept as they are
                return "\\" + e;
        }
    }

    private String hex(int digits, int column) {
        if (pos + digits > code.length()) throw error("Truncated escape sequence", column);
        try {
            int cp = Integer.parseInt(code.substring(pos, pos + digits), 16);
            pos += digits;
            return new String(Character.toChars(cp));
        } catch (NumberFormatException nfe) {
            throw error("Invalid escape sequence", column);
        }
    }

    private InvalidCodeException error(String message, int column) {
        return new InvalidCodeException(message, new Location(fileName, line, column));
    }
}
