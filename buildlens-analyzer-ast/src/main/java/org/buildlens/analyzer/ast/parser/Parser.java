package org.buildlens.analyzer.ast.parser;

import org.buildlens.analyzer.ast.*;
import org.buildlens.analyzer.common.InvalidCodeException;
import org.buildlens.analyzer.common.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/*
Recursive descent, one method per precedence level, lowest first:

ternary   : or ('?' ternary ':' ternary)?
or        : and ('or' and)*
and       : comparison ('and' comparison)*
comparison: additive (('=='|'!='|'<'|'<='|'>'|'>='|'in'|'not' 'in') additive)?
additive  : multiplicative (('+'|'-') multiplicative)*
multiplicative: unary (('*'|'/'|'%') unary)*
unary     : ('not'|'-') unary | postfix
postfix   : primary ('.' ID '(' arguments ')' | '[' ternary ']')*
 */
public class Parser {
    private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);

    private static final Set<TokenType> NO_TERMINATORS = EnumSet.noneOf(TokenType.class);
    private static final Set<TokenType> IF_TERMINATORS = EnumSet.of(TokenType.ELIF, TokenType.ELSE, TokenType.ENDIF);
    private static final Set<TokenType> ELSE_TERMINATORS = EnumSet.of(TokenType.ENDIF);
    private static final Set<TokenType> FOREACH_TERMINATORS = EnumSet.of(TokenType.ENDFOREACH);

    private final String fileName;
    private final List<Token> tokens;
    private int current;
    private int conditionLevel;

    public Parser(String code, String fileName) {
        this.fileName = fileName;
        this.tokens = new Lexer(code, fileName).tokenize();
    }

    public CodeBlockNode parse() {
        LOGGER.debug("Parsing {}, {} tokens", fileName, tokens.size());
        CodeBlockNode block = codeBlock(NO_TERMINATORS);
        if (peek().type() != TokenType.EOF) {
            throw error("Unexpected " + peek().type(), peek());
        }
        return block;
    }

    // ---- statements

    private CodeBlockNode codeBlock(Set<TokenType> terminators) {
        Location location = location(peek());
        List<Node> lines = new ArrayList<>();
        while (true) {
            while (accept(TokenType.EOL) != null) {
                // skip empty lines
            }
            TokenType type = peek().type();
            if (type == TokenType.EOF || terminators.contains(type)) break;
            lines.add(line());
            if (accept(TokenType.EOL) == null && peek().type() != TokenType.EOF) {
                throw error("Expected end of line, got " + peek().type(), peek());
            }
        }
        return new CodeBlockNode(location, lines);
    }

    private Node line() {
        Token token = peek();
        switch (token.type()) {
            case IF:
                return ifClause();
            case FOREACH:
                return foreachClause();
            case BREAK:
                advance();
                return new BreakNode(location(token));
            case CONTINUE:
                advance();
                return new ContinueNode(location(token));
            default:
                return statement();
        }
    }

    private Node statement() {
        Token start = peek();
        Node expression = ternary();
        Token operator = accept(TokenType.ASSIGN);
        if (operator == null) operator = accept(TokenType.PLUS_ASSIGN);
        if (operator == null) return expression;
        if (!(expression instanceof IdNode id)) {
            throw error("Assignment target must be an identifier", start);
        }
        Node value = ternary();
        if (operator.type() == TokenType.ASSIGN) {
            return new AssignmentNode(location(start), id.name(), value);
        }
        return new PlusAssignmentNode(location(start), id.name(), value);
    }

    private IfClauseNode ifClause() {
        Token ifToken = expect(TokenType.IF);
        List<IfNode> ifs = new ArrayList<>();
        ifs.add(ifArm(ifToken));
        Token elif;
        while ((elif = accept(TokenType.ELIF)) != null) {
            ifs.add(ifArm(elif));
        }
        CodeBlockNode elseBlock = null;
        if (accept(TokenType.ELSE) != null) {
            elseBlock = conditionalBlock(ELSE_TERMINATORS);
        }
        expect(TokenType.ENDIF);
        return new IfClauseNode(location(ifToken), ifs, elseBlock);
    }

    private IfNode ifArm(Token keyword) {
        Node condition = ternary();
        expect(TokenType.EOL);
        CodeBlockNode block = conditionalBlock(IF_TERMINATORS);
        return new IfNode(location(keyword), condition, block);
    }

    private ForeachClauseNode foreachClause() {
        Token foreach = expect(TokenType.FOREACH);
        List<String> names = new ArrayList<>();
        names.add(expect(TokenType.ID).value());
        if (accept(TokenType.COMMA) != null) {
            names.add(expect(TokenType.ID).value());
        }
        expect(TokenType.COLON);
        Node items = ternary();
        expect(TokenType.EOL);
        CodeBlockNode block = conditionalBlock(FOREACH_TERMINATORS);
        expect(TokenType.ENDFOREACH);
        return new ForeachClauseNode(location(foreach), names, items, block);
    }

    private CodeBlockNode conditionalBlock(Set<TokenType> terminators) {
        conditionLevel++;
        try {
            return codeBlock(terminators);
        } finally {
            conditionLevel--;
        }
    }

    // ---- expressions

    private Node ternary() {
        Node condition = or();
        Token question = accept(TokenType.QUESTION_MARK);
        if (question == null) return condition;
        Node trueBlock = ternary();
        expect(TokenType.COLON);
        Node falseBlock = ternary();
        return new TernaryNode(location(question), condition, trueBlock, falseBlock);
    }

    private Node or() {
        Node left = and();
        Token token;
        while ((token = accept(TokenType.OR)) != null) {
            left = new OrNode(location(token), left, and());
        }
        return left;
    }

    private Node and() {
        Node left = comparison();
        Token token;
        while ((token = accept(TokenType.AND)) != null) {
            left = new AndNode(location(token), left, comparison());
        }
        return left;
    }

    private Node comparison() {
        Node left = additive();
        Token token = peek();
        ComparisonOperator operator = switch (token.type()) {
            case EQUAL -> ComparisonOperator.EQ;
            case NOT_EQUAL -> ComparisonOperator.NE;
            case LT -> ComparisonOperator.LT;
            case LE -> ComparisonOperator.LE;
            case GT -> ComparisonOperator.GT;
            case GE -> ComparisonOperator.GE;
            case IN -> ComparisonOperator.IN;
            case NOT -> peekNext().type() == TokenType.IN ? ComparisonOperator.NOT_IN : null;
            default -> null;
        };
        if (operator == null) return left;
        advance();
        if (operator == ComparisonOperator.NOT_IN) advance();
        return new ComparisonNode(location(token), operator, left, additive());
    }

    private Node additive() {
        Node left = multiplicative();
        while (true) {
            Token token = peek();
            ArithmeticOperator operator;
            if (token.type() == TokenType.PLUS) operator = ArithmeticOperator.ADD;
            else if (token.type() == TokenType.DASH) operator = ArithmeticOperator.SUB;
            else return left;
            advance();
            left = new ArithmeticNode(location(token), operator, left, multiplicative());
        }
    }

    private Node multiplicative() {
        Node left = unary();
        while (true) {
            Token token = peek();
            ArithmeticOperator operator;
            if (token.type() == TokenType.STAR) operator = ArithmeticOperator.MUL;
            else if (token.type() == TokenType.SLASH) operator = ArithmeticOperator.DIV;
            else if (token.type() == TokenType.PERCENT) operator = ArithmeticOperator.MOD;
            else return left;
            advance();
            left = new ArithmeticNode(location(token), operator, left, unary());
        }
    }

    private Node unary() {
        Token token = peek();
        if (accept(TokenType.NOT) != null) {
            return new NotNode(location(token), unary());
        }
        if (accept(TokenType.DASH) != null) {
            return new UMinusNode(location(token), unary());
        }
        return postfix();
    }

    private Node postfix() {
        Node node = primary();
        while (true) {
            Token token = peek();
            if (accept(TokenType.DOT) != null) {
                Token name = expect(TokenType.ID);
                expect(TokenType.LPAREN);
                Arguments arguments = arguments(TokenType.RPAREN);
                expect(TokenType.RPAREN);
                node = new MethodNode(location(name), node, name.value(), arguments);
            } else if (accept(TokenType.LBRACKET) != null) {
                Node index = ternary();
                expect(TokenType.RBRACKET);
                node = new IndexNode(location(token), node, index);
            } else {
                return node;
            }
        }
    }

    private Node primary() {
        Token token = advance();
        Location location = location(token);
        switch (token.type()) {
            case LPAREN: {
                Node inner = ternary();
                expect(TokenType.RPAREN);
                return new ParenthesizedNode(location, inner);
            }
            case LBRACKET: {
                Arguments arguments = arguments(TokenType.RBRACKET);
                if (arguments.hasKeywords()) throw error("Keyword arguments are not allowed in an array", token);
                expect(TokenType.RBRACKET);
                return new ArrayNode(location, arguments);
            }
            case LCURL: {
                Arguments arguments = dictEntries();
                expect(TokenType.RCURL);
                return new DictNode(location, arguments);
            }
            case ID: {
                if (accept(TokenType.LPAREN) != null) {
                    Arguments arguments = arguments(TokenType.RPAREN);
                    expect(TokenType.RPAREN);
                    return new FunctionNode(location, token.value(), arguments, conditionLevel);
                }
                return new IdNode(location, token.value());
            }
            case NUMBER:
                return new NumberNode(location, Long.parseLong(token.value()));
            case STRING:
            case MULTILINE_STRING:
                return new StringNode(location, token.value());
            case FSTRING:
            case MULTILINE_FSTRING:
                return new FormatStringNode(location, token.value());
            case TRUE:
                return new BooleanNode(location, true);
            case FALSE:
                return new BooleanNode(location, false);
            default:
                throw error("Unexpected " + token.type(), token);
        }
    }

    /*
    positional arguments, then keyword arguments; a trailing comma is allowed
     */
    private Arguments arguments(TokenType closing) {
        List<Node> positional = new ArrayList<>();
        List<Arguments.KeywordArgument> keywords = new ArrayList<>();
        while (peek().type() != closing) {
            Token start = peek();
            Node node = ternary();
            if (accept(TokenType.COLON) != null) {
                if (!(node instanceof IdNode)) throw error("Keyword argument name must be an identifier", start);
                keywords.add(new Arguments.KeywordArgument(node, ternary()));
            } else {
                if (!keywords.isEmpty()) {
                    throw error("All keyword arguments must be after positional arguments", start);
                }
                positional.add(node);
            }
            if (accept(TokenType.COMMA) == null) break;
        }
        return new Arguments(positional, keywords);
    }

    private Arguments dictEntries() {
        List<Arguments.KeywordArgument> entries = new ArrayList<>();
        while (peek().type() != TokenType.RCURL) {
            Node key = ternary();
            expect(TokenType.COLON);
            entries.add(new Arguments.KeywordArgument(key, ternary()));
            if (accept(TokenType.COMMA) == null) break;
        }
        return new Arguments(List.of(), entries);
    }

    // ---- token handling

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        return tokens.get(Math.min(current + 1, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.type() != TokenType.EOF) current++;
        return token;
    }

    private Token accept(TokenType type) {
        if (peek().type() == type) return advance();
        return null;
    }

    private Token expect(TokenType type) {
        Token token = peek();
        if (token.type() != type) {
            throw error("Expected " + type + ", got " + token.type(), token);
        }
        return advance();
    }

    private Location location(Token token) {
        return new Location(fileName, token.line(), token.column());
    }

    private InvalidCodeException error(String message, Token token) {
        return new InvalidCodeException(message, location(token));
    }
}
