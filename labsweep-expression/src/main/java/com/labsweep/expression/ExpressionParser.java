package com.labsweep.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser for value-list expressions.
 * <pre>
 * expr    := sum
 * sum     := product (('+' | '-') product)*
 * product := unary (('*' | '/' | '//' | '%') unary)*
 * unary   := ('-' | '+') unary | power
 * power   := atom ('**' unary)?
 * atom    := NUMBER | STRING | True | False | IDENT | IDENT '(' args ')'
 *          | '(' ')' | '(' expr ')' | '(' expr ',' [expr (',' expr)* [',']] ')'
 *          | '[' [expr (',' expr)* [',']] ']'
 * args    := [arg (',' arg)* [',']]      arg := expr | IDENT '=' expr
 * </pre>
 */
final class ExpressionParser {

    private final List<Token> tokens;
    private int pos;

    ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    static ExprNode parse(String text) {
        return new ExpressionParser(new ExpressionLexer(text).tokenize()).parse();
    }

    ExprNode parse() {
        ExprNode node = expr();
        if (peek().type() != Token.Type.EOF) {
            throw EvaluationException.syntax("unexpected " + peek() + " at position " + peek().position()
                    + ", likely unbalanced brackets");
        }
        return node;
    }

    private ExprNode expr() {
        return sum();
    }

    private ExprNode sum() {
        ExprNode left = product();
        while (look(Token.Type.PLUS) || look(Token.Type.MINUS)) {
            Token.Type op = advance().type();
            left = new ExprNode.Binary(op, left, product());
        }
        return left;
    }

    private ExprNode product() {
        ExprNode left = unary();
        while (look(Token.Type.STAR) || look(Token.Type.SLASH) || look(Token.Type.DOUBLE_SLASH) || look(Token.Type.PERCENT)) {
            Token.Type op = advance().type();
            left = new ExprNode.Binary(op, left, unary());
        }
        return left;
    }

    private ExprNode unary() {
        if (look(Token.Type.MINUS) || look(Token.Type.PLUS)) {
            Token.Type op = advance().type();
            return new ExprNode.Unary(op, unary());
        }
        return power();
    }

    private ExprNode power() {
        ExprNode base = atom();
        if (look(Token.Type.POWER)) {
            advance();
            return new ExprNode.Binary(Token.Type.POWER, base, unary());
        }
        return base;
    }

    private ExprNode atom() {
        Token t = advance();
        switch (t.type()) {
            case NUMBER:
                return new ExprNode.Literal(parseNumber(t));
            case STRING:
                return new ExprNode.Literal(Value.of(t.text()));
            case IDENT:
                if ("True".equals(t.text())) return new ExprNode.Literal(Value.of(true));
                if ("False".equals(t.text())) return new ExprNode.Literal(Value.of(false));
                if (look(Token.Type.LPAREN)) {
                    advance();
                    return call(t.text());
                }
                return new ExprNode.Name(t.text());
            case LPAREN:
                return parenthesized();
            case LBRACKET:
                return new ExprNode.SequenceLiteral(elements(Token.Type.RBRACKET));
            case EOF:
                throw EvaluationException.syntax("unexpected end of expression, likely unbalanced brackets");
            default:
                throw EvaluationException.syntax("unexpected " + t + " at position " + t.position());
        }
    }

    private ExprNode parenthesized() {
        if (look(Token.Type.RPAREN)) {
            advance();
            return new ExprNode.SequenceLiteral(List.of());
        }
        ExprNode first = expr();
        if (look(Token.Type.RPAREN)) {
            advance();
            return first;
        }
        expect(Token.Type.COMMA);
        List<ExprNode> items = new ArrayList<>();
        items.add(first);
        items.addAll(elements(Token.Type.RPAREN));
        return new ExprNode.SequenceLiteral(items);
    }

    /** Comma-separated expressions up to and including {@code close}; a trailing comma is allowed. */
    private List<ExprNode> elements(Token.Type close) {
        List<ExprNode> items = new ArrayList<>();
        while (!look(close)) {
            items.add(expr());
            if (!look(close)) {
                expect(Token.Type.COMMA);
            }
        }
        advance();
        return items;
    }

    private ExprNode call(String name) {
        List<ExprNode> positional = new ArrayList<>();
        Map<String, ExprNode> keywords = new LinkedHashMap<>();
        while (!look(Token.Type.RPAREN)) {
            if (look(Token.Type.IDENT) && peekAt(1).type() == Token.Type.ASSIGN) {
                String keyword = advance().text();
                advance();
                if (keywords.put(keyword, expr()) != null) {
                    throw EvaluationException.syntax("keyword argument repeated: " + keyword);
                }
            } else {
                if (!keywords.isEmpty()) {
                    throw EvaluationException.syntax("positional argument follows keyword argument in call to " + name);
                }
                positional.add(expr());
            }
            if (!look(Token.Type.RPAREN)) {
                expect(Token.Type.COMMA);
            }
        }
        advance();
        return new ExprNode.Call(name, positional, keywords);
    }

    private static Value parseNumber(Token t) {
        String text = t.text();
        boolean real = text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0;
        if (real) {
            return Arithmetic.real(Double.parseDouble(text));
        }
        try {
            return Value.of(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw EvaluationException.value("integer literal too large: " + text);
        }
    }

    private void expect(Token.Type type) {
        Token t = advance();
        if (t.type() != type) {
            String hint = t.type() == Token.Type.EOF ? ", likely unbalanced brackets" : "";
            throw EvaluationException.syntax("expected " + describe(type) + " but found " + t
                    + (t.type() == Token.Type.EOF ? "" : " at position " + t.position()) + hint);
        }
    }

    private static String describe(Token.Type type) {
        return switch (type) {
            case COMMA -> "','";
            case RPAREN -> "')'";
            case RBRACKET -> "']'";
            default -> type.name();
        };
    }

    private boolean look(Token.Type type) {
        return peek().type() == type;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token t = tokens.get(pos);
        if (t.type() != Token.Type.EOF) pos++;
        return t;
    }
}
