package com.labsweep.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits expression text into tokens. Only numbers, quoted strings, identifiers, brackets,
 * commas, '=' (keyword arguments) and arithmetic operators exist; anything else, including
 * '.' outside a number, is a syntax error, so attribute access cannot be expressed.
 */
final class ExpressionLexer {

    private final String s;
    private int i;

    ExpressionLexer(String s) {
        this.s = s;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token t;
        do {
            t = next();
            tokens.add(t);
        } while (t.type() != Token.Type.EOF);
        return tokens;
    }

    private Token next() {
        skipWhitespace();
        if (i >= s.length()) return new Token(Token.Type.EOF, "", i);
        int start = i;
        char c = s.charAt(i);
        if (isIdentStart(c)) {
            i++;
            while (i < s.length() && isIdentPart(s.charAt(i))) i++;
            return new Token(Token.Type.IDENT, s.substring(start, i), start);
        }
        if (Character.isDigit(c) || (c == '.' && i + 1 < s.length() && Character.isDigit(s.charAt(i + 1)))) {
            return number(start);
        }
        if (c == '\'' || c == '"') {
            return string(start, c);
        }
        if (s.startsWith("**", i)) {
            i += 2;
            return new Token(Token.Type.POWER, "**", start);
        }
        if (s.startsWith("//", i)) {
            i += 2;
            return new Token(Token.Type.DOUBLE_SLASH, "//", start);
        }
        i++;
        return switch (c) {
            case '(' -> new Token(Token.Type.LPAREN, "(", start);
            case ')' -> new Token(Token.Type.RPAREN, ")", start);
            case '[' -> new Token(Token.Type.LBRACKET, "[", start);
            case ']' -> new Token(Token.Type.RBRACKET, "]", start);
            case ',' -> new Token(Token.Type.COMMA, ",", start);
            case '=' -> new Token(Token.Type.ASSIGN, "=", start);
            case '+' -> new Token(Token.Type.PLUS, "+", start);
            case '-' -> new Token(Token.Type.MINUS, "-", start);
            case '*' -> new Token(Token.Type.STAR, "*", start);
            case '/' -> new Token(Token.Type.SLASH, "/", start);
            case '%' -> new Token(Token.Type.PERCENT, "%", start);
            default -> throw EvaluationException.syntax("invalid character '" + c + "' at position " + start);
        };
    }

    private Token number(int start) {
        while (i < s.length() && Character.isDigit(s.charAt(i))) i++;
        if (i < s.length() && s.charAt(i) == '.') {
            i++;
            while (i < s.length() && Character.isDigit(s.charAt(i))) i++;
        }
        if (i < s.length() && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < s.length() && (s.charAt(j) == '+' || s.charAt(j) == '-')) j++;
            if (j < s.length() && Character.isDigit(s.charAt(j))) {
                i = j;
                while (i < s.length() && Character.isDigit(s.charAt(i))) i++;
            }
        }
        if (i < s.length() && isIdentStart(s.charAt(i))) {
            throw EvaluationException.syntax("invalid decimal literal at position " + start);
        }
        return new Token(Token.Type.NUMBER, s.substring(start, i), start);
    }

    private Token string(int start, char quote) {
        i++;
        StringBuilder sb = new StringBuilder();
        while (i < s.length()) {
            char ch = s.charAt(i++);
            if (ch == quote) {
                return new Token(Token.Type.STRING, sb.toString(), start);
            }
            if (ch == '\\' && i < s.length()) {
                char e = s.charAt(i++);
                switch (e) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> sb.append(e);
                }
            } else {
                sb.append(ch);
            }
        }
        throw EvaluationException.syntax("unterminated string literal at position " + start);
    }

    private void skipWhitespace() {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
