package com.labsweep.expression;

/** Lexical token with its start offset in the source text. */
record Token(Type type, String text, int position) {

    enum Type {
        NUMBER, STRING, IDENT,
        LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA, ASSIGN,
        PLUS, MINUS, STAR, SLASH, DOUBLE_SLASH, PERCENT, POWER,
        EOF
    }

    @Override
    public String toString() {
        return type == Type.EOF ? "end of expression" : "'" + text + "'";
    }
}
