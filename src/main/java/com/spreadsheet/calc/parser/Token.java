package com.spreadsheet.calc.parser;

/**
 * A lexical token of a formula, with its offset in the source text.
 */
class Token {

    enum Type {
        NUMBER,
        REF,
        FN,
        PLUS,
        MINUS,
        TIMES,
        DIVIDE,
        LPAREN,
        RPAREN,
        COMMA,
        END
    }

    private final Type type;
    private final String text;
    private final int position;

    Token(Type type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    Type getType() {
        return type;
    }

    String getText() {
        return text;
    }

    int getPosition() {
        return position;
    }
}
