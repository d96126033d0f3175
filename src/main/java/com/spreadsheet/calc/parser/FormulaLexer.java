package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.exceptions.SyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits formula text into tokens. Whitespace is skipped; letters are lower-cased.
 */
class FormulaLexer {

    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?([eE][+-]?\\d+)?|\\.\\d+([eE][+-]?\\d+)?");
    private static final Pattern REF = Pattern.compile("\\$?[a-z]+\\$?\\d+");
    private static final Pattern WORD = Pattern.compile("[a-z]+");

    private final String text;

    FormulaLexer(String text) {
        this.text = text.toLowerCase(Locale.ROOT);
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            Token.Type single = singleCharType(c);
            if (single != null) {
                tokens.add(new Token(single, String.valueOf(c), pos));
                pos++;
                continue;
            }
            Matcher number = NUMBER.matcher(text).region(pos, text.length());
            if (number.lookingAt()) {
                tokens.add(new Token(Token.Type.NUMBER, number.group(), pos));
                pos = number.end();
                continue;
            }
            Matcher ref = REF.matcher(text).region(pos, text.length());
            if (ref.lookingAt()) {
                tokens.add(new Token(Token.Type.REF, ref.group(), pos));
                pos = ref.end();
                continue;
            }
            Matcher word = WORD.matcher(text).region(pos, text.length());
            if (word.lookingAt() && (word.group().equals("min") || word.group().equals("max"))) {
                tokens.add(new Token(Token.Type.FN, word.group(), pos));
                pos = word.end();
                continue;
            }
            throw new SyntaxException("Unexpected character '" + text.charAt(pos) + "' at position " + pos, pos);
        }
        if (tokens.isEmpty()) {
            throw new SyntaxException("Empty formula", 0);
        }
        tokens.add(new Token(Token.Type.END, "", text.length()));
        return tokens;
    }

    private static Token.Type singleCharType(char c) {
        switch (c) {
            case '+':
                return Token.Type.PLUS;
            case '-':
                return Token.Type.MINUS;
            case '*':
                return Token.Type.TIMES;
            case '/':
                return Token.Type.DIVIDE;
            case '(':
                return Token.Type.LPAREN;
            case ')':
                return Token.Type.RPAREN;
            case ',':
                return Token.Type.COMMA;
            default:
                return null;
        }
    }
}
