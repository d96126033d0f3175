package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.exceptions.SyntaxException;
import com.spreadsheet.calc.models.CellId;
import com.spreadsheet.calc.models.Grid;
import com.spreadsheet.calc.models.ast.ApplyNode;
import com.spreadsheet.calc.models.ast.Ast;
import com.spreadsheet.calc.models.ast.CellRef;
import com.spreadsheet.calc.models.ast.NumberNode;
import com.spreadsheet.calc.models.ast.Operator;
import com.spreadsheet.calc.models.ast.RefNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Recursive-descent parser for cell formulas:
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := factor (('*' | '/') factor)*
 * factor := NUMBER | REF | '-' factor | '(' expr ')' | FN '(' expr ',' expr ')'
 * </pre>
 * FN is min or max. REF is letters and digits, each optionally prefixed by '$'
 * to make that coordinate absolute. Input is case-insensitive.
 * <p>
 * References are stored relative to the cell being parsed, so the same tree
 * evaluates correctly wherever it is placed.
 */
public class FormulaParser {

    private final Grid grid;

    public FormulaParser(Grid grid) {
        this.grid = grid;
    }

    /**
     * Parses {@code text} as the formula of {@code base}.
     * Throws SyntaxException on any error; never returns null.
     */
    public Ast parse(String text, CellId base) {
        if (text == null) {
            throw new SyntaxException("Missing formula", 0);
        }
        Parse parse = new Parse(new FormulaLexer(text).tokenize(), base);
        Ast ast = parse.expr();
        parse.expect(Token.Type.END, "end of formula");
        return ast;
    }

    // One parse over a token list; not reused
    private class Parse {
        private final List<Token> tokens;
        private final CellId base;
        private int index;

        Parse(List<Token> tokens, CellId base) {
            this.tokens = tokens;
            this.base = base;
        }

        Ast expr() {
            Ast left = term();
            while (peek().getType() == Token.Type.PLUS || peek().getType() == Token.Type.MINUS) {
                Operator op = Operator.fromSymbol(next().getText());
                left = new ApplyNode(op, Arrays.asList(left, term()));
            }
            return left;
        }

        Ast term() {
            Ast left = factor();
            while (peek().getType() == Token.Type.TIMES || peek().getType() == Token.Type.DIVIDE) {
                Operator op = Operator.fromSymbol(next().getText());
                left = new ApplyNode(op, Arrays.asList(left, factor()));
            }
            return left;
        }

        Ast factor() {
            Token token = next();
            switch (token.getType()) {
                case NUMBER:
                    return number(token);
                case REF:
                    return reference(token);
                case MINUS:
                    return new ApplyNode(Operator.MINUS, Collections.singletonList(factor()));
                case LPAREN: {
                    Ast inner = expr();
                    expect(Token.Type.RPAREN, "')'");
                    return inner;
                }
                case FN: {
                    Operator op = Operator.fromSymbol(token.getText());
                    expect(Token.Type.LPAREN, "'(' after " + token.getText());
                    Ast first = expr();
                    expect(Token.Type.COMMA, "',' between " + token.getText() + " arguments");
                    Ast second = expr();
                    expect(Token.Type.RPAREN, "')'");
                    return new ApplyNode(op, Arrays.asList(first, second));
                }
                default:
                    throw new SyntaxException("Unexpected " + describe(token)
                            + " at position " + token.getPosition(), token.getPosition());
            }
        }

        private Ast number(Token token) {
            double value;
            try {
                value = Double.parseDouble(token.getText());
            } catch (NumberFormatException e) {
                throw new SyntaxException("Bad number '" + token.getText() + "'", token.getPosition());
            }
            if (Double.isInfinite(value)) {
                throw new SyntaxException("Number '" + token.getText() + "' is out of range", token.getPosition());
            }
            return new NumberNode(value);
        }

        private Ast reference(Token token) {
            String text = token.getText();
            boolean columnAbsolute = text.startsWith("$");
            String rest = columnAbsolute ? text.substring(1) : text;
            int split = 0;
            while (split < rest.length() && Character.isLetter(rest.charAt(split))) {
                split++;
            }
            String letters = rest.substring(0, split);
            String digits = rest.substring(split);
            boolean rowAbsolute = digits.startsWith("$");
            if (rowAbsolute) {
                digits = digits.substring(1);
            }
            CellId target = CellId.parse(letters + digits);
            if (target == null || !grid.contains(target)) {
                throw new SyntaxException("Bad cell reference '" + text + "'", token.getPosition());
            }
            return new RefNode(CellRef.of(target, columnAbsolute, rowAbsolute, base));
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            Token token = tokens.get(index);
            if (token.getType() != Token.Type.END) {
                index++;
            }
            return token;
        }

        void expect(Token.Type type, String what) {
            Token token = next();
            if (token.getType() != type) {
                throw new SyntaxException("Expected " + what + " but found " + describe(token)
                        + " at position " + token.getPosition(), token.getPosition());
            }
        }

        private String describe(Token token) {
            return token.getType() == Token.Type.END ? "end of formula" : "'" + token.getText() + "'";
        }
    }
}
