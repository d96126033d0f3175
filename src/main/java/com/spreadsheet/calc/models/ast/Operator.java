package com.spreadsheet.calc.models.ast;

/**
 * The fixed operator set. Binary except MINUS, which negates when given
 * a single operand.
 */
public enum Operator {
    PLUS("+", 1, false),
    MINUS("-", 1, false),
    TIMES("*", 2, false),
    DIVIDE("/", 2, false),
    MIN("min", 0, true),
    MAX("max", 0, true);

    private final String symbol;
    private final int precedence;
    private final boolean function;

    Operator(String symbol, int precedence, boolean function) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.function = function;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    // Written as name(x,y) rather than infix
    public boolean isFunction() {
        return function;
    }

    /**
     * Looks up an operator by its symbol or function name.
     * An unknown symbol means parser and evaluator disagree, which is a bug.
     */
    public static Operator fromSymbol(String symbol) {
        for (Operator op : values()) {
            if (op.symbol.equalsIgnoreCase(symbol)) {
                return op;
            }
        }
        throw new IllegalStateException("Unknown operator '" + symbol + "'");
    }

    /**
     * Applies this operator. Division by zero follows IEEE semantics.
     */
    public double apply(double[] args) {
        if (this == MINUS && args.length == 1) {
            return -args[0];
        }
        if (args.length != 2) {
            throw new IllegalStateException("Operator '" + symbol + "' applied to " + args.length + " operands");
        }
        double a = args[0];
        double b = args[1];
        switch (this) {
            case PLUS:
                return a + b;
            case MINUS:
                return a - b;
            case TIMES:
                return a * b;
            case DIVIDE:
                return a / b;
            case MIN:
                return Math.min(a, b);
            case MAX:
                return Math.max(a, b);
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }
}
