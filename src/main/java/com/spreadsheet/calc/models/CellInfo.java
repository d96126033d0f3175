package com.spreadsheet.calc.models;

/**
 * Result of querying one cell: its formula text and current value.
 * An empty cell has expr "" and value 0.
 */
public class CellInfo {
    private final String expr;
    private final double value;

    public CellInfo(String expr, double value) {
        this.expr = expr;
        this.value = value;
    }

    public String getExpr() {
        return expr;
    }

    public double getValue() {
        return value;
    }
}
