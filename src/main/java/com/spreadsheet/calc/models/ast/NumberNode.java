package com.spreadsheet.calc.models.ast;

import com.spreadsheet.calc.models.CellId;

import java.util.List;

/**
 * Numeric literal.
 */
public final class NumberNode extends Ast {
    private final double value;

    public NumberNode(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.NUM;
    }

    @Override
    public String toText(CellId base) {
        return format(value);
    }

    /**
     * Integral values print without a fraction: 5 rather than 5.0.
     */
    public static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    @Override
    int precedence() {
        return PRIMARY;
    }

    @Override
    void collectReferences(List<CellRef> refs) {
    }
}
