package com.spreadsheet.calc.models.ast;

import com.spreadsheet.calc.models.CellId;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable parsed formula. One of three kinds:
 * - NUM: a numeric literal
 * - REF: a reference to another cell, relative to the cell holding the formula
 * - APP: an operator applied to an ordered list of operands
 */
public abstract class Ast {

    public enum Kind {
        NUM,
        REF,
        APP
    }

    // Binding strength used when rendering; literals, refs and calls bind tightest
    static final int PRIMARY = 3;

    public abstract Kind getKind();

    /**
     * Renders canonical formula text as seen from the given cell.
     * Relative references are shown resolved against {@code base}.
     */
    public abstract String toText(CellId base);

    abstract int precedence();

    /**
     * Every reference in this formula, left to right.
     */
    public List<CellRef> references() {
        List<CellRef> refs = new ArrayList<>();
        collectReferences(refs);
        return refs;
    }

    abstract void collectReferences(List<CellRef> refs);
}
