package com.spreadsheet.calc.models.ast;

import com.spreadsheet.calc.models.CellId;

import java.util.Objects;

/**
 * A reference as written in a formula. Each coordinate is either absolute
 * (written with a '$' prefix) or an offset from the cell holding the formula,
 * so copying a formula elsewhere shifts its relative parts.
 */
public final class CellRef {
    private final boolean columnAbsolute;
    private final int column;
    private final boolean rowAbsolute;
    private final int row;

    private CellRef(boolean columnAbsolute, int column, boolean rowAbsolute, int row) {
        this.columnAbsolute = columnAbsolute;
        this.column = column;
        this.rowAbsolute = rowAbsolute;
        this.row = row;
    }

    /**
     * Builds the reference to {@code target} as written inside {@code base}.
     */
    public static CellRef of(CellId target, boolean columnAbsolute, boolean rowAbsolute, CellId base) {
        int col = columnAbsolute ? target.getColumn() : target.getColumn() - base.getColumn();
        int r = rowAbsolute ? target.getRow() : target.getRow() - base.getRow();
        return new CellRef(columnAbsolute, col, rowAbsolute, r);
    }

    public int columnAt(CellId base) {
        return columnAbsolute ? column : base.getColumn() + column;
    }

    public int rowAt(CellId base) {
        return rowAbsolute ? row : base.getRow() + row;
    }

    /**
     * Absolute target of this reference for a formula living in {@code base}.
     */
    public CellId resolve(CellId base) {
        return new CellId(columnAt(base), rowAt(base));
    }

    public boolean isColumnAbsolute() {
        return columnAbsolute;
    }

    public boolean isRowAbsolute() {
        return rowAbsolute;
    }

    public String toText(CellId base) {
        return (columnAbsolute ? "$" : "") + CellId.columnName(columnAt(base))
                + (rowAbsolute ? "$" : "") + rowAt(base);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRef)) {
            return false;
        }
        CellRef other = (CellRef) o;
        return columnAbsolute == other.columnAbsolute && column == other.column
                && rowAbsolute == other.rowAbsolute && row == other.row;
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnAbsolute, column, rowAbsolute, row);
    }

    @Override
    public String toString() {
        return "CellRef[" + (columnAbsolute ? "$" : "+") + column + "," + (rowAbsolute ? "$" : "+") + row + "]";
    }
}
