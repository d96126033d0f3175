package com.spreadsheet.calc.models;

import com.spreadsheet.calc.exceptions.BadRequestException;

/**
 * Fixed bounds of every spreadsheet, set once at start-up.
 */
public class Grid {
    private final int maxColumns;
    private final int maxRows;

    public Grid(int maxColumns, int maxRows) {
        if (maxColumns < 1 || maxRows < 1) {
            throw new IllegalArgumentException("Grid must have at least one row and column");
        }
        this.maxColumns = maxColumns;
        this.maxRows = maxRows;
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public int getMaxRows() {
        return maxRows;
    }

    /**
     * True if the 0-based column and 1-based row lie inside the grid.
     */
    public boolean contains(int column, int row) {
        return column >= 0 && column < maxColumns && row >= 1 && row <= maxRows;
    }

    public boolean contains(CellId cellId) {
        return contains(cellId.getColumn(), cellId.getRow());
    }

    /**
     * Parses a caller-supplied cell id, rejecting malformed or off-grid ids.
     */
    public CellId cellId(String text) {
        CellId cellId = CellId.parse(text);
        if (cellId == null) {
            throw new BadRequestException("Bad cell id: " + text);
        }
        if (!contains(cellId)) {
            throw new BadRequestException("Cell " + cellId + " is outside the "
                    + maxColumns + "x" + maxRows + " grid");
        }
        return cellId;
    }
}
