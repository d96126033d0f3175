package com.spreadsheet.calc.exceptions;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when an edit would make a cell depend on itself,
 * either directly (a1 = a1+1) or through a loop of other cells.
 * The edit is rolled back before this escapes the engine.
 */
public class CircularReferenceException extends RuntimeException {
    private final List<String> cells;

    public CircularReferenceException(String message, Collection<String> cells) {
        super(message);
        this.cells = List.copyOf(cells);
    }

    /**
     * Ids of the cells found on the cycle.
     */
    public List<String> getCells() {
        return cells;
    }
}
