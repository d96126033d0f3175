package com.spreadsheet.calc.exceptions;

/**
 * Thrown for malformed requests that never reach evaluation:
 * a cell id outside the grid, both or neither of expr/srcCellId,
 * or a copy whose rebased references fall off the grid.
 */
public class BadRequestException extends RuntimeException {
    public BadRequestException(String message) {
        super(message);
    }
}
