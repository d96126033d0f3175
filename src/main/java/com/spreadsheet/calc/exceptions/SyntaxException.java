package com.spreadsheet.calc.exceptions;

/**
 * Thrown when formula text cannot be parsed.
 * Raised before anything is staged, so no state changes.
 */
public class SyntaxException extends RuntimeException {
    private final int position;

    public SyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    // Offset into the formula text where parsing stopped
    public int getPosition() {
        return position;
    }
}
