package com.spreadsheet.calc.exceptions;

/**
 * Simple DTO to structure error responses with a code and message.
 * For example:
 * {
 *   "code": "CIRCULAR_REF",
 *   "message": "circular reference involving a1, b1"
 * }
 */
public class ErrorResponse {
    public static final String SYNTAX = "SYNTAX";
    public static final String CIRCULAR_REF = "CIRCULAR_REF";
    public static final String BAD_REQ = "BAD_REQ";
    public static final String INTERNAL = "INTERNAL";

    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
