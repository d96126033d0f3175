package com.spreadsheet.calc.dao;

import java.util.List;

/**
 * Keeps the formula text of every cell, keyed by spreadsheet name and cell id.
 * Knows nothing about evaluation; the service mirrors committed edits into it.
 */
public interface SpreadsheetDao {

    void setCellExpr(String spreadsheetName, String cellId, String expr);

    /**
     * Formula text of the cell, or "" for an empty or unknown cell.
     */
    String query(String spreadsheetName, String cellId);

    void remove(String spreadsheetName, String cellId);

    void clear(String spreadsheetName);

    /**
     * [cellId, expr] pairs for every stored cell of the spreadsheet.
     */
    List<List<String>> getData(String spreadsheetName);
}
