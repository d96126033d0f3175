package com.spreadsheet.calc.dao;

import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cell store. Everything is lost on restart.
 */
@Repository
public class InMemorySpreadsheetDao implements SpreadsheetDao {

    // spreadsheetName -> (cellId -> expr)
    private final Map<String, Map<String, String>> spreadsheets = new ConcurrentHashMap<>();

    @Override
    public void setCellExpr(String spreadsheetName, String cellId, String expr) {
        cells(spreadsheetName).put(cellId, expr);
    }

    @Override
    public String query(String spreadsheetName, String cellId) {
        return stored(spreadsheetName).getOrDefault(cellId, "");
    }

    @Override
    public void remove(String spreadsheetName, String cellId) {
        stored(spreadsheetName).remove(cellId);
    }

    @Override
    public void clear(String spreadsheetName) {
        spreadsheets.remove(spreadsheetName);
    }

    @Override
    public List<List<String>> getData(String spreadsheetName) {
        List<List<String>> data = new ArrayList<>();
        stored(spreadsheetName).forEach((cellId, expr) -> data.add(Arrays.asList(cellId, expr)));
        return data;
    }

    // Read-only lookups don't register the spreadsheet
    private Map<String, String> stored(String spreadsheetName) {
        return spreadsheets.getOrDefault(spreadsheetName, Collections.emptyMap());
    }

    private Map<String, String> cells(String spreadsheetName) {
        return spreadsheets.computeIfAbsent(spreadsheetName, k -> new ConcurrentHashMap<>());
    }
}
