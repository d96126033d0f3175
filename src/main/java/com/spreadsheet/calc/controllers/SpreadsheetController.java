package com.spreadsheet.calc.controllers;

import com.spreadsheet.calc.exceptions.BadRequestException;
import com.spreadsheet.calc.models.CellInfo;
import com.spreadsheet.calc.services.SpreadsheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for spreadsheets and their cells.
 * The base path comes from spreadsheet.api.base-path ("/api" by default).
 */
@RestController
@RequestMapping("${spreadsheet.api.base-path:/api}")
public class SpreadsheetController {

    @Autowired
    private SpreadsheetService spreadsheetService;

    /**
     * GET /{ssName}/{cellId}
     * Returns { "expr": ..., "value": ... } for the cell; "" and 0 when empty.
     */
    @GetMapping("/{ssName}/{cellId}")
    public ResponseEntity<CellInfo> queryCell(@PathVariable String ssName, @PathVariable String cellId) {
        return ResponseEntity.ok(spreadsheetService.query(ssName, cellId));
    }

    /**
     * PATCH /{ssName}/{cellId}?expr=... sets the cell's formula.
     * PATCH /{ssName}/{cellId}?srcCellId=... copies another cell's formula here.
     * Exactly one of the two must be given. Returns { cellId: value } for every
     * updated cell. Syntax errors and circular references become a 400.
     */
    @PatchMapping("/{ssName}/{cellId}")
    public ResponseEntity<Map<String, Double>> evaluateOrCopyCell(
            @PathVariable String ssName,
            @PathVariable String cellId,
            @RequestParam(required = false) String expr,
            @RequestParam(required = false) String srcCellId
    ) {
        if (expr == null && srcCellId == null) {
            throw new BadRequestException("Must provide either \"expr\" or \"srcCellId\" query parameter");
        }
        if (expr != null && srcCellId != null) {
            throw new BadRequestException("Cannot provide both \"expr\" and \"srcCellId\" query parameters");
        }
        if (expr != null) {
            return ResponseEntity.ok(spreadsheetService.evaluate(ssName, cellId, expr));
        }
        return ResponseEntity.ok(spreadsheetService.copy(ssName, cellId, srcCellId));
    }

    /**
     * DELETE /{ssName}/{cellId}
     * Empties the cell; returns the new values of the cells that depended on it.
     */
    @DeleteMapping("/{ssName}/{cellId}")
    public ResponseEntity<Map<String, Double>> removeCell(@PathVariable String ssName, @PathVariable String cellId) {
        return ResponseEntity.ok(spreadsheetService.remove(ssName, cellId));
    }

    /**
     * GET /{ssName}
     * Returns [[cellId, expr], ...], or [[cellId, expr, value], ...] with withValues=true.
     */
    @GetMapping("/{ssName}")
    public ResponseEntity<List<? extends List<?>>> dumpSpreadsheet(
            @PathVariable String ssName,
            @RequestParam(defaultValue = "false") boolean withValues
    ) {
        if (withValues) {
            return ResponseEntity.ok(spreadsheetService.dumpWithValues(ssName));
        }
        return ResponseEntity.ok(spreadsheetService.dump(ssName));
    }

    /**
     * PUT /{ssName}
     * Body: [[cellId, expr], ...]. Replaces the spreadsheet's contents.
     */
    @PutMapping("/{ssName}")
    public ResponseEntity<Void> loadSpreadsheet(@PathVariable String ssName, @RequestBody List<List<String>> data) {
        spreadsheetService.load(ssName, data);
        return ResponseEntity.ok().build();
    }

    /**
     * DELETE /{ssName}
     * Removes every cell.
     */
    @DeleteMapping("/{ssName}")
    public ResponseEntity<Void> clearSpreadsheet(@PathVariable String ssName) {
        spreadsheetService.clear(ssName);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /{ssName}/forwardDependencies
     * For each cell, the set of cells its formula references.
     */
    @GetMapping("/{ssName}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable String ssName) {
        return ResponseEntity.ok(spreadsheetService.forwardDependencies(ssName));
    }

    /**
     * GET /{ssName}/reverseDependencies
     * For each cell, the set of cells whose formulas reference it.
     */
    @GetMapping("/{ssName}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable String ssName) {
        return ResponseEntity.ok(spreadsheetService.reverseDependencies(ssName));
    }
}
