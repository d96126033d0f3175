package com.spreadsheet.calc.engine;

import com.spreadsheet.calc.models.CellId;
import com.spreadsheet.calc.models.ast.Ast;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Formulas and values of one spreadsheet, with room for a single pending edit.
 * <p>
 * Committed state is the authoritative cell -> formula map plus the value last
 * computed for each cell. The staged view is committed state overlaid with the
 * pending edit (a new formula, or a removal when the formula is null).
 * Outside an edit there is no pending change, so staged == committed.
 * <p>
 * Not thread-safe; callers serialize edits.
 */
class CellStore {

    private final Map<CellId, Ast> committed = new HashMap<>();
    private final Map<CellId, Double> values = new HashMap<>();

    private boolean pending;
    private CellId pendingCell;
    private Ast pendingAst;

    /**
     * Opens a transaction editing {@code cellId}. A null ast stages a removal.
     */
    void stage(CellId cellId, Ast ast) {
        if (pending) {
            throw new IllegalStateException("Edit of " + pendingCell + " still in flight, cannot stage " + cellId);
        }
        pending = true;
        pendingCell = cellId;
        pendingAst = ast;
    }

    /**
     * Formula of a cell as seen by the transaction in flight, or null if empty.
     */
    Ast staged(CellId cellId) {
        if (pending && pendingCell.equals(cellId)) {
            return pendingAst;
        }
        return committed.get(cellId);
    }

    /**
     * All non-empty cells as seen by the transaction in flight.
     */
    Set<CellId> stagedCells() {
        Set<CellId> cells = new TreeSet<>(committed.keySet());
        if (pending) {
            if (pendingAst == null) {
                cells.remove(pendingCell);
            } else {
                cells.add(pendingCell);
            }
        }
        return cells;
    }

    /**
     * Makes the pending formula authoritative and records the recomputed values.
     * Only the edited cell's formula changes; dependents only get new values.
     */
    void commit(Map<CellId, Double> updates) {
        if (!pending) {
            throw new IllegalStateException("Nothing staged to commit");
        }
        if (pendingAst == null) {
            committed.remove(pendingCell);
            values.remove(pendingCell);
        } else {
            committed.put(pendingCell, pendingAst);
        }
        values.putAll(updates);
        clearPending();
    }

    /**
     * Discards the pending edit. The edited cell goes back to its committed
     * formula, or to empty if it had none.
     */
    void rollback() {
        clearPending();
    }

    boolean isPending() {
        return pending;
    }

    Ast committed(CellId cellId) {
        return committed.get(cellId);
    }

    // Last committed value; 0 for an empty cell
    double value(CellId cellId) {
        Double value = values.get(cellId);
        return value == null ? 0 : value;
    }

    SortedSet<CellId> committedCells() {
        return new TreeSet<>(committed.keySet());
    }

    void clear() {
        if (pending) {
            throw new IllegalStateException("Cannot clear while an edit of " + pendingCell + " is in flight");
        }
        committed.clear();
        values.clear();
    }

    private void clearPending() {
        pending = false;
        pendingCell = null;
        pendingAst = null;
    }
}
