package com.spreadsheet.calc.engine;

import com.spreadsheet.calc.exceptions.BadRequestException;
import com.spreadsheet.calc.models.CellId;
import com.spreadsheet.calc.models.CellInfo;
import com.spreadsheet.calc.models.Grid;
import com.spreadsheet.calc.models.ast.Ast;
import com.spreadsheet.calc.models.ast.CellRef;
import com.spreadsheet.calc.parser.FormulaParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * In-memory formula engine for one spreadsheet.
 * <p>
 * Each edit runs as a transaction against the {@link CellStore}:
 * <ol>
 *   <li>parse the formula (nothing is staged if this fails)</li>
 *   <li>stage the new formula for the edited cell</li>
 *   <li>order the edited cell and its transitive dependents, failing on a cycle</li>
 *   <li>evaluate each of them once, in that order</li>
 *   <li>commit, or roll back if anything failed</li>
 * </ol>
 * The returned update map holds exactly the edited cell and its transitive
 * dependents, with their new values. Committed state never changes on failure.
 * <p>
 * Not thread-safe: callers must serialize edits. Reads may run between edits.
 */
public class Spreadsheet {

    private static final Logger log = LoggerFactory.getLogger(Spreadsheet.class);

    private final String name;
    private final Grid grid;
    private final FormulaParser parser;
    private final CellStore store = new CellStore();
    private final Evaluator evaluator = new Evaluator(store);

    public Spreadsheet(String name, Grid grid) {
        this.name = name;
        this.grid = grid;
        this.parser = new FormulaParser(grid);
    }

    public String getName() {
        return name;
    }

    public Grid getGrid() {
        return grid;
    }

    /**
     * Sets the formula of {@code cellId} and recomputes everything depending on it.
     * Throws SyntaxException or CircularReferenceException without changing anything.
     */
    public SortedMap<CellId, Double> eval(CellId cellId, String expr) {
        Ast ast = parser.parse(expr, cellId);
        return apply(cellId, ast);
    }

    /**
     * Empties {@code cellId}. Dependents now see 0; they are returned with their
     * new values, the removed cell is not.
     */
    public SortedMap<CellId, Double> remove(CellId cellId) {
        if (store.committed(cellId) == null) {
            return new TreeMap<>();
        }
        return apply(cellId, null);
    }

    /**
     * Copies the formula of {@code src} into {@code dest}. Relative references
     * shift by the distance between the two cells; absolute ones stay put.
     * Copying an empty cell empties the destination.
     */
    public SortedMap<CellId, Double> copy(CellId dest, CellId src) {
        Ast ast = store.committed(src);
        if (ast == null) {
            return remove(dest);
        }
        for (CellRef ref : ast.references()) {
            if (!grid.contains(ref.columnAt(dest), ref.rowAt(dest))) {
                throw new BadRequestException("Copying " + src + " to " + dest
                        + " moves a reference off the grid");
            }
        }
        return apply(dest, ast);
    }

    public CellInfo query(CellId cellId) {
        Ast ast = store.committed(cellId);
        if (ast == null) {
            return new CellInfo("", 0);
        }
        return new CellInfo(ast.toText(cellId), store.value(cellId));
    }

    /**
     * [cellId, expr] for every non-empty cell, in grid order.
     */
    public List<List<String>> dump() {
        List<List<String>> data = new ArrayList<>();
        for (CellId cellId : store.committedCells()) {
            data.add(Arrays.asList(cellId.toString(), store.committed(cellId).toText(cellId)));
        }
        return data;
    }

    /**
     * [cellId, expr, value] for every non-empty cell, in grid order.
     */
    public List<List<Object>> dumpWithValues() {
        List<List<Object>> data = new ArrayList<>();
        for (CellId cellId : store.committedCells()) {
            data.add(Arrays.asList(cellId.toString(), store.committed(cellId).toText(cellId),
                    store.value(cellId)));
        }
        return data;
    }

    public boolean isEmpty() {
        return store.committedCells().isEmpty();
    }

    public void clear() {
        store.clear();
    }

    /**
     * For each cell, the cells its formula references.
     */
    public Map<String, Set<String>> forwardDependencies() {
        return DependencyGraph.toStrings(DependencyGraph.ofStaged(store).getForward());
    }

    /**
     * For each cell, the cells whose formulas reference it.
     */
    public Map<String, Set<String>> reverseDependencies() {
        return DependencyGraph.toStrings(DependencyGraph.ofStaged(store).getReverse());
    }

    private SortedMap<CellId, Double> apply(CellId cellId, Ast ast) {
        store.stage(cellId, ast);
        SortedMap<CellId, Double> updates;
        try {
            List<CellId> order = DependencyGraph.ofStaged(store).propagationOrder(cellId);
            Map<CellId, Double> memo = new HashMap<>();
            for (CellId cell : order) {
                Ast formula = store.staged(cell);
                memo.put(cell, formula == null ? 0 : evaluator.evaluate(formula, cell, memo));
            }
            updates = new TreeMap<>(memo);
            if (ast == null) {
                updates.remove(cellId);
            }
        } catch (RuntimeException e) {
            store.rollback();
            throw e;
        }
        store.commit(updates);
        log.debug("{}: committed {} -> {} updates", name, cellId, updates.size());
        return Collections.unmodifiableSortedMap(updates);
    }
}
