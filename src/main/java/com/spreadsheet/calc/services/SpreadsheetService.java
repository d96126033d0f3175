package com.spreadsheet.calc.services;

import com.spreadsheet.calc.dao.SpreadsheetDao;
import com.spreadsheet.calc.engine.Spreadsheet;
import com.spreadsheet.calc.exceptions.BadRequestException;
import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.exceptions.SyntaxException;
import com.spreadsheet.calc.models.CellId;
import com.spreadsheet.calc.models.CellInfo;
import com.spreadsheet.calc.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Main business logic: owns every named spreadsheet, serializes edits to each
 * one and mirrors committed formulas into the {@link SpreadsheetDao}.
 * <p>
 * Spreadsheets are created on first use, starting from whatever the DAO holds.
 * Edits take the spreadsheet's write lock; queries take its read lock.
 */
@Service
public class SpreadsheetService {

    private static final Logger log = LoggerFactory.getLogger(SpreadsheetService.class);

    private final SpreadsheetDao dao;
    private final Grid grid;

    // All open spreadsheets, by name
    private final Map<String, Handle> spreadsheets = new ConcurrentHashMap<>();

    public SpreadsheetService(SpreadsheetDao dao, Grid grid) {
        this.dao = dao;
        this.grid = grid;
    }

    /**
     * Sets {@code cellId} to the formula {@code expr}. Returns the new value of
     * the cell and of every cell depending on it, keyed by cell id.
     */
    public Map<String, Double> evaluate(String ssName, String cellId, String expr) {
        CellId id = grid.cellId(cellId);
        return write(ssName, handle -> {
            SortedMap<CellId, Double> updates = rejecting(ssName, id,
                    () -> handle.spreadsheet.eval(id, expr));
            dao.setCellExpr(ssName, id.toString(), handle.spreadsheet.query(id).getExpr());
            return toStrings(updates);
        });
    }

    /**
     * Copies the formula of {@code srcCellId} into {@code destCellId},
     * shifting its relative references.
     */
    public Map<String, Double> copy(String ssName, String destCellId, String srcCellId) {
        CellId dest = grid.cellId(destCellId);
        CellId src = grid.cellId(srcCellId);
        return write(ssName, handle -> {
            SortedMap<CellId, Double> updates = rejecting(ssName, dest,
                    () -> handle.spreadsheet.copy(dest, src));
            String expr = handle.spreadsheet.query(dest).getExpr();
            if (expr.isEmpty()) {
                dao.remove(ssName, dest.toString());
            } else {
                dao.setCellExpr(ssName, dest.toString(), expr);
            }
            return toStrings(updates);
        });
    }

    /**
     * Empties {@code cellId}; returns the new values of its dependents.
     */
    public Map<String, Double> remove(String ssName, String cellId) {
        CellId id = grid.cellId(cellId);
        return write(ssName, handle -> {
            SortedMap<CellId, Double> updates = handle.spreadsheet.remove(id);
            dao.remove(ssName, id.toString());
            return toStrings(updates);
        });
    }

    public CellInfo query(String ssName, String cellId) {
        CellId id = grid.cellId(cellId);
        return read(ssName, handle -> handle.spreadsheet.query(id));
    }

    public List<List<String>> dump(String ssName) {
        return read(ssName, handle -> handle.spreadsheet.dump());
    }

    public List<List<Object>> dumpWithValues(String ssName) {
        return read(ssName, handle -> handle.spreadsheet.dumpWithValues());
    }

    public Map<String, Set<String>> forwardDependencies(String ssName) {
        return read(ssName, handle -> handle.spreadsheet.forwardDependencies());
    }

    public Map<String, Set<String>> reverseDependencies(String ssName) {
        return read(ssName, handle -> handle.spreadsheet.reverseDependencies());
    }

    public void clear(String ssName) {
        write(ssName, handle -> {
            handle.spreadsheet.clear();
            dao.clear(ssName);
            return null;
        });
    }

    /**
     * Replaces the whole spreadsheet with the given [cellId, expr] pairs,
     * evaluated in order. If any pair fails, the old contents stay.
     */
    public void load(String ssName, List<List<String>> data) {
        if (data == null) {
            throw new BadRequestException("Missing spreadsheet data");
        }
        write(ssName, handle -> {
            Spreadsheet loaded = new Spreadsheet(ssName, grid);
            for (List<String> pair : data) {
                if (pair == null || pair.size() != 2) {
                    throw new BadRequestException("Expected [cellId, expr] pairs, got " + pair);
                }
                CellId id = grid.cellId(pair.get(0));
                rejecting(ssName, id, () -> loaded.eval(id, pair.get(1)));
            }
            handle.spreadsheet = loaded;
            dao.clear(ssName);
            for (List<String> cell : loaded.dump()) {
                dao.setCellExpr(ssName, cell.get(0), cell.get(1));
            }
            log.debug("{}: loaded {} cells", ssName, data.size());
            return null;
        });
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private interface Operation<T> {
        T run(Handle handle);
    }

    private <T> T write(String ssName, Operation<T> operation) {
        Handle handle = open(ssName);
        handle.lock.writeLock().lock();
        try {
            return operation.run(handle);
        } finally {
            handle.lock.writeLock().unlock();
        }
    }

    private <T> T read(String ssName, Operation<T> operation) {
        Handle handle = spreadsheets.get(requireName(ssName));
        if (handle == null) {
            if (dao.getData(ssName).isEmpty()) {
                // Nothing stored under this name: answer from an empty view, don't register it
                return operation.run(new Handle(new Spreadsheet(ssName, grid)));
            }
            handle = open(ssName);
        }
        handle.lock.readLock().lock();
        try {
            return operation.run(handle);
        } finally {
            handle.lock.readLock().unlock();
        }
    }

    private Handle open(String ssName) {
        return spreadsheets.computeIfAbsent(requireName(ssName), this::restore);
    }

    private static String requireName(String ssName) {
        if (ssName == null || ssName.isBlank()) {
            throw new BadRequestException("Missing spreadsheet name");
        }
        return ssName;
    }

    /**
     * Rebuilds a spreadsheet from the formulas the DAO holds for it.
     */
    private Handle restore(String ssName) {
        Spreadsheet spreadsheet = new Spreadsheet(ssName, grid);
        List<List<String>> stored = dao.getData(ssName);
        for (List<String> cell : stored) {
            spreadsheet.eval(grid.cellId(cell.get(0)), cell.get(1));
        }
        log.info("Opened spreadsheet {} with {} stored cells", ssName, stored.size());
        return new Handle(spreadsheet);
    }

    // Logs edits rejected for user-caused reasons before passing them on
    private static SortedMap<CellId, Double> rejecting(String ssName, CellId cellId,
                                                       Supplier<SortedMap<CellId, Double>> edit) {
        try {
            return edit.get();
        } catch (SyntaxException | CircularReferenceException ex) {
            log.warn("{}: rejected edit of {}: {}", ssName, cellId, ex.getMessage());
            throw ex;
        }
    }

    private static Map<String, Double> toStrings(SortedMap<CellId, Double> updates) {
        Map<String, Double> result = new LinkedHashMap<>();
        updates.forEach((cellId, value) -> result.put(cellId.toString(), value));
        return result;
    }

    private static class Handle {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private Spreadsheet spreadsheet;

        Handle(Spreadsheet spreadsheet) {
            this.spreadsheet = spreadsheet;
        }
    }
}
