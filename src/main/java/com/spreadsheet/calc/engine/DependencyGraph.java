package com.spreadsheet.calc.engine;

import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.models.CellId;
import com.spreadsheet.calc.models.ast.Ast;
import com.spreadsheet.calc.models.ast.CellRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Reference graph of a spreadsheet.
 * Forward edges run from a cell to the cells its formula references;
 * reverse edges run from a cell to the cells whose formulas reference it.
 */
final class DependencyGraph {

    private final SortedMap<CellId, SortedSet<CellId>> forward;
    private final SortedMap<CellId, SortedSet<CellId>> reverse;

    private DependencyGraph(SortedMap<CellId, SortedSet<CellId>> forward,
                            SortedMap<CellId, SortedSet<CellId>> reverse) {
        this.forward = forward;
        this.reverse = reverse;
    }

    /**
     * Builds the graph of the staged view: the pending edit is included.
     */
    static DependencyGraph ofStaged(CellStore store) {
        SortedMap<CellId, SortedSet<CellId>> forward = new TreeMap<>();
        SortedMap<CellId, SortedSet<CellId>> reverse = new TreeMap<>();
        for (CellId cell : store.stagedCells()) {
            Ast ast = store.staged(cell);
            SortedSet<CellId> targets = forward.computeIfAbsent(cell, k -> new TreeSet<>());
            reverse.computeIfAbsent(cell, k -> new TreeSet<>());
            for (CellRef ref : ast.references()) {
                CellId target = ref.resolve(cell);
                targets.add(target);
                forward.computeIfAbsent(target, k -> new TreeSet<>());
                reverse.computeIfAbsent(target, k -> new TreeSet<>()).add(cell);
            }
        }
        return new DependencyGraph(forward, reverse);
    }

    SortedSet<CellId> precedents(CellId cell) {
        return forward.getOrDefault(cell, Collections.emptySortedSet());
    }

    SortedSet<CellId> dependents(CellId cell) {
        return reverse.getOrDefault(cell, Collections.emptySortedSet());
    }

    /**
     * {@code start} plus every cell that depends on it, directly or transitively.
     */
    Set<CellId> affectedBy(CellId start) {
        Set<CellId> visited = new HashSet<>();
        Queue<CellId> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            CellId current = queue.poll();
            for (CellId dependent : dependents(current)) {
                if (visited.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return visited;
    }

    /**
     * Orders {@code start} and its transitive dependents so every cell comes after
     * the cells it references (Kahn's algorithm over the affected subgraph).
     * <p>
     * The committed graph is acyclic, so a cycle created by editing {@code start}
     * must pass through it and lies entirely inside the affected set. If the sort
     * cannot place every affected cell, such a cycle exists.
     */
    List<CellId> propagationOrder(CellId start) {
        Set<CellId> affected = affectedBy(start);
        Map<CellId, Integer> pendingPrecedents = new HashMap<>();
        for (CellId cell : affected) {
            int count = 0;
            for (CellId precedent : precedents(cell)) {
                if (affected.contains(precedent)) {
                    count++;
                }
            }
            pendingPrecedents.put(cell, count);
        }

        Deque<CellId> ready = new ArrayDeque<>();
        for (CellId cell : new TreeSet<>(affected)) {
            if (pendingPrecedents.get(cell) == 0) {
                ready.add(cell);
            }
        }
        List<CellId> order = new ArrayList<>(affected.size());
        while (!ready.isEmpty()) {
            CellId cell = ready.poll();
            order.add(cell);
            for (CellId dependent : dependents(cell)) {
                if (!affected.contains(dependent)) {
                    continue;
                }
                int remaining = pendingPrecedents.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < affected.size()) {
            List<CellId> cycle = findCycle(start);
            String cells = cycle.stream().map(CellId::toString).collect(Collectors.joining(", "));
            throw new CircularReferenceException("circular reference involving " + cells,
                    cycle.stream().map(CellId::toString).collect(Collectors.toList()));
        }
        return order;
    }

    /**
     * A reference path from {@code start} back to itself, found by an iterative
     * depth-first walk over forward edges. Empty if there is none.
     */
    List<CellId> findCycle(CellId start) {
        Deque<CellId> path = new ArrayDeque<>();
        Deque<Iterator<CellId>> pending = new ArrayDeque<>();
        Set<CellId> explored = new HashSet<>();
        path.addLast(start);
        pending.addLast(precedents(start).iterator());
        explored.add(start);
        while (!pending.isEmpty()) {
            Iterator<CellId> next = pending.peekLast();
            if (!next.hasNext()) {
                pending.removeLast();
                path.removeLast();
                continue;
            }
            CellId target = next.next();
            if (target.equals(start)) {
                return new ArrayList<>(path);
            }
            if (explored.add(target)) {
                path.addLast(target);
                pending.addLast(precedents(target).iterator());
            }
        }
        return Collections.emptyList();
    }

    /**
     * Adjacency as strings, cells in grid order. Every cell that appears on
     * either end of an edge has an entry, possibly empty.
     */
    static Map<String, Set<String>> toStrings(SortedMap<CellId, SortedSet<CellId>> adjacency) {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        adjacency.forEach((cell, targets) -> result.put(cell.toString(),
                targets.stream().map(CellId::toString).collect(Collectors.toCollection(LinkedHashSet::new))));
        return result;
    }

    SortedMap<CellId, SortedSet<CellId>> getForward() {
        return forward;
    }

    SortedMap<CellId, SortedSet<CellId>> getReverse() {
        return reverse;
    }
}
