package com.spreadsheet.calc.engine;

import com.spreadsheet.calc.models.CellId;
import com.spreadsheet.calc.models.Grid;
import com.spreadsheet.calc.parser.FormulaParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private final FormulaParser parser = new FormulaParser(new Grid(26, 99));
    private CellStore store;

    @BeforeEach
    void setUp() {
        store = new CellStore();
    }

    private static CellId id(String text) {
        return CellId.parse(text);
    }

    private void put(String cell, String expr) {
        store.stage(id(cell), parser.parse(expr, id(cell)));
        store.commit(Map.of());
    }

    @Test
    void testAffectedSetIsTransitiveDependents() {
        put("b1", "a1");
        put("c1", "b1");
        put("d1", "a1+c1");
        put("e1", "z1");
        DependencyGraph graph = DependencyGraph.ofStaged(store);
        assertEquals(Set.of(id("a1"), id("b1"), id("c1"), id("d1")), graph.affectedBy(id("a1")));
        assertEquals(Set.of(id("c1"), id("d1")), graph.affectedBy(id("c1")));
    }

    @Test
    void testPropagationOrderRespectsReferences() {
        put("d1", "a1+c1");
        put("c1", "b1");
        put("b1", "a1");
        List<CellId> order = DependencyGraph.ofStaged(store).propagationOrder(id("a1"));
        assertEquals(List.of(id("a1"), id("b1"), id("c1"), id("d1")), order);
    }

    @Test
    void testFindCycle() {
        put("a1", "c1");
        put("b1", "a1");
        put("c1", "b1");
        DependencyGraph graph = DependencyGraph.ofStaged(store);
        assertEquals(List.of(id("a1"), id("c1"), id("b1")), graph.findCycle(id("a1")));
        assertTrue(DependencyGraph.ofStaged(new CellStore()).findCycle(id("a1")).isEmpty());
    }
}
