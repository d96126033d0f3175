package com.spreadsheet.calc.models.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperatorTest {

    @Test
    void testMinusIsUnaryOrBinary() {
        assertEquals(-4.0, Operator.MINUS.apply(new double[]{4}));
        assertEquals(1.0, Operator.MINUS.apply(new double[]{5, 4}));
    }

    @Test
    void testFromSymbol() {
        assertEquals(Operator.MAX, Operator.fromSymbol("MAX"));
        assertEquals(Operator.DIVIDE, Operator.fromSymbol("/"));
    }

    @Test
    void testContractBreachesAreInternalFaults() {
        assertThrows(IllegalStateException.class, () -> Operator.fromSymbol("^"));
        assertThrows(IllegalStateException.class, () -> Operator.PLUS.apply(new double[]{1}));
        assertThrows(IllegalStateException.class, () -> Operator.MIN.apply(new double[]{1, 2, 3}));
    }
}
