package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.exceptions.SyntaxException;
import com.spreadsheet.calc.models.CellId;
import com.spreadsheet.calc.models.Grid;
import com.spreadsheet.calc.models.ast.ApplyNode;
import com.spreadsheet.calc.models.ast.Ast;
import com.spreadsheet.calc.models.ast.CellRef;
import com.spreadsheet.calc.models.ast.NumberNode;
import com.spreadsheet.calc.models.ast.Operator;
import com.spreadsheet.calc.models.ast.RefNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for formula parsing and canonical rendering.
 */
class FormulaParserTest {

    private FormulaParser parser;
    private CellId a1;

    @BeforeEach
    void setUp() {
        parser = new FormulaParser(new Grid(26, 99));
        a1 = CellId.parse("a1");
    }

    @Test
    void testNumberLiteral() {
        Ast ast = parser.parse("42.5", a1);
        assertEquals(Ast.Kind.NUM, ast.getKind());
        assertEquals(42.5, ((NumberNode) ast).getValue());
    }

    @Test
    void testPrecedenceAndAssociativity() {
        // 1+2*3 => +(1, *(2,3))
        ApplyNode plus = (ApplyNode) parser.parse("1+2*3", a1);
        assertEquals(Operator.PLUS, plus.getOperator());
        assertEquals(Operator.TIMES, ((ApplyNode) plus.getOperands().get(1)).getOperator());

        // 8-4-2 groups to the left
        ApplyNode minus = (ApplyNode) parser.parse("8-4-2", a1);
        assertEquals(Ast.Kind.APP, minus.getOperands().get(0).getKind());
        assertEquals(Ast.Kind.NUM, minus.getOperands().get(1).getKind());
    }

    @Test
    void testUnaryMinusHasOneOperand() {
        ApplyNode neg = (ApplyNode) parser.parse("-(3)", a1);
        assertEquals(Operator.MINUS, neg.getOperator());
        assertEquals(1, neg.getOperands().size());
    }

    @Test
    void testMinMaxFunctions() {
        ApplyNode min = (ApplyNode) parser.parse("MIN(a1, 2)", a1);
        assertEquals(Operator.MIN, min.getOperator());
        assertEquals(2, min.getOperands().size());
        assertEquals("max(b2,3)", parser.parse("max( b2 , 3 )", a1).toText(a1));
    }

    @Test
    void testReferencesAreRelativeToTheBaseCell() {
        CellId c3 = CellId.parse("c3");
        RefNode ref = (RefNode) parser.parse("b2", c3);
        assertEquals(CellId.parse("b2"), ref.getRef().resolve(c3));
        // The same tree seen from d4 points one column right and one row down
        assertEquals(CellId.parse("c3"), ref.getRef().resolve(CellId.parse("d4")));
        assertEquals("c3", ref.toText(CellId.parse("d4")));
    }

    @Test
    void testAbsoluteReferencesDoNotMove() {
        CellId c3 = CellId.parse("c3");
        RefNode ref = (RefNode) parser.parse("$b$2", c3);
        CellRef cellRef = ref.getRef();
        assertTrue(cellRef.isColumnAbsolute());
        assertTrue(cellRef.isRowAbsolute());
        assertEquals("$b$2", ref.toText(CellId.parse("f9")));

        RefNode mixed = (RefNode) parser.parse("$b2", c3);
        assertEquals("$b3", mixed.toText(CellId.parse("e4")));
    }

    @Test
    void testCanonicalText() {
        assertEquals("a1+1", parser.parse("A1 + 1", a1).toText(a1));
        assertEquals("(1+2)*3", parser.parse("(1+2)*3", a1).toText(a1));
        assertEquals("1+2*3", parser.parse("1+(2*3)", a1).toText(a1));
        assertEquals("8-(4-2)", parser.parse("8-(4-2)", a1).toText(a1));
        assertEquals("8-4-2", parser.parse("(8-4)-2", a1).toText(a1));
        assertEquals("-(a1+2)", parser.parse("-(a1+2)", a1).toText(a1));
        assertEquals("-3", parser.parse("-(3)", a1).toText(a1));
        assertEquals("2.5", parser.parse("2.50", a1).toText(a1));
    }

    @Test
    void testReferencesListedLeftToRight() {
        List<CellRef> refs = parser.parse("a1+max(b2,c3)*a1", a1).references();
        assertEquals(4, refs.size());
        assertEquals(CellId.parse("c3"), refs.get(2).resolve(a1));
    }

    @Test
    void testSyntaxErrors() {
        assertThrows(SyntaxException.class, () -> parser.parse("", a1));
        assertThrows(SyntaxException.class, () -> parser.parse("1+", a1));
        assertThrows(SyntaxException.class, () -> parser.parse("(1+2", a1));
        assertThrows(SyntaxException.class, () -> parser.parse("1 2", a1));
        assertThrows(SyntaxException.class, () -> parser.parse("foo(1,2)", a1));
        assertThrows(SyntaxException.class, () -> parser.parse("min(1)", a1));
        assertThrows(SyntaxException.class, () -> parser.parse("a1 # 2", a1));
    }

    @Test
    void testEqualPrecedenceRightOperandKeepsParentheses() {
        assertEquals("a1+(b1+c1)", parser.parse("a1+(b1+c1)", a1).toText(a1));
        assertEquals("a1*(b1/c1)", parser.parse("a1*(b1/c1)", a1).toText(a1));
        assertEquals("a1*(b1*c1)", parser.parse("a1*(b1*c1)", a1).toText(a1));
        assertEquals("a1+b1+c1", parser.parse("(a1+b1)+c1", a1).toText(a1));
    }

    @Test
    void testOverflowingLiteralIsSyntaxError() {
        SyntaxException ex = assertThrows(SyntaxException.class, () -> parser.parse("1+1e400", a1));
        assertEquals(2, ex.getPosition());
        assertEquals("1.0E300", parser.parse("1e300", a1).toText(a1));
    }

    @Test
    void testReferenceOutsideGridIsSyntaxError() {
        SyntaxException ex = assertThrows(SyntaxException.class, () -> parser.parse("1+a100", a1));
        assertEquals(2, ex.getPosition());
        assertThrows(SyntaxException.class, () -> parser.parse("a0", a1));
    }
}
