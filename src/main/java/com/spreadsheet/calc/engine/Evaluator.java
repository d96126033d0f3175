package com.spreadsheet.calc.engine;

import com.spreadsheet.calc.models.CellId;
import com.spreadsheet.calc.models.ast.ApplyNode;
import com.spreadsheet.calc.models.ast.Ast;
import com.spreadsheet.calc.models.ast.NumberNode;
import com.spreadsheet.calc.models.ast.RefNode;

import java.util.List;
import java.util.Map;

/**
 * Computes the value of a formula against the staged view of a {@link CellStore}.
 * <p>
 * A referenced cell is read from the per-edit memo if it has been recomputed in
 * this edit, from the committed values if it is unaffected by the edit, and is
 * 0 if it is empty. Callers evaluate cells in dependency order, so the memo
 * already holds every recomputed cell a formula can reach.
 */
class Evaluator {

    private final CellStore store;

    Evaluator(CellStore store) {
        this.store = store;
    }

    double evaluate(Ast ast, CellId atCell, Map<CellId, Double> memo) {
        switch (ast.getKind()) {
            case NUM:
                return ((NumberNode) ast).getValue();
            case REF: {
                CellId target = ((RefNode) ast).getRef().resolve(atCell);
                Double recomputed = memo.get(target);
                if (recomputed != null) {
                    return recomputed;
                }
                if (store.staged(target) == null) {
                    return 0;
                }
                return store.value(target);
            }
            case APP: {
                ApplyNode app = (ApplyNode) ast;
                List<Ast> operands = app.getOperands();
                double[] args = new double[operands.size()];
                for (int i = 0; i < args.length; i++) {
                    args[i] = evaluate(operands.get(i), atCell, memo);
                }
                return app.getOperator().apply(args);
            }
            default:
                throw new IllegalStateException("Unknown formula kind " + ast.getKind());
        }
    }
}
