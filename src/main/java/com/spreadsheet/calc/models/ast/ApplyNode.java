package com.spreadsheet.calc.models.ast;

import com.spreadsheet.calc.models.CellId;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Operator application. Operand order matters for - and /.
 */
public final class ApplyNode extends Ast {
    private final Operator operator;
    private final List<Ast> operands;

    public ApplyNode(Operator operator, List<Ast> operands) {
        this.operator = operator;
        this.operands = List.copyOf(operands);
    }

    public Operator getOperator() {
        return operator;
    }

    public List<Ast> getOperands() {
        return operands;
    }

    @Override
    public Kind getKind() {
        return Kind.APP;
    }

    @Override
    public String toText(CellId base) {
        if (operator.isFunction()) {
            return operator.getSymbol() + "(" + operands.stream()
                    .map(a -> a.toText(base))
                    .collect(Collectors.joining(",")) + ")";
        }
        if (operands.size() == 1) {
            Ast operand = operands.get(0);
            String text = operand.toText(base);
            return "-" + (operand.precedence() < PRIMARY ? "(" + text + ")" : text);
        }
        Ast left = operands.get(0);
        Ast right = operands.get(1);
        int prec = precedence();
        String leftText = left.toText(base);
        String rightText = right.toText(base);
        if (left.precedence() < prec) {
            leftText = "(" + leftText + ")";
        }
        // Operators group to the left, so a right operand of equal precedence
        // keeps its parentheses: a+(b+c) is not a+b+c in floating point
        if (right.precedence() <= prec) {
            rightText = "(" + rightText + ")";
        }
        return leftText + operator.getSymbol() + rightText;
    }

    @Override
    int precedence() {
        if (operator.isFunction() || operands.size() == 1) {
            return PRIMARY;
        }
        return operator.getPrecedence();
    }

    @Override
    void collectReferences(List<CellRef> refs) {
        for (Ast operand : operands) {
            operand.collectReferences(refs);
        }
    }
}
