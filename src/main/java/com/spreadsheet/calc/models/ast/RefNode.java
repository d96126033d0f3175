package com.spreadsheet.calc.models.ast;

import com.spreadsheet.calc.models.CellId;

import java.util.List;

/**
 * Reference to another cell. The target depends on where the formula lives.
 */
public final class RefNode extends Ast {
    private final CellRef ref;

    public RefNode(CellRef ref) {
        this.ref = ref;
    }

    public CellRef getRef() {
        return ref;
    }

    @Override
    public Kind getKind() {
        return Kind.REF;
    }

    @Override
    public String toText(CellId base) {
        return ref.toText(base);
    }

    @Override
    int precedence() {
        return PRIMARY;
    }

    @Override
    void collectReferences(List<CellRef> refs) {
        refs.add(ref);
    }
}
