package com.sheetdoc.app.formula.ast;

import com.sheetdoc.app.models.CellAddress;

import java.util.List;

/**
 * A same-document rectangle, e.g. A1:B3.
 */
public final class Range implements Expression {
    private final CellReference start;
    private final CellReference end;

    public Range(CellReference start, CellReference end) {
        this.start = start;
        this.end = end;
    }

    public CellReference getStart() {
        return start;
    }

    public CellReference getEnd() {
        return end;
    }

    /**
     * Member addresses in row-major order.
     */
    public List<String> addresses() {
        return CellAddress.expandRange(start.getAddress(), end.getAddress());
    }

    public long size() {
        return CellAddress.rangeSize(start.getAddress(), end.getAddress());
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitRange(this);
    }
}
