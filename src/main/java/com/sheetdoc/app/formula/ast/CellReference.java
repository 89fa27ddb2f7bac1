package com.sheetdoc.app.formula.ast;

/**
 * A same-document cell, e.g. B5. The address is canonical uppercase.
 */
public final class CellReference implements Expression {
    private final String address;

    public CellReference(String address) {
        this.address = address;
    }

    public String getAddress() {
        return address;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCell(this);
    }
}
