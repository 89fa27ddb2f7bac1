package com.sheetdoc.app.formula.ast;

import com.sheetdoc.app.models.PageReference;

/**
 * A cell on another page, e.g. {@code @[Budget](p1):B2}.
 */
public final class ExternalCellReference implements Expression {
    private final PageReference page;
    private final String address;

    public ExternalCellReference(PageReference page, String address) {
        this.page = page;
        this.address = address;
    }

    public PageReference getPage() {
        return page;
    }

    public String getAddress() {
        return address;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitExternalCell(this);
    }
}
