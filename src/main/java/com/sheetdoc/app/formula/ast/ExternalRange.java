package com.sheetdoc.app.formula.ast;

import com.sheetdoc.app.models.CellAddress;
import com.sheetdoc.app.models.PageReference;

import java.util.List;

/**
 * A rectangle on another page, e.g. {@code @[Budget]:A1:A5}.
 */
public final class ExternalRange implements Expression {
    private final PageReference page;
    private final CellReference start;
    private final CellReference end;

    public ExternalRange(PageReference page, CellReference start, CellReference end) {
        this.page = page;
        this.start = start;
        this.end = end;
    }

    public PageReference getPage() {
        return page;
    }

    public CellReference getStart() {
        return start;
    }

    public CellReference getEnd() {
        return end;
    }

    public List<String> addresses() {
        return CellAddress.expandRange(start.getAddress(), end.getAddress());
    }

    public long size() {
        return CellAddress.rangeSize(start.getAddress(), end.getAddress());
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitExternalRange(this);
    }
}
