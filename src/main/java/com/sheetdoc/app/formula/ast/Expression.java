package com.sheetdoc.app.formula.ast;

/**
 * A node of a parsed formula. Nodes are immutable.
 */
public interface Expression {
    <R> R accept(ExpressionVisitor<R> visitor);
}
