package com.sheetdoc.app.formula.ast;

/**
 * Prefix + or -.
 */
public final class UnaryExpression implements Expression {
    private final Operator operator;
    private final Expression argument;

    public UnaryExpression(Operator operator, Expression argument) {
        this.operator = operator;
        this.argument = argument;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getArgument() {
        return argument;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
