package com.sheetdoc.app.formula.ast;

public interface ExpressionVisitor<R> {
    R visitNumber(NumberLiteral node);

    R visitString(StringLiteral node);

    R visitBoolean(BooleanLiteral node);

    R visitCell(CellReference node);

    R visitRange(Range node);

    R visitExternalCell(ExternalCellReference node);

    R visitExternalRange(ExternalRange node);

    R visitUnary(UnaryExpression node);

    R visitBinary(BinaryExpression node);

    R visitFunctionCall(FunctionCall node);
}
