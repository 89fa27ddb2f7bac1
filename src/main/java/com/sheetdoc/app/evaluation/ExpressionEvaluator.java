package com.sheetdoc.app.evaluation;

import com.sheetdoc.app.evaluation.functions.FunctionArguments;
import com.sheetdoc.app.evaluation.functions.FunctionLibrary;
import com.sheetdoc.app.formula.ast.BinaryExpression;
import com.sheetdoc.app.formula.ast.BooleanLiteral;
import com.sheetdoc.app.formula.ast.CellReference;
import com.sheetdoc.app.formula.ast.Expression;
import com.sheetdoc.app.formula.ast.ExpressionVisitor;
import com.sheetdoc.app.formula.ast.ExternalCellReference;
import com.sheetdoc.app.formula.ast.ExternalRange;
import com.sheetdoc.app.formula.ast.FunctionCall;
import com.sheetdoc.app.formula.ast.NumberLiteral;
import com.sheetdoc.app.formula.ast.Operator;
import com.sheetdoc.app.formula.ast.Range;
import com.sheetdoc.app.formula.ast.StringLiteral;
import com.sheetdoc.app.formula.ast.UnaryExpression;
import com.sheetdoc.app.models.CellValue;
import com.sheetdoc.app.models.PageReference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.DoubleBinaryOperator;

/**
 * Evaluates an expression tree to a list of values: one value for scalars,
 * the member cells in row-major order for ranges. Operators use the first
 * value of each operand.
 */
final class ExpressionEvaluator implements ExpressionVisitor<Result<List<CellValue>>> {

    private final FunctionLibrary functions;
    private final CellValueProvider cells;

    ExpressionEvaluator(FunctionLibrary functions, CellValueProvider cells) {
        this.functions = functions;
        this.cells = cells;
    }

    Result<CellValue> evaluate(Expression expression) {
        return expression.accept(this).map(ExpressionEvaluator::first);
    }

    @Override
    public Result<List<CellValue>> visitNumber(NumberLiteral node) {
        return single(CellValue.number(node.getValue()));
    }

    @Override
    public Result<List<CellValue>> visitString(StringLiteral node) {
        return single(CellValue.string(node.getValue()));
    }

    @Override
    public Result<List<CellValue>> visitBoolean(BooleanLiteral node) {
        return single(CellValue.bool(node.getValue()));
    }

    @Override
    public Result<List<CellValue>> visitCell(CellReference node) {
        return cells.local(node.getAddress()).map(Collections::singletonList);
    }

    @Override
    public Result<List<CellValue>> visitRange(Range node) {
        List<CellValue> values = new ArrayList<>();
        for (String address : node.addresses()) {
            Result<CellValue> value = cells.local(address);
            if (value.isError()) {
                return value.propagate();
            }
            values.add(value.getValue());
        }
        return Result.ok(values);
    }

    @Override
    public Result<List<CellValue>> visitExternalCell(ExternalCellReference node) {
        return cells.external(node.getPage(), node.getAddress()).map(Collections::singletonList);
    }

    @Override
    public Result<List<CellValue>> visitExternalRange(ExternalRange node) {
        PageReference page = node.getPage();
        List<CellValue> values = new ArrayList<>();
        for (String address : node.addresses()) {
            Result<CellValue> value = cells.external(page, address);
            if (value.isError()) {
                return value.propagate();
            }
            values.add(value.getValue());
        }
        return Result.ok(values);
    }

    @Override
    public Result<List<CellValue>> visitUnary(UnaryExpression node) {
        return evaluate(node.getArgument())
                .flatMap(ValueCoercion::coerceNumber)
                .map(number -> Collections.singletonList(CellValue.number(
                        node.getOperator() == Operator.SUBTRACT ? -number : number)));
    }

    @Override
    public Result<List<CellValue>> visitBinary(BinaryExpression node) {
        Result<CellValue> left = evaluate(node.getLeft());
        if (left.isError()) {
            return left.propagate();
        }
        Result<CellValue> right = evaluate(node.getRight());
        if (right.isError()) {
            return right.propagate();
        }
        return apply(node, left.getValue(), right.getValue()).map(Collections::singletonList);
    }

    @Override
    public Result<List<CellValue>> visitFunctionCall(FunctionCall node) {
        FunctionArguments arguments = new FunctionArguments(node.getName(), node.getArguments(),
                argument -> argument.accept(this));
        return functions.call(arguments).map(Collections::singletonList);
    }

    private Result<CellValue> apply(BinaryExpression node, CellValue left, CellValue right) {
        switch (node.getOperator()) {
            case ADD:
                // numeric when both sides are numeric, otherwise "hello"+"world" = "helloworld"
                if (ValueCoercion.isNumeric(left) && ValueCoercion.isNumeric(right)) {
                    return arithmetic(left, right, Double::sum);
                }
                return Result.ok(CellValue.string(ValueCoercion.display(left) + ValueCoercion.display(right)));
            case SUBTRACT:
                return arithmetic(left, right, (a, b) -> a - b);
            case MULTIPLY:
                return arithmetic(left, right, (a, b) -> a * b);
            case DIVIDE:
                return ValueCoercion.coerceNumber(right).flatMap(denominator -> {
                    if (denominator == 0) {
                        return Result.fail(EvalErrorCode.DIVISION_BY_ZERO, "Division by zero");
                    }
                    return ValueCoercion.coerceNumber(left).map(numerator -> CellValue.number(numerator / denominator));
                });
            case POWER:
                return arithmetic(left, right, Math::pow);
            case CONCAT:
                return Result.ok(CellValue.string(ValueCoercion.display(left) + ValueCoercion.display(right)));
            case EQUAL:
                return Result.ok(CellValue.bool(equal(left, right)));
            case NOT_EQUAL:
                return Result.ok(CellValue.bool(!equal(left, right)));
            case GREATER:
                return compare(left, right).map(order -> CellValue.bool(order > 0));
            case LESS:
                return compare(left, right).map(order -> CellValue.bool(order < 0));
            case GREATER_EQUAL:
                return compare(left, right).map(order -> CellValue.bool(order >= 0));
            case LESS_EQUAL:
                return compare(left, right).map(order -> CellValue.bool(order <= 0));
            default:
                throw new IllegalStateException("Unsupported operator " + node.getOperator());
        }
    }

    private static Result<CellValue> arithmetic(CellValue left, CellValue right,
                                                DoubleBinaryOperator operation) {
        return ValueCoercion.coerceNumber(left).flatMap(a -> ValueCoercion.coerceNumber(right)
                .map(b -> CellValue.number(operation.applyAsDouble(a, b))));
    }

    // numeric equality when both sides coerce, display-text equality otherwise
    private static boolean equal(CellValue left, CellValue right) {
        Result<Double> a = ValueCoercion.coerceNumber(left);
        Result<Double> b = ValueCoercion.coerceNumber(right);
        if (a.isOk() && b.isOk()) {
            return a.getValue().doubleValue() == b.getValue().doubleValue();
        }
        return ValueCoercion.display(left).equals(ValueCoercion.display(right));
    }

    private static Result<Integer> compare(CellValue left, CellValue right) {
        return ValueCoercion.coerceNumber(left).flatMap(a -> ValueCoercion.coerceNumber(right)
                .map(b -> a < b ? -1 : (a > b ? 1 : 0)));
    }

    private static Result<List<CellValue>> single(CellValue value) {
        return Result.ok(Collections.singletonList(value));
    }

    private static CellValue first(List<CellValue> values) {
        return values.isEmpty() ? CellValue.EMPTY : values.get(0);
    }
}
