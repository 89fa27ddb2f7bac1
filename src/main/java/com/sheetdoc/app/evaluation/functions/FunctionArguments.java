package com.sheetdoc.app.evaluation.functions;

import com.sheetdoc.app.evaluation.Result;
import com.sheetdoc.app.evaluation.ValueCoercion;
import com.sheetdoc.app.formula.ast.Expression;
import com.sheetdoc.app.models.CellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * The argument expressions of one call plus a way to evaluate them.
 */
public final class FunctionArguments {

    private final String name;
    private final List<Expression> expressions;
    private final Function<Expression, Result<List<CellValue>>> evaluator;
    private Result<List<CellValue>> flattened;

    public FunctionArguments(String name, List<Expression> expressions,
                             Function<Expression, Result<List<CellValue>>> evaluator) {
        this.name = name;
        this.expressions = expressions;
        this.evaluator = evaluator;
    }

    public String getName() {
        return name;
    }

    /**
     * Number of argument expressions as written, before range flattening.
     */
    public int count() {
        return expressions.size();
    }

    /**
     * Every argument evaluated and flattened (ranges row-major).
     * Fails with the first argument error.
     */
    public Result<List<CellValue>> values() {
        if (flattened == null) {
            List<CellValue> all = new ArrayList<>();
            for (Expression expression : expressions) {
                Result<List<CellValue>> result = evaluator.apply(expression);
                if (result.isError()) {
                    flattened = result;
                    return flattened;
                }
                all.addAll(result.getValue());
            }
            flattened = Result.ok(all);
        }
        return flattened;
    }

    /**
     * The first value of the argument at the index; EMPTY for an empty result.
     */
    public Result<CellValue> scalar(int index) {
        return evaluator.apply(expressions.get(index))
                .map(values -> values.isEmpty() ? CellValue.EMPTY : values.get(0));
    }

    static Result<Double> number(List<CellValue> values, int index) {
        return ValueCoercion.coerceNumber(values.get(index));
    }
}
