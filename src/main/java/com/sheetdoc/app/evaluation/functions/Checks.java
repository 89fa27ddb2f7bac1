package com.sheetdoc.app.evaluation.functions;

import com.sheetdoc.app.evaluation.EvalError;
import com.sheetdoc.app.evaluation.Result;
import com.sheetdoc.app.evaluation.ValueCoercion;
import com.sheetdoc.app.models.CellValue;

import java.util.ArrayList;
import java.util.List;

final class Checks {

    private Checks() {
    }

    /**
     * Null when min <= actual <= max, otherwise an ARGUMENT_COUNT error
     * worded like "ABS expects exactly one argument".
     */
    static EvalError arity(String name, int actual, int min, int max, String expected) {
        if (actual < min || actual > max) {
            return EvalError.argumentCount(name + " expects " + expected);
        }
        return null;
    }

    static Result<List<Double>> numbers(List<CellValue> values) {
        List<Double> numbers = new ArrayList<>(values.size());
        for (CellValue value : values) {
            Result<Double> number = ValueCoercion.coerceNumber(value);
            if (number.isError()) {
                return number.propagate();
            }
            numbers.add(number.getValue());
        }
        return Result.ok(numbers);
    }

    static Result<CellValue> number(double value) {
        return Result.ok(CellValue.number(value));
    }

    static Result<CellValue> text(String value) {
        return Result.ok(CellValue.string(value));
    }

    static Result<CellValue> bool(boolean value) {
        return Result.ok(CellValue.bool(value));
    }

    static String textOf(CellValue value) {
        return ValueCoercion.display(value);
    }
}
