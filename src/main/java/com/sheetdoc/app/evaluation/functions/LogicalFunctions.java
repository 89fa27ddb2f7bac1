package com.sheetdoc.app.evaluation.functions;

import com.sheetdoc.app.evaluation.EvalError;
import com.sheetdoc.app.evaluation.Result;
import com.sheetdoc.app.evaluation.ValueCoercion;
import com.sheetdoc.app.models.CellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Only IFERROR evaluates its fallback lazily; every other function,
 * IF included, evaluates all of its arguments.
 */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void register(FunctionLibrary library) {
        library.register("IF", LogicalFunctions::ifThenElse);
        library.register("IFERROR", LogicalFunctions::ifError);
        library.register("AND", args -> fold(args, "AND", true));
        library.register("OR", args -> fold(args, "OR", false));
        library.register("NOT", args -> test(args, "NOT", value -> !ValueCoercion.toBoolean(value)));
        library.register("ISBLANK", args -> test(args, "ISBLANK", CellValue::isEmpty));
        library.register("ISNUMBER", args -> test(args, "ISNUMBER",
                value -> value.isNumber() && Double.isFinite(value.asNumber())));
        library.register("ISTEXT", args -> test(args, "ISTEXT", CellValue::isString));
    }

    // every argument is evaluated first, so an error in either branch fails the call
    private static Result<CellValue> ifThenElse(FunctionArguments args) {
        EvalError arity = Checks.arity("IF", args.count(), 2, Integer.MAX_VALUE, "at least two arguments");
        if (arity != null) {
            return Result.fail(arity);
        }
        List<CellValue> values = new ArrayList<>(args.count());
        for (int i = 0; i < args.count(); i++) {
            Result<CellValue> value = args.scalar(i);
            if (value.isError()) {
                return value;
            }
            values.add(value.getValue());
        }
        if (ValueCoercion.toBoolean(values.get(0))) {
            return Result.ok(values.get(1));
        }
        return Result.ok(values.size() >= 3 ? values.get(2) : CellValue.EMPTY);
    }

    private static Result<CellValue> ifError(FunctionArguments args) {
        EvalError arity = Checks.arity("IFERROR", args.count(), 2, Integer.MAX_VALUE, "at least two arguments");
        if (arity != null) {
            return Result.fail(arity);
        }
        Result<CellValue> attempt = args.scalar(0);
        return attempt.isOk() ? attempt : args.scalar(1);
    }

    private static Result<CellValue> fold(FunctionArguments args, String name, boolean all) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity(name, values.size(), 1, Integer.MAX_VALUE, "at least one argument");
            if (arity != null) {
                return Result.fail(arity);
            }
            for (CellValue value : values) {
                if (ValueCoercion.toBoolean(value) != all) {
                    return Checks.bool(!all);
                }
            }
            return Checks.bool(all);
        });
    }

    private static Result<CellValue> test(FunctionArguments args, String name, Predicate<CellValue> predicate) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity(name, values.size(), 1, 1, "exactly one argument");
            if (arity != null) {
                return Result.fail(arity);
            }
            return Checks.bool(predicate.test(values.get(0)));
        });
    }
}
