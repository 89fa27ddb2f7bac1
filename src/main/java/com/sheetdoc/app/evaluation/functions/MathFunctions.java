package com.sheetdoc.app.evaluation.functions;

import com.sheetdoc.app.evaluation.EvalError;
import com.sheetdoc.app.evaluation.EvalErrorCode;
import com.sheetdoc.app.evaluation.Result;
import com.sheetdoc.app.evaluation.ValueCoercion;
import com.sheetdoc.app.models.CellValue;

import java.util.List;
import java.util.Random;
import java.util.function.DoubleUnaryOperator;

/**
 * Aggregates and numeric functions. All of them work on the flattened
 * argument list, so SUM(A1:A3, 4) sees four values.
 */
final class MathFunctions {

    private MathFunctions() {
    }

    static void register(FunctionLibrary library, Random random) {
        library.register("SUM", MathFunctions::sum);
        library.register("AVERAGE", MathFunctions::average);
        library.register("AVG", MathFunctions::average);
        library.register("MIN", args -> extreme(args, true));
        library.register("MAX", args -> extreme(args, false));
        library.register("COUNT", MathFunctions::count);
        library.register("COUNTA", MathFunctions::countA);
        library.register("ABS", args -> unary(args, "ABS", Math::abs));
        library.register("ROUND", MathFunctions::round);
        library.register("FLOOR", args -> toSignificance(args, "FLOOR", true));
        library.register("CEILING", args -> toSignificance(args, "CEILING", false));
        library.register("SQRT", MathFunctions::sqrt);
        library.register("POWER", MathFunctions::power);
        library.register("POW", MathFunctions::power);
        library.register("MOD", MathFunctions::mod);
        library.register("INT", args -> unary(args, "INT", Math::floor));
        library.register("SIGN", args -> unary(args, "SIGN", Math::signum));
        library.register("PI", args -> Checks.number(Math.PI));
        library.register("RAND", args -> Checks.number(random.nextDouble()));
        library.register("RANDBETWEEN", args -> randBetween(args, random));
    }

    // Empty cells count as 0 here, unlike COUNT and COUNTA.
    private static Result<CellValue> sum(FunctionArguments args) {
        return args.values().flatMap(Checks::numbers).flatMap(numbers -> {
            double total = 0;
            for (double number : numbers) {
                total += number;
            }
            return Checks.number(total);
        });
    }

    private static Result<CellValue> average(FunctionArguments args) {
        return args.values().flatMap(values -> {
            double total = 0;
            int counted = 0;
            for (CellValue value : values) {
                if (value.isEmpty() || (value.isString() && value.asString().trim().isEmpty())) {
                    continue;
                }
                Result<Double> number = ValueCoercion.coerceNumber(value);
                if (number.isOk()) {
                    total += number.getValue();
                    counted++;
                }
            }
            return Checks.number(counted == 0 ? 0 : total / counted);
        });
    }

    private static Result<CellValue> extreme(FunctionArguments args, boolean min) {
        return args.values().flatMap(Checks::numbers).flatMap(numbers -> {
            if (numbers.isEmpty()) {
                return Checks.number(0);
            }
            double best = numbers.get(0);
            for (double number : numbers) {
                best = min ? Math.min(best, number) : Math.max(best, number);
            }
            return Checks.number(best);
        });
    }

    private static Result<CellValue> count(FunctionArguments args) {
        return args.values().flatMap(values -> {
            int count = 0;
            for (CellValue value : values) {
                if (!value.isEmpty() && ValueCoercion.isNumeric(value)) {
                    count++;
                }
            }
            return Checks.number(count);
        });
    }

    private static Result<CellValue> countA(FunctionArguments args) {
        return args.values().flatMap(values -> {
            int count = 0;
            for (CellValue value : values) {
                if (!value.isEmpty()) {
                    count++;
                }
            }
            return Checks.number(count);
        });
    }

    private static Result<CellValue> unary(FunctionArguments args, String name,
                                           DoubleUnaryOperator operation) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity(name, values.size(), 1, 1, "exactly one argument");
            if (arity != null) {
                return Result.fail(arity);
            }
            return FunctionArguments.number(values, 0)
                    .map(number -> CellValue.number(operation.applyAsDouble(number)));
        });
    }

    private static Result<CellValue> round(FunctionArguments args) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity("ROUND", values.size(), 1, Integer.MAX_VALUE, "at least one argument");
            if (arity != null) {
                return Result.fail(arity);
            }
            return Checks.numbers(values.subList(0, Math.min(2, values.size()))).flatMap(numbers -> {
                double precision = numbers.size() > 1 ? numbers.get(1) : 0;
                double factor = Math.pow(10, precision);
                // half-up towards positive infinity: ROUND(-2.5) is -2
                return Checks.number(Math.floor(numbers.get(0) * factor + 0.5) / factor);
            });
        });
    }

    private static Result<CellValue> toSignificance(FunctionArguments args, String name, boolean down) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity(name, values.size(), 1, Integer.MAX_VALUE, "at least one argument");
            if (arity != null) {
                return Result.fail(arity);
            }
            return Checks.numbers(values.subList(0, Math.min(2, values.size()))).flatMap(numbers -> {
                double significance = numbers.size() > 1 ? Math.abs(numbers.get(1)) : 1;
                if (significance == 0) {
                    return Result.fail(EvalErrorCode.ZERO_SIGNIFICANCE, name + " significance cannot be zero");
                }
                double steps = numbers.get(0) / significance;
                return Checks.number((down ? Math.floor(steps) : Math.ceil(steps)) * significance);
            });
        });
    }

    private static Result<CellValue> sqrt(FunctionArguments args) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity("SQRT", values.size(), 1, 1, "exactly one argument");
            if (arity != null) {
                return Result.fail(arity);
            }
            return FunctionArguments.number(values, 0).flatMap(number -> {
                if (number < 0) {
                    return Result.fail(EvalError.invalidArgument(
                            "SQRT: Cannot take square root of negative number"));
                }
                return Checks.number(Math.sqrt(number));
            });
        });
    }

    private static Result<CellValue> power(FunctionArguments args) {
        return binary(args, "POWER").flatMap(numbers -> Checks.number(Math.pow(numbers.get(0), numbers.get(1))));
    }

    private static Result<CellValue> mod(FunctionArguments args) {
        return binary(args, "MOD").flatMap(numbers -> {
            if (numbers.get(1) == 0) {
                return Result.fail(EvalErrorCode.DIVISION_BY_ZERO, "MOD: Division by zero");
            }
            return Checks.number(numbers.get(0) % numbers.get(1));
        });
    }

    private static Result<CellValue> randBetween(FunctionArguments args, Random random) {
        return binary(args, "RANDBETWEEN").flatMap(numbers -> {
            double bottom = Math.floor(numbers.get(0));
            double top = Math.floor(numbers.get(1));
            if (bottom > top) {
                return Result.fail(EvalError.invalidArgument(
                        "RANDBETWEEN: bottom must be less than or equal to top"));
            }
            return Checks.number(Math.floor(random.nextDouble() * (top - bottom + 1)) + bottom);
        });
    }

    private static Result<List<Double>> binary(FunctionArguments args, String name) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity(name, values.size(), 2, 2, "exactly two arguments");
            if (arity != null) {
                return Result.fail(arity);
            }
            return Checks.numbers(values);
        });
    }
}
