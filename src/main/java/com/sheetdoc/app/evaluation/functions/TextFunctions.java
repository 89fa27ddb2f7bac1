package com.sheetdoc.app.evaluation.functions;

import com.sheetdoc.app.evaluation.EvalError;
import com.sheetdoc.app.evaluation.Result;
import com.sheetdoc.app.models.CellValue;

import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * String functions. Arguments are read through their display text, so
 * UPPER(TRUE) is "TRUE" and LEN(1/4) is 4.
 */
final class TextFunctions {

    static final int MAX_REPEAT = 10000;

    private TextFunctions() {
    }

    static void register(FunctionLibrary library) {
        library.register("CONCAT", TextFunctions::concat);
        library.register("CONCATENATE", TextFunctions::concat);
        library.register("UPPER", args -> transform(args, "UPPER", text -> text.toUpperCase(Locale.ROOT)));
        library.register("LOWER", args -> transform(args, "LOWER", text -> text.toLowerCase(Locale.ROOT)));
        library.register("TRIM", args -> transform(args, "TRIM", String::trim));
        library.register("LEN", TextFunctions::len);
        library.register("LEFT", args -> slice(args, "LEFT", true));
        library.register("RIGHT", args -> slice(args, "RIGHT", false));
        library.register("MID", TextFunctions::mid);
        library.register("SUBSTITUTE", TextFunctions::substitute);
        library.register("REPT", TextFunctions::rept);
        library.register("FIND", args -> find(args, "FIND", false));
        library.register("SEARCH", args -> find(args, "SEARCH", true));
    }

    private static Result<CellValue> concat(FunctionArguments args) {
        return args.values().flatMap(values -> {
            StringBuilder joined = new StringBuilder();
            for (CellValue value : values) {
                joined.append(Checks.textOf(value));
            }
            return Checks.text(joined.toString());
        });
    }

    private static Result<CellValue> transform(FunctionArguments args, String name, UnaryOperator<String> operation) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity(name, values.size(), 1, 1, "exactly one argument");
            if (arity != null) {
                return Result.fail(arity);
            }
            return Checks.text(operation.apply(Checks.textOf(values.get(0))));
        });
    }

    private static Result<CellValue> len(FunctionArguments args) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity("LEN", values.size(), 1, 1, "exactly one argument");
            if (arity != null) {
                return Result.fail(arity);
            }
            return Checks.number(Checks.textOf(values.get(0)).length());
        });
    }

    private static Result<CellValue> slice(FunctionArguments args, String name, boolean fromStart) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity(name, values.size(), 1, 2, "one or two arguments");
            if (arity != null) {
                return Result.fail(arity);
            }
            String text = Checks.textOf(values.get(0));
            Result<Double> requested = values.size() > 1 ? FunctionArguments.number(values, 1) : Result.ok(1d);
            return requested.flatMap(count -> {
                int chars = (int) Math.min(text.length(), Math.max(0, Math.floor(count)));
                return Checks.text(fromStart
                        ? text.substring(0, chars)
                        : text.substring(text.length() - chars));
            });
        });
    }

    private static Result<CellValue> mid(FunctionArguments args) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity("MID", values.size(), 3, 3, "exactly three arguments");
            if (arity != null) {
                return Result.fail(arity);
            }
            String text = Checks.textOf(values.get(0));
            return Checks.numbers(values.subList(1, 3)).flatMap(numbers -> {
                long start = (long) Math.max(1, Math.floor(numbers.get(0))) - 1;
                long chars = (long) Math.max(0, Math.floor(numbers.get(1)));
                int from = (int) Math.min(text.length(), start);
                int to = (int) Math.min(text.length(), start + chars);
                return Checks.text(text.substring(from, to));
            });
        });
    }

    private static Result<CellValue> substitute(FunctionArguments args) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity("SUBSTITUTE", values.size(), 3, 4, "three or four arguments");
            if (arity != null) {
                return Result.fail(arity);
            }
            String text = Checks.textOf(values.get(0));
            String oldText = Checks.textOf(values.get(1));
            String newText = Checks.textOf(values.get(2));
            if (values.size() == 3) {
                return Checks.text(oldText.isEmpty() ? text : text.replace(oldText, newText));
            }
            return FunctionArguments.number(values, 3).flatMap(instance -> {
                if (Math.floor(instance) < 1) {
                    return Result.fail(EvalError.invalidArgument("SUBSTITUTE instance_num must be positive"));
                }
                return Checks.text(replaceOccurrence(text, oldText, newText, (long) Math.floor(instance)));
            });
        });
    }

    private static String replaceOccurrence(String text, String oldText, String newText, long occurrence) {
        if (oldText.isEmpty()) {
            return text;
        }
        int index = -1;
        for (long seen = 0; seen < occurrence; seen++) {
            index = text.indexOf(oldText, index < 0 ? 0 : index + oldText.length());
            if (index < 0) {
                return text;
            }
        }
        return text.substring(0, index) + newText + text.substring(index + oldText.length());
    }

    private static Result<CellValue> rept(FunctionArguments args) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity("REPT", values.size(), 2, 2, "exactly two arguments");
            if (arity != null) {
                return Result.fail(arity);
            }
            String text = Checks.textOf(values.get(0));
            return FunctionArguments.number(values, 1).flatMap(times -> {
                double count = Math.max(0, Math.floor(times));
                if (count > MAX_REPEAT) {
                    return Result.fail(EvalError.invalidArgument("REPT repeat count too large"));
                }
                StringBuilder repeated = new StringBuilder();
                for (int i = 0; i < count; i++) {
                    repeated.append(text);
                }
                return Checks.text(repeated.toString());
            });
        });
    }

    // 1-based position of the first match at or after the optional start position
    private static Result<CellValue> find(FunctionArguments args, String name, boolean ignoreCase) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity(name, values.size(), 2, 3, "two or three arguments");
            if (arity != null) {
                return Result.fail(arity);
            }
            String needle = Checks.textOf(values.get(0));
            String haystack = Checks.textOf(values.get(1));
            if (ignoreCase) {
                needle = needle.toLowerCase(Locale.ROOT);
                haystack = haystack.toLowerCase(Locale.ROOT);
            }
            String findText = needle;
            String withinText = haystack;
            Result<Double> start = values.size() > 2 ? FunctionArguments.number(values, 2) : Result.ok(1d);
            return start.flatMap(position -> {
                int from = (int) Math.min(Integer.MAX_VALUE, Math.max(1, Math.floor(position))) - 1;
                int index = withinText.indexOf(findText, from);
                if (index < 0) {
                    return Result.fail(EvalError.invalidArgument(name + ": Text not found"));
                }
                return Checks.number(index + 1);
            });
        });
    }
}
