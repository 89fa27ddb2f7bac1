package com.sheetdoc.app.evaluation.functions;

import com.sheetdoc.app.evaluation.EvalErrorCode;
import com.sheetdoc.app.evaluation.Result;
import com.sheetdoc.app.models.CellValue;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

/**
 * Registry of built-in functions by case-insensitive name.
 */
public class FunctionLibrary {

    private final Map<String, FormulaFunction> functions = new TreeMap<>();

    /**
     * Every built-in, with the system clock and an unseeded random source.
     */
    public static FunctionLibrary standard() {
        return standard(Clock.systemDefaultZone(), new Random());
    }

    /**
     * Every built-in; TODAY/NOW read the clock and RAND/RANDBETWEEN the random source.
     */
    public static FunctionLibrary standard(Clock clock, Random random) {
        FunctionLibrary library = new FunctionLibrary();
        MathFunctions.register(library, random);
        TextFunctions.register(library);
        LogicalFunctions.register(library);
        DateFunctions.register(library, clock);
        return library;
    }

    public void register(String name, FormulaFunction function) {
        functions.put(name.toUpperCase(), function);
    }

    public boolean isSupported(String name) {
        return functions.containsKey(name.toUpperCase());
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    public Result<CellValue> call(FunctionArguments arguments) {
        String name = arguments.getName().toUpperCase();
        FormulaFunction function = functions.get(name);
        if (function == null) {
            return Result.fail(EvalErrorCode.UNSUPPORTED_FUNCTION, "Unsupported function " + name);
        }
        return function.apply(arguments);
    }
}
