package com.sheetdoc.app.evaluation.functions;

import com.sheetdoc.app.evaluation.Result;
import com.sheetdoc.app.models.CellValue;

/**
 * A built-in spreadsheet function. Arguments are evaluated on demand through
 * {@link FunctionArguments}, so IFERROR only evaluates its fallback when needed.
 */
@FunctionalInterface
public interface FormulaFunction {
    Result<CellValue> apply(FunctionArguments arguments);
}
