package com.sheetdoc.app.evaluation;

/**
 * Why a cell failed to produce a value.
 * SYNTAX wraps any tokenizer or parser failure of the cell's own formula,
 * including a range larger than the configured limit.
 */
public enum EvalErrorCode {
    SYNTAX,
    DIVISION_BY_ZERO,
    NOT_NUMERIC,
    UNSUPPORTED_FUNCTION,
    ARGUMENT_COUNT,
    ZERO_SIGNIFICANCE,
    INVALID_ARGUMENT,
    CIRCULAR_REFERENCE,
    EXTERNAL_UNAVAILABLE
}
