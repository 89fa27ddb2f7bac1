package com.sheetdoc.app.formula;

/**
 * Lexical and syntactic failure kinds. Each aborts parsing of one formula only.
 */
public enum FormulaErrorCode {
    // lexical
    UNTERMINATED_STRING,
    INVALID_NUMBER_LITERAL,
    UNEXPECTED_CHARACTER,
    INVALID_PAGE_REFERENCE,
    // syntactic
    EMPTY_FORMULA,
    TRAILING_TOKENS,
    INVALID_RANGE_OPERANDS,
    UNEXPECTED_IDENTIFIER,
    UNEXPECTED_END,
    UNEXPECTED_TOKEN,
    UNCLOSED_PARENTHESIS,
    EXPECTED_CELL_REFERENCE,
    // limits
    RANGE_TOO_LARGE
}
