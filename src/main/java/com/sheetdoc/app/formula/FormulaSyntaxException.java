package com.sheetdoc.app.formula;

/**
 * Thrown by the tokenizer and parser. The evaluator catches it at the cell
 * boundary and records it as that cell's error.
 */
public class FormulaSyntaxException extends RuntimeException {
    private final FormulaErrorCode code;

    public FormulaSyntaxException(FormulaErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public FormulaErrorCode getCode() {
        return code;
    }
}
