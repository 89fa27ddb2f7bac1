package com.sheetdoc.app.formula;

public enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    CELL,
    PAGE,
    IDENTIFIER,
    OPERATOR,
    PAREN,
    COMMA,
    COLON
}
