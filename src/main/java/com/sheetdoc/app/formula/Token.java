package com.sheetdoc.app.formula;

import com.sheetdoc.app.models.PageReference;

/**
 * One lexical unit of a formula. PAGE tokens also carry the parsed mention.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final PageReference page;

    public Token(TokenType type, String text) {
        this(type, text, null);
    }

    public Token(TokenType type, String text, PageReference page) {
        this.type = type;
        this.text = text;
        this.page = page;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public PageReference getPage() {
        return page;
    }

    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
