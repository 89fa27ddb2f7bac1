package com.sheetdoc.app.formula;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    @Test
    void testFunctionCallWithRange() {
        List<Token> tokens = Tokenizer.tokenize("sum(a1:B2)");

        assertEquals(6, tokens.size());
        assertTrue(tokens.get(0).is(TokenType.IDENTIFIER, "SUM"));
        assertTrue(tokens.get(1).is(TokenType.PAREN, "("));
        assertTrue(tokens.get(2).is(TokenType.CELL, "A1"));
        assertEquals(TokenType.COLON, tokens.get(3).getType());
        assertTrue(tokens.get(4).is(TokenType.CELL, "B2"));
        assertTrue(tokens.get(5).is(TokenType.PAREN, ")"));
    }

    @Test
    void testOperatorsAndComparisons() {
        List<Token> tokens = Tokenizer.tokenize("1<=2<>3>=4&\"x\"");

        assertTrue(tokens.get(1).is(TokenType.OPERATOR, "<="));
        assertTrue(tokens.get(3).is(TokenType.OPERATOR, "<>"));
        assertTrue(tokens.get(5).is(TokenType.OPERATOR, ">="));
        assertTrue(tokens.get(7).is(TokenType.OPERATOR, "&"));
        assertTrue(tokens.get(8).is(TokenType.STRING, "x"));
    }

    @Test
    void testBooleansAreCaseInsensitive() {
        List<Token> tokens = Tokenizer.tokenize("true, False");
        assertTrue(tokens.get(0).is(TokenType.BOOLEAN, "TRUE"));
        assertEquals(TokenType.COMMA, tokens.get(1).getType());
        assertTrue(tokens.get(2).is(TokenType.BOOLEAN, "FALSE"));
    }

    @Test
    void testNumberLiterals() {
        assertTrue(Tokenizer.tokenize("12.5").get(0).is(TokenType.NUMBER, "12.5"));
        assertTrue(Tokenizer.tokenize(".5").get(0).is(TokenType.NUMBER, ".5"));

        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class, () -> Tokenizer.tokenize("1.2.3"));
        assertEquals(FormulaErrorCode.INVALID_NUMBER_LITERAL, e.getCode());
    }

    /**
     * Page mentions become a single PAGE token carrying the parsed reference.
     */
    @Test
    void testPageMention() {
        List<Token> tokens = Tokenizer.tokenize("@[ Budget ](p1:sheet):b2");

        assertEquals(TokenType.PAGE, tokens.get(0).getType());
        assertEquals("Budget", tokens.get(0).getPage().getLabel());
        assertEquals("p1", tokens.get(0).getPage().getIdentifier());
        assertEquals("sheet", tokens.get(0).getPage().getMentionType());
        assertEquals("@[Budget](p1:sheet)", tokens.get(0).getText());
        assertEquals(TokenType.COLON, tokens.get(1).getType());
        assertTrue(tokens.get(2).is(TokenType.CELL, "B2"));
    }

    @Test
    void testPageMentionWithoutIdentifier() {
        Token page = Tokenizer.tokenize("@[Notes]:A1").get(0);
        assertNull(page.getPage().getIdentifier());
        assertEquals("@[Notes]", page.getText());
    }

    @Test
    void testLexicalErrors() {
        assertEquals(FormulaErrorCode.UNTERMINATED_STRING,
                assertThrows(FormulaSyntaxException.class, () -> Tokenizer.tokenize("\"abc")).getCode());
        assertEquals(FormulaErrorCode.UNEXPECTED_CHARACTER,
                assertThrows(FormulaSyntaxException.class, () -> Tokenizer.tokenize("1 # 2")).getCode());
        assertEquals(FormulaErrorCode.INVALID_PAGE_REFERENCE,
                assertThrows(FormulaSyntaxException.class, () -> Tokenizer.tokenize("@[Budget")).getCode());
        assertEquals(FormulaErrorCode.INVALID_PAGE_REFERENCE,
                assertThrows(FormulaSyntaxException.class, () -> Tokenizer.tokenize("@[  ]:A1")).getCode());
    }

    @Test
    void testIsNumberLiteral() {
        assertTrue(Tokenizer.isNumberLiteral("42"));
        assertTrue(Tokenizer.isNumberLiteral("-3.5"));
        assertTrue(Tokenizer.isNumberLiteral("7."));
        assertFalse(Tokenizer.isNumberLiteral("1e5"));
        assertFalse(Tokenizer.isNumberLiteral("12abc"));
        assertFalse(Tokenizer.isNumberLiteral(""));
    }
}
