package com.sheetdoc.app.formula;

import com.sheetdoc.app.models.PageReference;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns formula text (without the leading '=') into a flat token list.
 * Scanning order per position: page mention, string, number,
 * identifier/cell, operator, punctuation.
 */
public final class Tokenizer {

    static final Pattern NUMBER_LITERAL = Pattern.compile("^-?(?:\\d+\\.?\\d*|\\.\\d+)$");
    static final Pattern CELL_TOKEN = Pattern.compile("^[A-Z]+\\d+$");

    private final String formula;
    private int index;

    private Tokenizer(String formula) {
        this.formula = formula;
    }

    public static List<Token> tokenize(String formula) {
        return new Tokenizer(formula).run();
    }

    /**
     * True for plain decimal text such as "12", "-3.5" or ".5"; cells holding
     * such text are numbers.
     */
    public static boolean isNumberLiteral(String text) {
        return NUMBER_LITERAL.matcher(text).matches();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();

        while (index < formula.length()) {
            char c = formula.charAt(index);

            if (Character.isWhitespace(c)) {
                index++;
            } else if (c == '@' && peekAt(index + 1) == '[') {
                tokens.add(readPageMention());
            } else if (c == '"') {
                tokens.add(readString());
            } else if (isDigit(c) || c == '.') {
                tokens.add(readNumber());
            } else if (isIdentifierStart(c)) {
                tokens.add(readWord());
            } else if (c == '(' || c == ')') {
                tokens.add(new Token(TokenType.PAREN, String.valueOf(c)));
                index++;
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ","));
                index++;
            } else if (c == ':') {
                tokens.add(new Token(TokenType.COLON, ":"));
                index++;
            } else if (c == '<' || c == '>' || c == '=') {
                tokens.add(readComparison(c));
            } else if ("+-*/^&".indexOf(c) >= 0) {
                tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c)));
                index++;
            } else {
                throw new FormulaSyntaxException(FormulaErrorCode.UNEXPECTED_CHARACTER,
                        "Unexpected character '" + c + "' in formula");
            }
        }

        return tokens;
    }

    // @[Label] or @[Label](identifier) or @[Label](identifier:mentionType)
    private Token readPageMention() {
        int labelStart = index + 2;
        int labelEnd = formula.indexOf(']', labelStart);
        if (labelEnd < 0) {
            throw new FormulaSyntaxException(FormulaErrorCode.INVALID_PAGE_REFERENCE,
                    "Unterminated page reference");
        }
        String label = formula.substring(labelStart, labelEnd).trim();
        if (label.isEmpty()) {
            throw new FormulaSyntaxException(FormulaErrorCode.INVALID_PAGE_REFERENCE,
                    "Page reference label cannot be empty");
        }

        int cursor = labelEnd + 1;
        String identifier = null;
        String mentionType = null;

        if (peekAt(cursor) == '(') {
            int metaEnd = formula.indexOf(')', cursor + 1);
            if (metaEnd < 0) {
                throw new FormulaSyntaxException(FormulaErrorCode.INVALID_PAGE_REFERENCE,
                        "Unterminated page reference identifier");
            }
            String meta = formula.substring(cursor + 1, metaEnd).trim();
            int colon = meta.indexOf(':');
            if (colon < 0) {
                identifier = meta;
            } else {
                identifier = meta.substring(0, colon);
                mentionType = meta.substring(colon + 1);
            }
            cursor = metaEnd + 1;
        }

        PageReference page = new PageReference(label, identifier, mentionType);
        index = cursor;
        return new Token(TokenType.PAGE, page.getRaw(), page);
    }

    private Token readString() {
        int end = formula.indexOf('"', index + 1);
        if (end < 0) {
            throw new FormulaSyntaxException(FormulaErrorCode.UNTERMINATED_STRING,
                    "Unterminated string literal");
        }
        String value = formula.substring(index + 1, end);
        index = end + 1;
        return new Token(TokenType.STRING, value);
    }

    private Token readNumber() {
        int end = index + 1;
        while (end < formula.length() && (isDigit(formula.charAt(end)) || formula.charAt(end) == '.')) {
            end++;
        }
        String value = formula.substring(index, end);
        if (!NUMBER_LITERAL.matcher(value).matches()) {
            throw new FormulaSyntaxException(FormulaErrorCode.INVALID_NUMBER_LITERAL,
                    "Invalid number literal: " + value);
        }
        index = end;
        return new Token(TokenType.NUMBER, value);
    }

    private Token readWord() {
        int end = index + 1;
        while (end < formula.length() && isIdentifierPart(formula.charAt(end))) {
            end++;
        }
        String upper = formula.substring(index, end).toUpperCase();
        index = end;

        if (CELL_TOKEN.matcher(upper).matches()) {
            return new Token(TokenType.CELL, upper);
        }
        if (upper.equals("TRUE") || upper.equals("FALSE")) {
            return new Token(TokenType.BOOLEAN, upper);
        }
        return new Token(TokenType.IDENTIFIER, upper);
    }

    private Token readComparison(char c) {
        char next = peekAt(index + 1);
        if ((c == '<' && (next == '=' || next == '>')) || (c == '>' && next == '=')) {
            index += 2;
            return new Token(TokenType.OPERATOR, "" + c + next);
        }
        index++;
        return new Token(TokenType.OPERATOR, String.valueOf(c));
    }

    private char peekAt(int position) {
        return position < formula.length() ? formula.charAt(position) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
