package com.sheetdoc.app.formula;

import com.sheetdoc.app.formula.ast.BinaryExpression;
import com.sheetdoc.app.formula.ast.BooleanLiteral;
import com.sheetdoc.app.formula.ast.CellReference;
import com.sheetdoc.app.formula.ast.Expression;
import com.sheetdoc.app.formula.ast.ExternalCellReference;
import com.sheetdoc.app.formula.ast.ExternalRange;
import com.sheetdoc.app.formula.ast.FunctionCall;
import com.sheetdoc.app.formula.ast.NumberLiteral;
import com.sheetdoc.app.formula.ast.Operator;
import com.sheetdoc.app.formula.ast.Range;
import com.sheetdoc.app.formula.ast.StringLiteral;
import com.sheetdoc.app.formula.ast.UnaryExpression;
import com.sheetdoc.app.models.PageReference;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/*
 * Grammar, lowest to highest precedence:
 *
 * formula        : comparison EOF ;
 * comparison     : concatenation ( ( "=" | ">" | "<" | ">=" | "<=" | "<>" ) concatenation )* ;
 * concatenation  : additive ( "&" additive )* ;
 * additive       : multiplicative ( ( "+" | "-" ) multiplicative )* ;
 * multiplicative : exponent ( ( "*" | "/" ) exponent )* ;
 * exponent       : unary ( "^" unary )* ;
 * unary          : ( "+" | "-" ) unary | range ;
 * range          : primary ( ":" primary )? ;            both sides must be cells
 * primary        : NUMBER | STRING | BOOLEAN | CELL
 *                | PAGE ":" CELL ( ":" CELL )?
 *                | IDENTIFIER "(" ( comparison ( "," comparison )* )? ")"
 *                | "(" comparison ")" ;
 */

/**
 * Recursive-descent parser from a token list to an expression tree.
 * Performs no evaluation; failures raise {@link FormulaSyntaxException}.
 */
public final class FormulaParser {

    private final List<Token> tokens;
    private int position;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Expression parse(List<Token> tokens) {
        if (tokens.isEmpty()) {
            throw new FormulaSyntaxException(FormulaErrorCode.EMPTY_FORMULA, "Empty formula");
        }
        FormulaParser parser = new FormulaParser(tokens);
        Expression expression = parser.comparison();
        if (!parser.isAtEnd()) {
            throw new FormulaSyntaxException(FormulaErrorCode.TRAILING_TOKENS,
                    "Unexpected tokens after end of formula");
        }
        return expression;
    }

    /**
     * Tokenizes and parses formula text given without its leading '='.
     */
    public static Expression parse(String formula) {
        return parse(Tokenizer.tokenize(formula));
    }

    private Expression comparison() {
        Expression node = concatenation();
        while (matchOperator("=", ">", "<", ">=", "<=", "<>")) {
            Operator operator = Operator.fromSymbol(previous().getText());
            node = new BinaryExpression(operator, node, concatenation());
        }
        return node;
    }

    private Expression concatenation() {
        Expression node = additive();
        while (matchOperator("&")) {
            node = new BinaryExpression(Operator.CONCAT, node, additive());
        }
        return node;
    }

    private Expression additive() {
        Expression node = multiplicative();
        while (matchOperator("+", "-")) {
            Operator operator = Operator.fromSymbol(previous().getText());
            node = new BinaryExpression(operator, node, multiplicative());
        }
        return node;
    }

    private Expression multiplicative() {
        Expression node = exponent();
        while (matchOperator("*", "/")) {
            Operator operator = Operator.fromSymbol(previous().getText());
            node = new BinaryExpression(operator, node, exponent());
        }
        return node;
    }

    private Expression exponent() {
        Expression node = unary();
        while (matchOperator("^")) {
            node = new BinaryExpression(Operator.POWER, node, unary());
        }
        return node;
    }

    private Expression unary() {
        if (matchOperator("+", "-")) {
            Operator operator = Operator.fromSymbol(previous().getText());
            return new UnaryExpression(operator, unary());
        }
        return range();
    }

    private Expression range() {
        Expression left = primary();
        if (match(TokenType.COLON)) {
            Expression right = primary();
            if (!(left instanceof CellReference) || !(right instanceof CellReference)) {
                throw new FormulaSyntaxException(FormulaErrorCode.INVALID_RANGE_OPERANDS,
                        "Range references must use cell addresses");
            }
            return new Range((CellReference) left, (CellReference) right);
        }
        return left;
    }

    private Expression primary() {
        if (match(TokenType.NUMBER)) {
            return new NumberLiteral(Double.parseDouble(previous().getText()));
        }
        if (match(TokenType.STRING)) {
            return new StringLiteral(previous().getText());
        }
        if (match(TokenType.BOOLEAN)) {
            return new BooleanLiteral(previous().getText().equals("TRUE"));
        }
        if (match(TokenType.PAGE)) {
            return pageReference(previous().getPage());
        }
        if (match(TokenType.CELL)) {
            return new CellReference(previous().getText());
        }
        if (match(TokenType.IDENTIFIER)) {
            return functionCall(previous().getText());
        }
        if (matchSpecific(TokenType.PAREN, "(")) {
            Expression inner = comparison();
            consume(TokenType.PAREN, ")", "Expected closing parenthesis");
            return inner;
        }
        if (isAtEnd()) {
            throw new FormulaSyntaxException(FormulaErrorCode.UNEXPECTED_END, "Unexpected end of formula");
        }
        throw new FormulaSyntaxException(FormulaErrorCode.UNEXPECTED_TOKEN,
                "Unexpected token '" + peek().getText() + "'");
    }

    private Expression pageReference(PageReference page) {
        if (!match(TokenType.COLON)) {
            throw new FormulaSyntaxException(FormulaErrorCode.EXPECTED_CELL_REFERENCE,
                    "Expected \":\" after page reference");
        }
        CellReference start = cellAfterPage();
        if (match(TokenType.COLON)) {
            return new ExternalRange(page, start, cellAfterPage());
        }
        return new ExternalCellReference(page, start.getAddress());
    }

    private CellReference cellAfterPage() {
        if (match(TokenType.CELL)) {
            return new CellReference(previous().getText());
        }
        throw new FormulaSyntaxException(FormulaErrorCode.EXPECTED_CELL_REFERENCE,
                "Expected cell reference after page reference");
    }

    private Expression functionCall(String name) {
        if (!matchSpecific(TokenType.PAREN, "(")) {
            throw new FormulaSyntaxException(FormulaErrorCode.UNEXPECTED_IDENTIFIER,
                    "Unexpected identifier '" + name + "'");
        }
        List<Expression> arguments = new ArrayList<>();
        if (!check(TokenType.PAREN, ")")) {
            do {
                arguments.add(comparison());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.PAREN, ")", "Expected closing parenthesis for " + name + "()");
        return new FunctionCall(name, arguments);
    }

    private boolean match(TokenType type) {
        if (check(type, null)) {
            position++;
            return true;
        }
        return false;
    }

    private boolean matchSpecific(TokenType type, String text) {
        if (check(type, text)) {
            position++;
            return true;
        }
        return false;
    }

    private boolean matchOperator(String... operators) {
        if (check(TokenType.OPERATOR, null) && Arrays.asList(operators).contains(peek().getText())) {
            position++;
            return true;
        }
        return false;
    }

    private void consume(TokenType type, String text, String message) {
        if (!matchSpecific(type, text)) {
            throw new FormulaSyntaxException(FormulaErrorCode.UNCLOSED_PARENTHESIS, message);
        }
    }

    private boolean check(TokenType type, String text) {
        if (isAtEnd()) {
            return false;
        }
        Token token = peek();
        return text == null ? token.getType() == type : token.is(type, text);
    }

    private boolean isAtEnd() {
        return position >= tokens.size();
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
