package com.sheetdoc.app.formula;

import com.sheetdoc.app.formula.ast.BinaryExpression;
import com.sheetdoc.app.formula.ast.CellReference;
import com.sheetdoc.app.formula.ast.Expression;
import com.sheetdoc.app.formula.ast.ExternalCellReference;
import com.sheetdoc.app.formula.ast.ExternalRange;
import com.sheetdoc.app.formula.ast.FunctionCall;
import com.sheetdoc.app.formula.ast.NumberLiteral;
import com.sheetdoc.app.formula.ast.Operator;
import com.sheetdoc.app.formula.ast.Range;
import com.sheetdoc.app.formula.ast.UnaryExpression;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    /**
     * Multiplication binds tighter than addition.
     */
    @Test
    void testPrecedence() {
        BinaryExpression sum = (BinaryExpression) FormulaParser.parse("1+2*3");

        assertEquals(Operator.ADD, sum.getOperator());
        assertEquals(1d, ((NumberLiteral) sum.getLeft()).getValue());
        BinaryExpression product = (BinaryExpression) sum.getRight();
        assertEquals(Operator.MULTIPLY, product.getOperator());
    }

    @Test
    void testComparisonIsLowestPrecedence() {
        BinaryExpression comparison = (BinaryExpression) FormulaParser.parse("A1&\"x\"=B1+1");

        assertEquals(Operator.EQUAL, comparison.getOperator());
        assertEquals(Operator.CONCAT, ((BinaryExpression) comparison.getLeft()).getOperator());
        assertEquals(Operator.ADD, ((BinaryExpression) comparison.getRight()).getOperator());
    }

    @Test
    void testParenthesesAndUnaryMinus() {
        BinaryExpression product = (BinaryExpression) FormulaParser.parse("-(1+2)*3");

        UnaryExpression negation = (UnaryExpression) product.getLeft();
        assertEquals(Operator.SUBTRACT, negation.getOperator());
        assertEquals(Operator.ADD, ((BinaryExpression) negation.getArgument()).getOperator());
    }

    @Test
    void testFunctionCallArguments() {
        FunctionCall call = (FunctionCall) FormulaParser.parse("IF(A1>0, SUM(B1:B3), \"none\")");

        assertEquals("IF", call.getName());
        assertEquals(3, call.getArguments().size());
        FunctionCall inner = (FunctionCall) call.getArguments().get(1);
        Range range = (Range) inner.getArguments().get(0);
        assertEquals(Arrays.asList("B1", "B2", "B3"), range.addresses());
    }

    @Test
    void testEmptyArgumentList() {
        FunctionCall call = (FunctionCall) FormulaParser.parse("PI()");
        assertTrue(call.getArguments().isEmpty());
    }

    @Test
    void testExternalReferences() {
        ExternalCellReference cell = (ExternalCellReference) FormulaParser.parse("@[Budget](7):C4");
        assertEquals("C4", cell.getAddress());
        assertEquals("7", cell.getPage().getIdentifier());

        ExternalRange range = (ExternalRange) FormulaParser.parse("@[Budget]:A1:A2");
        assertEquals(Arrays.asList("A1", "A2"), range.addresses());
        assertEquals("Budget", range.getPage().getLabel());
    }

    @Test
    void testSingleCell() {
        Expression expression = FormulaParser.parse(" b12 ");
        assertEquals("B12", ((CellReference) expression).getAddress());
    }

    @Test
    void testSyntaxErrors() {
        assertEquals(FormulaErrorCode.EMPTY_FORMULA, codeOf("   "));
        assertEquals(FormulaErrorCode.TRAILING_TOKENS, codeOf("1 2"));
        assertEquals(FormulaErrorCode.INVALID_RANGE_OPERANDS, codeOf("A1:5"));
        assertEquals(FormulaErrorCode.UNEXPECTED_IDENTIFIER, codeOf("FOO"));
        assertEquals(FormulaErrorCode.UNCLOSED_PARENTHESIS, codeOf("(1+2"));
        assertEquals(FormulaErrorCode.UNEXPECTED_END, codeOf("1+"));
        assertEquals(FormulaErrorCode.UNEXPECTED_TOKEN, codeOf("*2"));
        assertEquals(FormulaErrorCode.EXPECTED_CELL_REFERENCE, codeOf("@[Budget]"));
        assertEquals(FormulaErrorCode.EXPECTED_CELL_REFERENCE, codeOf("@[Budget]:5"));
    }

    private static FormulaErrorCode codeOf(String formula) {
        return assertThrows(FormulaSyntaxException.class, () -> FormulaParser.parse(formula)).getCode();
    }
}
