package com.sheetdoc.app.formula;

import com.sheetdoc.app.formula.ast.BinaryExpression;
import com.sheetdoc.app.formula.ast.BooleanLiteral;
import com.sheetdoc.app.formula.ast.CellReference;
import com.sheetdoc.app.formula.ast.Expression;
import com.sheetdoc.app.formula.ast.ExpressionVisitor;
import com.sheetdoc.app.formula.ast.ExternalCellReference;
import com.sheetdoc.app.formula.ast.ExternalRange;
import com.sheetdoc.app.formula.ast.FunctionCall;
import com.sheetdoc.app.formula.ast.NumberLiteral;
import com.sheetdoc.app.formula.ast.Range;
import com.sheetdoc.app.formula.ast.StringLiteral;
import com.sheetdoc.app.formula.ast.UnaryExpression;
import com.sheetdoc.app.models.PageReference;
import com.sheetdoc.app.models.SheetData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Lists what a formula reads without evaluating it.
 * Local references come back as addresses ("B2"); references to other pages
 * come back as canonical mention keys ("@[Budget](p1):B2").
 */
public final class DependencyCollector implements ExpressionVisitor<Void> {

    public static final int DEFAULT_MAX_RANGE_CELLS = 100000;

    private static final Logger logger = LoggerFactory.getLogger(DependencyCollector.class);

    private final int maxRangeCells;
    private final SortedSet<String> references = new TreeSet<>();
    private final Map<String, PageReference> pages = new LinkedHashMap<>();

    private DependencyCollector(int maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    public static List<String> collect(Expression expression) {
        return collect(expression, DEFAULT_MAX_RANGE_CELLS);
    }

    /**
     * Sorted, de-duplicated dependency keys of the expression; ranges are expanded.
     * A range covering more than maxRangeCells cells fails with RANGE_TOO_LARGE
     * before anything is expanded.
     */
    public static List<String> collect(Expression expression, int maxRangeCells) {
        DependencyCollector collector = new DependencyCollector(maxRangeCells);
        expression.accept(collector);
        return new ArrayList<>(collector.references);
    }

    public static List<PageReference> collectExternalReferences(SheetData sheet) {
        return collectExternalReferences(sheet, DEFAULT_MAX_RANGE_CELLS);
    }

    /**
     * Distinct pages mentioned by any formula of the sheet, in first-seen order.
     * Formulas that do not parse, or that name a range over the limit, are skipped.
     */
    public static List<PageReference> collectExternalReferences(SheetData sheet, int maxRangeCells) {
        Map<String, PageReference> pages = new LinkedHashMap<>();
        for (String raw : sheet.getCells().values()) {
            String trimmed = raw == null ? "" : raw.trim();
            if (!trimmed.startsWith("=")) {
                continue;
            }
            DependencyCollector collector = new DependencyCollector(maxRangeCells);
            try {
                FormulaParser.parse(trimmed.substring(1)).accept(collector);
            } catch (FormulaSyntaxException e) {
                logger.debug("Skipping formula {}: {}", trimmed, e.getMessage());
                continue;
            }
            collector.pages.forEach(pages::putIfAbsent);
        }
        return new ArrayList<>(pages.values());
    }

    @Override
    public Void visitNumber(NumberLiteral node) {
        return null;
    }

    @Override
    public Void visitString(StringLiteral node) {
        return null;
    }

    @Override
    public Void visitBoolean(BooleanLiteral node) {
        return null;
    }

    @Override
    public Void visitCell(CellReference node) {
        references.add(node.getAddress());
        return null;
    }

    @Override
    public Void visitRange(Range node) {
        checkSize(node.size(), node.getStart().getAddress(), node.getEnd().getAddress());
        references.addAll(node.addresses());
        return null;
    }

    @Override
    public Void visitExternalCell(ExternalCellReference node) {
        pages.putIfAbsent(node.getPage().getRaw(), node.getPage());
        references.add(node.getPage().formatCell(node.getAddress()));
        return null;
    }

    @Override
    public Void visitExternalRange(ExternalRange node) {
        checkSize(node.size(), node.getStart().getAddress(), node.getEnd().getAddress());
        pages.putIfAbsent(node.getPage().getRaw(), node.getPage());
        for (String address : node.addresses()) {
            references.add(node.getPage().formatCell(address));
        }
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpression node) {
        node.getArgument().accept(this);
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpression node) {
        node.getLeft().accept(this);
        node.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall node) {
        for (Expression argument : node.getArguments()) {
            argument.accept(this);
        }
        return null;
    }

    private void checkSize(long size, String start, String end) {
        if (size > maxRangeCells) {
            throw new FormulaSyntaxException(FormulaErrorCode.RANGE_TOO_LARGE,
                    "Range " + start + ":" + end + " covers " + size + " cells; the limit is " + maxRangeCells);
        }
    }
}
