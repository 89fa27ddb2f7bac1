package com.sheetdoc.app.evaluation;

import com.sheetdoc.app.evaluation.functions.FunctionLibrary;
import com.sheetdoc.app.formula.DependencyCollector;
import com.sheetdoc.app.formula.FormulaParser;
import com.sheetdoc.app.formula.FormulaSyntaxException;
import com.sheetdoc.app.formula.Tokenizer;
import com.sheetdoc.app.formula.ast.Expression;
import com.sheetdoc.app.models.CellAddress;
import com.sheetdoc.app.models.CellValue;
import com.sheetdoc.app.models.DependencyRecord;
import com.sheetdoc.app.models.PageReference;
import com.sheetdoc.app.models.SheetData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Evaluates every cell of a sheet in one pass.
 *
 * Each pass gets a fresh {@link EvaluationContext}, so evaluator instances
 * hold no per-sheet state and can be shared between threads. Cells are
 * evaluated on demand and memoized; re-entering a cell that is still being
 * evaluated yields a circular-reference error instead of recursing.
 */
public class SheetEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(SheetEvaluator.class);

    private final FunctionLibrary functions;
    private final int maxRangeCells;

    public SheetEvaluator() {
        this(FunctionLibrary.standard());
    }

    public SheetEvaluator(FunctionLibrary functions) {
        this(functions, DependencyCollector.DEFAULT_MAX_RANGE_CELLS);
    }

    /**
     * @param maxRangeCells largest range a formula may name; bigger ranges
     *                      make that cell fail instead of being expanded
     */
    public SheetEvaluator(FunctionLibrary functions, int maxRangeCells) {
        this.functions = functions;
        this.maxRangeCells = maxRangeCells;
    }

    public SheetEvaluation evaluate(SheetData sheet) {
        return evaluate(sheet, EvaluationOptions.standalone());
    }

    public SheetEvaluation evaluate(SheetData sheet, EvaluationOptions options) {
        int rowCount = Math.max(1, sheet.getRowCount());
        int columnCount = Math.max(1, sheet.getColumnCount());
        EvaluationContext context = new EvaluationContext(sheet, options);
        String pageKey = context.getLocalPageKey();

        Map<String, EvaluatedCell> byAddress = new LinkedHashMap<>();
        List<List<String>> display = new ArrayList<>(rowCount);
        List<List<String>> errors = new ArrayList<>(rowCount);

        for (int row = 0; row < rowCount; row++) {
            List<String> displayRow = new ArrayList<>(columnCount);
            List<String> errorRow = new ArrayList<>(columnCount);
            for (int column = 0; column < columnCount; column++) {
                String address = CellAddress.encode(row, column);
                EvaluatedCell cell = evaluateCell(pageKey, address, context);
                byAddress.put(address, cell);
                displayRow.add(cell.getDisplay());
                errorRow.add(cell.getError());
            }
            display.add(displayRow);
            errors.add(errorRow);
        }

        Map<String, DependencyRecord> dependencies = linkDependents(byAddress);
        logger.debug("Evaluated {}x{} grid of page {}", rowCount, columnCount, pageKey);
        return new SheetEvaluation(byAddress, display, errors, dependencies);
    }

    /**
     * Evaluates a single cell of the sheet, e.g. for previews. Dependents are
     * not filled in.
     */
    public EvaluatedCell evaluateCell(SheetData sheet, String address, EvaluationOptions options) {
        EvaluationContext context = new EvaluationContext(sheet, options);
        return evaluateCell(context.getLocalPageKey(), CellAddress.decode(address).toString(), context);
    }

    EvaluatedCell evaluateCell(String pageKey, String address, EvaluationContext context) {
        EvaluatedCell cached = context.cached(pageKey, address);
        if (cached != null) {
            return cached;
        }

        SheetData sheet = context.sheet(pageKey);
        String raw = sheet.getCell(address);

        if (context.isInProgress(pageKey, address)) {
            return EvaluatedCell.failed(address, raw, EvalError.circular(context.cycleFrom(pageKey, address)),
                    Collections.emptyList());
        }

        context.enter(pageKey, address);
        EvaluatedCell result;
        try {
            result = evaluateRaw(pageKey, address, raw, context);
        } finally {
            context.exit(pageKey, address);
        }

        context.cache(pageKey, result);
        return result;
    }

    private EvaluatedCell evaluateRaw(String pageKey, String address, String raw, EvaluationContext context) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return EvaluatedCell.of(address, raw, CellValue.EMPTY, Collections.emptyList());
        }
        if (trimmed.startsWith("=")) {
            return evaluateFormula(pageKey, address, raw, trimmed.substring(1), context);
        }
        if (Tokenizer.isNumberLiteral(trimmed)) {
            return EvaluatedCell.of(address, raw, CellValue.number(Double.parseDouble(trimmed)),
                    Collections.emptyList());
        }
        return EvaluatedCell.of(address, raw, CellValue.string(raw), Collections.emptyList());
    }

    private EvaluatedCell evaluateFormula(String pageKey, String address, String raw, String formula,
                                          EvaluationContext context) {
        Expression expression;
        List<String> dependsOn;
        try {
            expression = FormulaParser.parse(formula);
            dependsOn = DependencyCollector.collect(expression, maxRangeCells);
        } catch (FormulaSyntaxException e) {
            logger.debug("Formula in {} is rejected: {}", address, e.getMessage());
            return EvaluatedCell.failed(address, raw, new EvalError(EvalErrorCode.SYNTAX, e.getMessage()),
                    Collections.emptyList());
        }

        ExpressionEvaluator evaluator = new ExpressionEvaluator(functions, new CellValueProvider() {
            @Override
            public Result<CellValue> local(String reference) {
                return valueOf(evaluateCell(pageKey, reference, context));
            }

            @Override
            public Result<CellValue> external(PageReference page, String reference) {
                return valueOf(evaluateExternalCell(page, reference, context));
            }
        });

        Result<CellValue> value = evaluator.evaluate(expression);
        if (value.isError()) {
            return EvaluatedCell.failed(address, raw, value.getError(), dependsOn);
        }
        return EvaluatedCell.of(address, raw, value.getValue(), dependsOn);
    }

    private EvaluatedCell evaluateExternalCell(PageReference page, String address, EvaluationContext context) {
        ExternalResolution resolution = context.resolve(page);
        if (!resolution.isAvailable()) {
            String message = resolution.getError() != null
                    ? resolution.getError()
                    : "Referenced page \"" + page.getLabel() + "\" is not available";
            return EvaluatedCell.failed(address, "", new EvalError(EvalErrorCode.EXTERNAL_UNAVAILABLE, message),
                    Collections.emptyList());
        }
        return evaluateCell(resolution.getPageId(), address, context);
    }

    private static Result<CellValue> valueOf(EvaluatedCell cell) {
        if (cell.hasError()) {
            return Result.fail(cell.getEvalError());
        }
        return Result.ok(cell.getValue());
    }

    // Only in-bounds local cells receive dependents; external keys are ignored.
    private static Map<String, DependencyRecord> linkDependents(Map<String, EvaluatedCell> byAddress) {
        Map<String, SortedSet<String>> dependents = new TreeMap<>();
        for (EvaluatedCell cell : byAddress.values()) {
            for (String dependency : cell.getDependsOn()) {
                if (byAddress.containsKey(dependency)) {
                    dependents.computeIfAbsent(dependency, key -> new TreeSet<>()).add(cell.getAddress());
                }
            }
        }

        Map<String, DependencyRecord> records = new LinkedHashMap<>();
        for (EvaluatedCell cell : byAddress.values()) {
            SortedSet<String> readers = dependents.getOrDefault(cell.getAddress(), Collections.emptySortedSet());
            cell.setDependents(new ArrayList<>(readers));
            records.put(cell.getAddress(), new DependencyRecord(cell.getDependsOn(), cell.getDependents()));
        }
        return records;
    }
}
