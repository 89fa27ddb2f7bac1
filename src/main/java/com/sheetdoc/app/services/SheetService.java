package com.sheetdoc.app.services;

import com.sheetdoc.app.config.SheetProperties;
import com.sheetdoc.app.evaluation.EvaluatedCell;
import com.sheetdoc.app.evaluation.EvaluationOptions;
import com.sheetdoc.app.evaluation.ExternalResolution;
import com.sheetdoc.app.evaluation.SheetEvaluation;
import com.sheetdoc.app.evaluation.SheetEvaluator;
import com.sheetdoc.app.exceptions.SheetNotFoundException;
import com.sheetdoc.app.exceptions.SheetTooLargeException;
import com.sheetdoc.app.formula.DependencyCollector;
import com.sheetdoc.app.models.CellUpdate;
import com.sheetdoc.app.models.CreateSheetRequest;
import com.sheetdoc.app.models.DependencyRecord;
import com.sheetdoc.app.models.PageReference;
import com.sheetdoc.app.models.Sheet;
import com.sheetdoc.app.models.SheetData;
import com.sheetdoc.app.repositories.SheetRepository;
import com.sheetdoc.app.sheetdoc.SheetContentParser;
import com.sheetdoc.app.sheetdoc.SheetDocCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Main business logic for creating sheets, editing cells, evaluating
 * formulas and moving sheets in and out of SheetDoc text.
 *
 * Edits take the sheet's write lock. Evaluation works on a snapshot taken
 * under the read lock, and sheets mentioned by formulas are snapshotted the
 * same way, so no two sheet locks are ever held at once.
 */
@Service
public class SheetService {

    private static final Logger logger = LoggerFactory.getLogger(SheetService.class);

    private final SheetRepository sheetRepository;
    private final SheetEvaluator sheetEvaluator;
    private final SheetDocCodec sheetDocCodec;
    private final SheetContentParser sheetContentParser;
    private final SheetProperties sheetProperties;

    public SheetService(SheetRepository sheetRepository, SheetEvaluator sheetEvaluator, SheetDocCodec sheetDocCodec,
                        SheetContentParser sheetContentParser, SheetProperties sheetProperties) {
        this.sheetRepository = sheetRepository;
        this.sheetEvaluator = sheetEvaluator;
        this.sheetDocCodec = sheetDocCodec;
        this.sheetContentParser = sheetContentParser;
        this.sheetProperties = sheetProperties;
    }

    /**
     * Creates an empty sheet and returns its ID. A null request, or null
     * fields in it, use the configured defaults.
     */
    public long createSheet(CreateSheetRequest request) {
        CreateSheetRequest options = request == null ? new CreateSheetRequest() : request;
        int rows = options.getRowCount() == null ? sheetProperties.getDefaultRowCount() : options.getRowCount();
        int columns = options.getColumnCount() == null
                ? sheetProperties.getDefaultColumnCount()
                : options.getColumnCount();
        checkSize(rows, columns);

        Sheet sheet = sheetRepository.save(new Sheet(options.getTitle(), SheetData.createEmpty(rows, columns)));
        if (sheet.getTitle() == null || sheet.getTitle().trim().isEmpty()) {
            sheet.setTitle("Sheet " + sheet.getId());
        }
        logger.info("Created sheet {} ({}x{})", sheet.getId(), rows, columns);
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        return sheetRepository.findById(sheetId)
                .orElseThrow(() -> new SheetNotFoundException("Sheet not found: " + sheetId));
    }

    /**
     * Sets one cell's raw text. Blank text clears the cell, and the grid grows
     * if the address lies outside it. Formula errors do not reject the edit;
     * they show up in the evaluation.
     */
    public void setCellValue(long sheetId, String address, String rawValue) {
        updateCells(sheetId, Collections.singletonList(new CellUpdate(address, rawValue)));
    }

    /**
     * Applies a batch of edits atomically: one invalid address, or one address
     * beyond the size limits, rejects the whole batch.
     */
    public void updateCells(long sheetId, List<CellUpdate> updates) {
        Sheet sheet = getSheet(sheetId);

        // Prevent race conditions among multiple writers
        sheet.getLock().writeLock().lock();
        try {
            SheetData updated = sheet.getData().withCellUpdates(updates);
            checkSize(updated.getRowCount(), updated.getColumnCount());
            sheet.setData(updated);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
        logger.debug("Applied {} cell update(s) to sheet {}", updates.size(), sheetId);
    }

    /**
     * Replaces the grid with stored content in any accepted form. Unreadable
     * content yields an empty sheet rather than an error.
     */
    public void replaceContent(long sheetId, Object content) {
        replaceData(getSheet(sheetId), sheetContentParser.parse(content));
    }

    /**
     * Loads SheetDoc text into the sheet. In strict mode a malformed document
     * is rejected with a SheetDocFormatException; otherwise it degrades to an
     * empty sheet.
     */
    public void importDocument(long sheetId, String text, boolean strict) {
        Sheet sheet = getSheet(sheetId);
        SheetData data = strict
                ? sheetDocCodec.toSheetData(sheetDocCodec.parse(text))
                : sheetContentParser.parse(text);
        replaceData(sheet, data);
    }

    private void checkSize(int rows, int columns) {
        if (rows > sheetProperties.getMaxRowCount() || columns > sheetProperties.getMaxColumnCount()) {
            throw new SheetTooLargeException("Sheet size " + rows + "x" + columns + " exceeds the limit of "
                    + sheetProperties.getMaxRowCount() + "x" + sheetProperties.getMaxColumnCount());
        }
    }

    private void replaceData(Sheet sheet, SheetData data) {
        SheetData sanitized = SheetContentParser.sanitize(data);
        checkSize(sanitized.getRowCount(), sanitized.getColumnCount());
        sheet.getLock().writeLock().lock();
        try {
            sheet.setData(sanitized);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
        logger.info("Replaced content of sheet {} ({} cells)", sheet.getId(), sanitized.getCells().size());
    }

    /**
     * Evaluates the current grid. Mentions of other sheets are resolved
     * against this service's repository.
     */
    public SheetEvaluation evaluate(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        return sheetEvaluator.evaluate(sheet.snapshot(), optionsFor(sheet));
    }

    /**
     * Returns address -> evaluated value for every non-empty cell,
     * e.g. { "A1": 3, "B1": "hello", "C1": "#ERROR" }.
     */
    public Map<String, Object> getSheetData(long sheetId) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (EvaluatedCell cell : evaluate(sheetId).getByAddress().values()) {
            if (cell.hasError()) {
                data.put(cell.getAddress(), cell.getDisplay());
            } else if (!cell.getValue().isEmpty()) {
                data.put(cell.getAddress(), cell.getValue().toJavaValue());
            }
        }
        return data;
    }

    /**
     * For each cell => the cells it references.
     */
    public Map<String, List<String>> getForwardDependencies(long sheetId) {
        return dependencyGraph(sheetId, DependencyRecord::getDependsOn);
    }

    /**
     * For each cell => the cells that reference it.
     */
    public Map<String, List<String>> getReverseDependencies(long sheetId) {
        return dependencyGraph(sheetId, DependencyRecord::getDependents);
    }

    private Map<String, List<String>> dependencyGraph(long sheetId, Function<DependencyRecord, List<String>> edges) {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        evaluate(sheetId).getDependencies().forEach((address, record) -> {
            if (!edges.apply(record).isEmpty()) {
                graph.put(address, edges.apply(record));
            }
        });
        return graph;
    }

    /**
     * The sheet as SheetDoc text, with its ID as page_id.
     */
    public String exportDocument(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        return sheetDocCodec.serialize(sheet.snapshot(), String.valueOf(sheet.getId()),
                sheetProperties.getDefaultSheetName(), optionsFor(sheet));
    }

    /**
     * Distinct pages mentioned by the sheet's formulas.
     */
    public List<PageReference> getExternalReferences(long sheetId) {
        return DependencyCollector.collectExternalReferences(getSheet(sheetId).snapshot(),
                sheetProperties.getMaxRangeCells());
    }

    private EvaluationOptions optionsFor(Sheet sheet) {
        return new EvaluationOptions(String.valueOf(sheet.getId()), sheet.getTitle(), this::resolve);
    }

    /**
     * Finds the mentioned sheet by numeric identifier first, then by title
     * (case-insensitive). Returns null when nothing matches.
     */
    ExternalResolution resolve(PageReference page) {
        Optional<Sheet> target = Optional.empty();
        if (page.getIdentifier() != null && page.getIdentifier().matches("\\d+")) {
            try {
                target = sheetRepository.findById(Long.parseLong(page.getIdentifier()));
            } catch (NumberFormatException e) {
                logger.debug("Page identifier {} is out of range", page.getIdentifier());
            }
        }
        if (!target.isPresent()) {
            target = sheetRepository.findAll().stream()
                    .filter(candidate -> candidate.getTitle() != null
                            && candidate.getTitle().trim().toLowerCase().equals(page.getNormalizedLabel()))
                    .findFirst();
        }
        if (!target.isPresent()) {
            logger.debug("No sheet matches {}", page.getRaw());
            return null;
        }
        Sheet found = target.get();
        return ExternalResolution.found(String.valueOf(found.getId()), found.getTitle(), found.snapshot());
    }
}
