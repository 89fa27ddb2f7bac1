package com.sheetdoc.app.controllers;

import com.sheetdoc.app.evaluation.SheetEvaluation;
import com.sheetdoc.app.models.CellUpdate;
import com.sheetdoc.app.models.CreateSheetRequest;
import com.sheetdoc.app.models.PageReference;
import com.sheetdoc.app.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for managing sheets.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Optional JSON body { "title", "rowCount", "columnCount" }.
     * Creates a new empty sheet, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody(required = false) CreateSheetRequest request) {
        long sheetId = sheetService.createSheet(request);
        return ResponseEntity.ok(sheetId);
    }

    /**
     * PUT /sheet/{sheetId}/cell/{address}
     * Body: raw cell text, e.g. "42", "hello" or "=SUM(A1:A3)". An empty body clears the cell.
     * An address that is not A1-style, or lies beyond the size limit, is a 400; formula errors are not,
     * they show up in the evaluation.
     */
    @PutMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<Void> setCellValue(
            @PathVariable long sheetId,
            @PathVariable String address,
            @RequestBody(required = false) String rawValue
    ) {
        sheetService.setCellValue(sheetId, address, rawValue);
        return ResponseEntity.ok().build();
    }

    /**
     * PUT /sheet/{sheetId}/cells
     * Body: [ { "address": "A1", "value": "1" }, ... ], applied all-or-nothing.
     */
    @PutMapping("/{sheetId}/cells")
    public ResponseEntity<Void> updateCells(@PathVariable long sheetId, @RequestBody List<CellUpdate> updates) {
        sheetService.updateCells(sheetId, updates);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /sheet/{sheetId}
     * Returns evaluated values of the non-empty cells: { "A1": 3, "B1": "hello", ... }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, Object>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/evaluation
     * Full evaluation: per-cell results, display and error matrices, dependencies.
     */
    @GetMapping("/{sheetId}/evaluation")
    public ResponseEntity<SheetEvaluation> getEvaluation(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.evaluate(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * For each cell => the cells it references.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, List<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * For each cell => the cells that reference it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, List<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/document
     * The sheet as SheetDoc text.
     */
    @GetMapping(value = "/{sheetId}/document", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> exportDocument(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.exportDocument(sheetId));
    }

    /**
     * PUT /sheet/{sheetId}/document?strict=true
     * Replaces the sheet with a SheetDoc (or JSON) document. With strict=true
     * a malformed SheetDoc is a 400; otherwise it loads as an empty sheet.
     */
    @PutMapping("/{sheetId}/document")
    public ResponseEntity<Void> importDocument(
            @PathVariable long sheetId,
            @RequestParam(defaultValue = "false") boolean strict,
            @RequestBody String document
    ) {
        sheetService.importDocument(sheetId, document, strict);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /sheet/{sheetId}/externalReferences
     * Pages mentioned by the sheet's formulas.
     */
    @GetMapping("/{sheetId}/externalReferences")
    public ResponseEntity<List<PageReference>> getExternalReferences(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getExternalReferences(sheetId));
    }
}
