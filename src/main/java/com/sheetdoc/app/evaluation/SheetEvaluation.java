package com.sheetdoc.app.evaluation;

import com.sheetdoc.app.models.DependencyRecord;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one evaluation pass over the rowCount x columnCount grid.
 * The display and error matrices are row-major; an error entry is null for
 * a cell that evaluated cleanly.
 */
public class SheetEvaluation {

    private final Map<String, EvaluatedCell> byAddress;
    private final List<List<String>> display;
    private final List<List<String>> errors;
    private final Map<String, DependencyRecord> dependencies;

    public SheetEvaluation(Map<String, EvaluatedCell> byAddress, List<List<String>> display,
                           List<List<String>> errors, Map<String, DependencyRecord> dependencies) {
        this.byAddress = Collections.unmodifiableMap(byAddress);
        this.display = Collections.unmodifiableList(display);
        this.errors = Collections.unmodifiableList(errors);
        this.dependencies = Collections.unmodifiableMap(dependencies);
    }

    public Map<String, EvaluatedCell> getByAddress() {
        return byAddress;
    }

    public EvaluatedCell getCell(String address) {
        return byAddress.get(address.trim().toUpperCase());
    }

    public List<List<String>> getDisplay() {
        return display;
    }

    public List<List<String>> getErrors() {
        return errors;
    }

    public Map<String, DependencyRecord> getDependencies() {
        return dependencies;
    }
}
