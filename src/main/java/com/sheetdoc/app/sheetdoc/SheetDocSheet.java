package com.sheetdoc.app.sheetdoc;

import com.sheetdoc.app.models.DependencyRecord;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One sheet of a SheetDoc. All maps are sorted by key so that writing the
 * same logical sheet twice gives the same text.
 */
public class SheetDocSheet {

    private final String name;
    private final int order;
    private final SheetMeta meta;
    private final Map<String, Map<String, Object>> columns;
    private final Map<String, SheetDocCell> cells;
    private final Map<String, Map<String, Object>> ranges;
    private final Map<String, DependencyRecord> dependencies;

    public SheetDocSheet(String name, int order, SheetMeta meta,
                         Map<String, Map<String, Object>> columns,
                         Map<String, SheetDocCell> cells,
                         Map<String, Map<String, Object>> ranges,
                         Map<String, DependencyRecord> dependencies) {
        this.name = name;
        this.order = order;
        this.meta = meta;
        this.columns = Collections.unmodifiableMap(new TreeMap<>(columns));
        this.cells = Collections.unmodifiableMap(new TreeMap<>(cells));
        this.ranges = Collections.unmodifiableMap(new TreeMap<>(ranges));
        this.dependencies = Collections.unmodifiableMap(new TreeMap<>(dependencies));
    }

    public static SheetDocSheet empty(String name, int rowCount, int columnCount) {
        return new SheetDocSheet(name, 0, new SheetMeta(rowCount, columnCount),
                Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap());
    }

    public String getName() {
        return name;
    }

    public int getOrder() {
        return order;
    }

    public SheetMeta getMeta() {
        return meta;
    }

    public Map<String, Map<String, Object>> getColumns() {
        return columns;
    }

    public Map<String, SheetDocCell> getCells() {
        return cells;
    }

    public Map<String, Map<String, Object>> getRanges() {
        return ranges;
    }

    public Map<String, DependencyRecord> getDependencies() {
        return dependencies;
    }
}
