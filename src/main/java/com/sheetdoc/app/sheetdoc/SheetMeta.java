package com.sheetdoc.app.sheetdoc;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sheet geometry plus any extra presentation keys. Extra keys are stored
 * camelCase and written snake_case.
 */
public class SheetMeta {

    private final int rowCount;
    private final int columnCount;
    private final Integer frozenRows;
    private final Integer frozenColumns;
    private final Map<String, Object> extras;

    public SheetMeta(int rowCount, int columnCount) {
        this(rowCount, columnCount, null, null, Collections.emptyMap());
    }

    public SheetMeta(int rowCount, int columnCount, Integer frozenRows, Integer frozenColumns,
                     Map<String, Object> extras) {
        this.rowCount = Math.max(1, rowCount);
        this.columnCount = Math.max(1, columnCount);
        this.frozenRows = frozenRows;
        this.frozenColumns = frozenColumns;
        this.extras = Collections.unmodifiableMap(new TreeMap<>(extras));
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public Integer getFrozenRows() {
        return frozenRows;
    }

    public Integer getFrozenColumns() {
        return frozenColumns;
    }

    public Map<String, Object> getExtras() {
        return extras;
    }
}
