package com.sheetdoc.app.config;

import com.sheetdoc.app.formula.DependencyCollector;
import com.sheetdoc.app.models.SheetData;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults for newly created sheets and size limits for stored ones,
 * bound from "sheets.*".
 */
@ConfigurationProperties(prefix = "sheets")
public class SheetProperties {

    private int defaultRowCount = SheetData.DEFAULT_ROWS;
    private int defaultColumnCount = SheetData.DEFAULT_COLUMNS;
    private String defaultSheetName = "Sheet1";
    private int maxRowCount = 10000;
    private int maxColumnCount = 500;
    private int maxRangeCells = DependencyCollector.DEFAULT_MAX_RANGE_CELLS;

    public int getDefaultRowCount() {
        return defaultRowCount;
    }

    public void setDefaultRowCount(int defaultRowCount) {
        this.defaultRowCount = defaultRowCount;
    }

    public int getDefaultColumnCount() {
        return defaultColumnCount;
    }

    public void setDefaultColumnCount(int defaultColumnCount) {
        this.defaultColumnCount = defaultColumnCount;
    }

    public String getDefaultSheetName() {
        return defaultSheetName;
    }

    public void setDefaultSheetName(String defaultSheetName) {
        this.defaultSheetName = defaultSheetName;
    }

    public int getMaxRowCount() {
        return maxRowCount;
    }

    public void setMaxRowCount(int maxRowCount) {
        this.maxRowCount = maxRowCount;
    }

    public int getMaxColumnCount() {
        return maxColumnCount;
    }

    public void setMaxColumnCount(int maxColumnCount) {
        this.maxColumnCount = maxColumnCount;
    }

    public int getMaxRangeCells() {
        return maxRangeCells;
    }

    public void setMaxRangeCells(int maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }
}
