package com.sheetdoc.app.models;

/**
 * Optional body of POST /sheet. Missing fields fall back to the configured defaults.
 */
public class CreateSheetRequest {

    private String title;
    private Integer rowCount;
    private Integer columnCount;

    // Default constructor needed for JSON deserialization
    public CreateSheetRequest() {
    }

    public CreateSheetRequest(String title, Integer rowCount, Integer columnCount) {
        this.title = title;
        this.rowCount = rowCount;
        this.columnCount = columnCount;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Integer getRowCount() {
        return rowCount;
    }

    public void setRowCount(Integer rowCount) {
        this.rowCount = rowCount;
    }

    public Integer getColumnCount() {
        return columnCount;
    }

    public void setColumnCount(Integer columnCount) {
        this.columnCount = columnCount;
    }
}
