package com.sheetdoc.app.models;

import com.sheetdoc.app.exceptions.InvalidCellAddressException;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The live grid of one sheet:
 * - a format version
 * - declared row and column counts (both at least 1)
 * - a sparse map of canonical address ("A1") -> raw cell text
 * An address missing from the map is an empty cell.
 * This is also the JSON interchange shape.
 */
public class SheetData {

    public static final int VERSION = 1;
    public static final int DEFAULT_ROWS = 20;
    public static final int DEFAULT_COLUMNS = 10;

    private int version = VERSION;
    private int rowCount = DEFAULT_ROWS;
    private int columnCount = DEFAULT_COLUMNS;
    private Map<String, String> cells = new TreeMap<>();

    // Default constructor needed for JSON (de)serialization
    public SheetData() {
    }

    public SheetData(int version, int rowCount, int columnCount, Map<String, String> cells) {
        this.version = version;
        this.rowCount = Math.max(1, rowCount);
        this.columnCount = Math.max(1, columnCount);
        setCells(cells);
    }

    public static SheetData createEmpty() {
        return createEmpty(DEFAULT_ROWS, DEFAULT_COLUMNS);
    }

    public static SheetData createEmpty(int rows, int columns) {
        return new SheetData(VERSION, rows, columns, new TreeMap<>());
    }

    public int getVersion() {
        return version;
    }
    public int getRowCount() {
        return rowCount;
    }
    public int getColumnCount() {
        return columnCount;
    }
    public Map<String, String> getCells() {
        return cells;
    }

    public void setVersion(int version) {
        this.version = version;
    }
    public void setRowCount(int rowCount) {
        this.rowCount = Math.max(1, rowCount);
    }
    public void setColumnCount(int columnCount) {
        this.columnCount = Math.max(1, columnCount);
    }

    /**
     * Replaces all cells; keys are uppercased.
     */
    public void setCells(Map<String, String> cells) {
        TreeMap<String, String> copy = new TreeMap<>();
        if (cells != null) {
            cells.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key.toUpperCase(), value);
                }
            });
        }
        this.cells = copy;
    }

    /**
     * Raw text at the address, "" for an empty cell.
     */
    public String getCell(String address) {
        String raw = cells.get(address.toUpperCase());
        return raw == null ? "" : raw;
    }

    /**
     * Replaces a single cell's raw text.
     */
    public void setCell(String address, String raw) {
        cells.put(address.toUpperCase(), raw);
    }

    public SheetData copy() {
        return new SheetData(version, rowCount, columnCount, cells);
    }

    /**
     * Returns a new SheetData with the updates applied:
     * blank values remove the cell, and the grid grows to include
     * the furthest updated address. This sheet is left untouched.
     */
    public SheetData withCellUpdates(List<CellUpdate> updates) {
        SheetData updated = copy();
        int maxRow = rowCount;
        int maxColumn = columnCount;

        for (CellUpdate update : updates) {
            String address = CellAddress.normalize(update.getAddress());
            if (address == null) {
                throw new InvalidCellAddressException("Invalid cell address: \"" + update.getAddress()
                        + "\". Use A1-style format (e.g., A1, B2, AA100).");
            }

            String value = update.getValue() == null ? "" : update.getValue();
            if (value.trim().isEmpty()) {
                updated.cells.remove(address);
            } else {
                updated.cells.put(address, value);
            }

            CellAddress decoded = CellAddress.decode(address);
            maxRow = Math.max(maxRow, decoded.getRow() + 1);
            maxColumn = Math.max(maxColumn, decoded.getColumn() + 1);
        }

        updated.setRowCount(maxRow);
        updated.setColumnCount(maxColumn);
        return updated;
    }
}
