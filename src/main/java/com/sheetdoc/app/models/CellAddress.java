package com.sheetdoc.app.models;

import com.sheetdoc.app.exceptions.InvalidCellAddressException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Zero-based (row, column) position in a sheet.
 * The canonical text form is column letters followed by the 1-based row,
 * e.g. (0,0) is "A1" and (4,1) is "B5". Columns use base-26 letters with
 * no zero digit (A..Z, AA..AZ, ...).
 */
public final class CellAddress implements Comparable<CellAddress> {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^([A-Z]+)(\\d+)$");

    private final int row;
    private final int column;

    public CellAddress(int row, int column) {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Row and column indices must be non-negative");
        }
        this.row = row;
        this.column = column;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Encodes a zero-based row/column pair, e.g. (4,1) -> "B5".
     */
    public static String encode(int row, int column) {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Row and column indices must be non-negative");
        }
        StringBuilder letters = new StringBuilder();
        int index = column;
        while (index >= 0) {
            letters.insert(0, (char) ('A' + index % 26));
            index = index / 26 - 1;
        }
        return letters.toString() + (row + 1);
    }

    /**
     * Decodes "B5" (any case) into (4,1).
     * Throws InvalidCellAddressException if the text is not LETTERS DIGITS.
     */
    public static CellAddress decode(String address) {
        if (address == null) {
            throw new InvalidCellAddressException("Invalid cell reference: null");
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(address.trim().toUpperCase());
        if (!matcher.matches()) {
            throw new InvalidCellAddressException("Invalid cell reference: " + address);
        }
        long column = 0;
        for (char letter : matcher.group(1).toCharArray()) {
            column = column * 26 + (letter - 'A' + 1);
            if (column > Integer.MAX_VALUE) {
                throw new InvalidCellAddressException("Column out of range: " + address);
            }
        }
        long row;
        try {
            row = Long.parseLong(matcher.group(2)) - 1;
        } catch (NumberFormatException e) {
            throw new InvalidCellAddressException("Row out of range: " + address);
        }
        // the 1-based row must itself fit in an int
        if (row < 0 || row >= Integer.MAX_VALUE) {
            throw new InvalidCellAddressException("Row out of range: " + address);
        }
        return new CellAddress((int) row, (int) column - 1);
    }

    /**
     * True if the text (trimmed, any case) is syntactically an A1-style address.
     */
    public static boolean isValid(String address) {
        return address != null && ADDRESS_PATTERN.matcher(address.trim().toUpperCase()).matches();
    }

    /**
     * Uppercased, trimmed address if valid, otherwise null.
     */
    public static String normalize(String address) {
        if (!isValid(address)) {
            return null;
        }
        return address.trim().toUpperCase();
    }

    /**
     * Every address of the rectangle spanned by the two corners, row-major.
     * The corners may be given in any order.
     */
    public static List<String> expandRange(String start, String end) {
        CellAddress from = decode(start);
        CellAddress to = decode(end);

        int minRow = Math.min(from.row, to.row);
        int maxRow = Math.max(from.row, to.row);
        int minColumn = Math.min(from.column, to.column);
        int maxColumn = Math.max(from.column, to.column);

        List<String> addresses = new ArrayList<>();
        for (int r = minRow; r <= maxRow; r++) {
            for (int c = minColumn; c <= maxColumn; c++) {
                addresses.add(encode(r, c));
            }
        }
        return addresses;
    }

    /**
     * Number of cells in the rectangle spanned by the two corners.
     */
    public static long rangeSize(String start, String end) {
        CellAddress from = decode(start);
        CellAddress to = decode(end);
        long rows = Math.abs((long) from.row - to.row) + 1;
        long columns = Math.abs((long) from.column - to.column) + 1;
        return rows * columns;
    }

    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return encode(row, column);
    }
}
