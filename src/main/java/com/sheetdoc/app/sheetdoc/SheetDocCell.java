package com.sheetdoc.app.sheetdoc;

import com.sheetdoc.app.models.CellValue;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One persisted cell. Every field is optional; a null value means the key
 * is absent from the document, while {@link CellValue#EMPTY} is written as "".
 */
public class SheetDocCell {

    private final String formula;
    private final CellValue value;
    private final String type;
    private final List<String> notes;
    private final SheetDocCellError error;

    public SheetDocCell(String formula, CellValue value, String type, List<String> notes,
                        SheetDocCellError error) {
        this.formula = formula;
        this.value = value;
        this.type = type;
        this.notes = notes == null ? Collections.emptyList() : Collections.unmodifiableList(notes);
        this.error = error;
    }

    public String getFormula() {
        return formula;
    }

    public CellValue getValue() {
        return value;
    }

    public String getType() {
        return type;
    }

    public List<String> getNotes() {
        return notes;
    }

    public SheetDocCellError getError() {
        return error;
    }

    public boolean isEmpty() {
        return formula == null && value == null && type == null && notes.isEmpty() && error == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SheetDocCell)) {
            return false;
        }
        SheetDocCell that = (SheetDocCell) o;
        return Objects.equals(formula, that.formula) && Objects.equals(value, that.value)
                && Objects.equals(type, that.type) && notes.equals(that.notes)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(formula, value, type, notes, error);
    }
}
