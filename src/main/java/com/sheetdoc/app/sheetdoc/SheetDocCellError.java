package com.sheetdoc.app.sheetdoc;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class SheetDocCellError {

    public static final String CIRCULAR_REF = "CIRCULAR_REF";
    public static final String EVAL_ERROR = "EVAL_ERROR";

    private final String type;
    private final String message;
    private final List<String> details;

    public SheetDocCellError(String type, String message, List<String> details) {
        this.type = type;
        this.message = message;
        this.details = details == null ? Collections.emptyList() : Collections.unmodifiableList(details);
    }

    public String getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getDetails() {
        return details;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SheetDocCellError)) {
            return false;
        }
        SheetDocCellError that = (SheetDocCellError) o;
        return type.equals(that.type) && Objects.equals(message, that.message) && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, message, details);
    }
}
