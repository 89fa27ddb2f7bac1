package com.sheetdoc.app.evaluation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.sheetdoc.app.models.CellType;
import com.sheetdoc.app.models.CellValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of evaluating one cell:
 * - address and the raw text it was evaluated from
 * - the computed value, its type and display text
 * - the error, if the cell failed ("#ERROR", or "#CYCLE" for cycles)
 * - dependsOn: everything the formula reads
 * - dependents: in-bounds cells that read this one (filled after a full pass)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EvaluatedCell {

    public static final String CYCLE_DISPLAY = "#CYCLE";

    private final String address;
    private final String raw;
    private final CellValue value;
    private final String display;
    private final EvalError evalError;
    private final List<String> dependsOn;
    private List<String> dependents = Collections.emptyList();

    private EvaluatedCell(String address, String raw, CellValue value, String display,
                          EvalError evalError, List<String> dependsOn) {
        this.address = address;
        this.raw = raw;
        this.value = value;
        this.display = display;
        this.evalError = evalError;
        this.dependsOn = Collections.unmodifiableList(new ArrayList<>(dependsOn));
    }

    public static EvaluatedCell of(String address, String raw, CellValue value, List<String> dependsOn) {
        return new EvaluatedCell(address, raw, value, ValueCoercion.display(value), null, dependsOn);
    }

    public static EvaluatedCell failed(String address, String raw, EvalError error, List<String> dependsOn) {
        String display = error.isCircular() ? CYCLE_DISPLAY : NumberFormatting.ERROR_DISPLAY;
        return new EvaluatedCell(address, raw, CellValue.EMPTY, display, error, dependsOn);
    }

    public String getAddress() {
        return address;
    }

    public String getRaw() {
        return raw;
    }

    public CellValue getValue() {
        return value;
    }

    public String getDisplay() {
        return display;
    }

    public CellType getType() {
        return value.getType();
    }

    /**
     * Human readable error message, null when the cell evaluated cleanly.
     */
    public String getError() {
        return evalError == null ? null : evalError.getMessage();
    }

    @JsonIgnore
    public EvalError getEvalError() {
        return evalError;
    }

    @JsonIgnore
    public boolean hasError() {
        return evalError != null;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public List<String> getDependents() {
        return dependents;
    }

    void setDependents(List<String> dependents) {
        this.dependents = Collections.unmodifiableList(new ArrayList<>(dependents));
    }
}
