package com.sheetdoc.app.evaluation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A formula failure carried as a value. Circular-reference errors also
 * carry the members of the detected cycle.
 */
public final class EvalError {

    public static final String CIRCULAR_MESSAGE = "Circular reference detected";

    private final EvalErrorCode code;
    private final String message;
    private final List<String> cycle;

    public EvalError(EvalErrorCode code, String message) {
        this(code, message, Collections.emptyList());
    }

    public EvalError(EvalErrorCode code, String message, List<String> cycle) {
        this.code = code;
        this.message = message;
        this.cycle = Collections.unmodifiableList(cycle);
    }

    public static EvalError circular(List<String> cycle) {
        return new EvalError(EvalErrorCode.CIRCULAR_REFERENCE, CIRCULAR_MESSAGE, cycle);
    }

    public static EvalError argumentCount(String message) {
        return new EvalError(EvalErrorCode.ARGUMENT_COUNT, message);
    }

    public static EvalError invalidArgument(String message) {
        return new EvalError(EvalErrorCode.INVALID_ARGUMENT, message);
    }

    public EvalErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getCycle() {
        return cycle;
    }

    public boolean isCircular() {
        return code == EvalErrorCode.CIRCULAR_REFERENCE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvalError)) {
            return false;
        }
        EvalError that = (EvalError) o;
        return code == that.code && message.equals(that.message) && cycle.equals(that.cycle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, cycle);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
