package com.sheetdoc.app.evaluation;

import java.util.function.Function;

/**
 * Either a value or an {@link EvalError}. Formula evaluation returns these
 * instead of throwing.
 */
public final class Result<T> {

    private final T value;
    private final EvalError error;

    private Result(T value, EvalError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> fail(EvalError error) {
        return new Result<>(null, error);
    }

    public static <T> Result<T> fail(EvalErrorCode code, String message) {
        return fail(new EvalError(code, message));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isError() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value: " + error);
        }
        return value;
    }

    public EvalError getError() {
        return error;
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return fail(error);
        }
        return ok(mapper.apply(value));
    }

    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (error != null) {
            return fail(error);
        }
        return mapper.apply(value);
    }

    /**
     * Re-types a failed result. Only valid on errors.
     */
    public <U> Result<U> propagate() {
        if (error == null) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return fail(error);
    }

    @Override
    public String toString() {
        return error == null ? "Ok(" + value + ")" : "Fail(" + error + ")";
    }
}
