package com.phillippitts.draftsmith.domain;

import java.util.Objects;

/**
 * Success-or-fault value returned by hub, orchestrator and collaborator operations.
 *
 * <p>Exactly one of {@link #getValue()} and {@link #getError()} is meaningful, as reported by
 * {@link #isOk()}. Accessing the wrong side throws {@link IllegalStateException}.
 *
 * @param <T> success value type
 * @param <E> fault type
 */
public final class Result<T, E> {

    private final boolean ok;
    private final T value;
    private final E error;

    private Result(boolean ok, T value, E error) {
        this.ok = ok;
        this.value = value;
        this.error = error;
    }

    public static <T, E> Result<T, E> ok(T value) {
        return new Result<>(true, value, null);
    }

    public static <T, E> Result<T, E> err(E error) {
        return new Result<>(false, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return ok;
    }

    public boolean isErr() {
        return !ok;
    }

    public T getValue() {
        if (!ok) {
            throw new IllegalStateException("Result is a fault: " + error);
        }
        return value;
    }

    public E getError() {
        if (ok) {
            throw new IllegalStateException("Result is a success value");
        }
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Result<?, ?> other)) {
            return false;
        }
        return ok == other.ok && Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ok, value, error);
    }

    @Override
    public String toString() {
        return ok ? "Ok[" + value + "]" : "Err[" + error + "]";
    }
}
