package com.ledgerly.core.global.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an operation that either produced a value or failed with a {@link BusinessError}.
 */
public final class Result<T> {

    private final T value;
    private final BusinessError error;

    private Result(T value, BusinessError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> failure(BusinessError error) {
        return new Result<>(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("Result is a failure: " + error.code());
        }
        return value;
    }

    public BusinessError error() {
        if (error == null) {
            throw new IllegalStateException("Result is a success");
        }
        return error;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return error == null ? "Result[success=" + value + "]" : "Result[failure=" + error.code() + "]";
    }
}
