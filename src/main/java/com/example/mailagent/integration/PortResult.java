package com.example.mailagent.integration;

import com.example.mailagent.domain.model.ErrorKind;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a call into an external port: either a value or a typed failure.
 * Ports return this instead of throwing so the caller can always tell "done" from "not done".
 */
public final class PortResult<T> {

    private final T value;
    private final PortFailure failure;

    private PortResult(T value, PortFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> PortResult<T> success(T value) {
        return new PortResult<>(value, null);
    }

    public static <T> PortResult<T> failure(PortFailure failure) {
        return new PortResult<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public static <T> PortResult<T> failure(ErrorKind kind, String message) {
        return failure(new PortFailure(kind, message));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("No value, call failed with " + failure);
        }
        return value;
    }

    public PortFailure getFailure() {
        if (failure == null) {
            throw new IllegalStateException("Call succeeded, there is no failure");
        }
        return failure;
    }

    public <R> PortResult<R> map(Function<? super T, ? extends R> mapper) {
        if (failure != null) {
            return failure(failure);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return failure == null ? "Success[" + value + "]" : "Failure[" + failure + "]";
    }
}
