package com.example.music2db;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or a classified failure. Used instead of exceptions on the
 * per-file and per-request paths of a scan so the caller decides what to skip.
 */
public final class Outcome<T> {
    private final T value;
    private final Failure failure;

    private Outcome(T value, Failure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(FailureKind kind, String detail) {
        return new Outcome<>(null, new Failure(Objects.requireNonNull(kind), detail));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("No value on failed outcome: " + failure);
        }
        return value;
    }

    public Failure getFailure() {
        return failure;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (failure != null) {
            return new Outcome<>(null, failure);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return failure == null ? "success(" + value + ")" : "failure(" + failure + ")";
    }

    public record Failure(FailureKind kind, String detail) {
        @Override
        public String toString() {
            return detail == null ? kind.name() : kind + ": " + detail;
        }
    }
}
