package com.ai.clinicdesk.llm;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an LLM call: a value or a failure, never both.
 */
public final class LlmResult<T> {

    private final T value;
    private final LlmFailure failure;
    private final String detail;

    private LlmResult(T value, LlmFailure failure, String detail) {
        this.value = value;
        this.failure = failure;
        this.detail = detail;
    }

    public static <T> LlmResult<T> success(T value) {
        return new LlmResult<>(Objects.requireNonNull(value), null, null);
    }

    public static <T> LlmResult<T> failure(LlmFailure failure, String detail) {
        return new LlmResult<>(null, Objects.requireNonNull(failure), detail);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public T getValue() {
        if (!isSuccess()) throw new IllegalStateException("LLM call failed: " + failure);
        return value;
    }

    public LlmFailure getFailure() {
        return failure;
    }

    public String getDetail() {
        return detail;
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }

    public <R> LlmResult<R> map(Function<T, R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(failure, detail);
    }

    @Override
    public String toString() {
        return isSuccess() ? "LlmResult[ok]" : "LlmResult[" + failure + (detail != null ? ": " + detail : "") + "]";
    }
}
