package io.github.cyfko.fuzzycast.core.utils;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of coercing a search term into a field's declared type: either the typed value or the
 * reason the term was rejected.
 * <p>
 * Instances are immutable and created via {@link #success(Object)} and {@link #failure(String)}.
 * A rejection is an ordinary outcome, not an error: callers are expected to drop it.
 * </p>
 * <p>
 * Most rejections are never reported, so {@link #failure(Supplier)} defers building the reason
 * until {@link #getErrorMessage()} is called.
 * </p>
 *
 * <pre>{@code
 * CastResult<Object> result = TypeConversionUtils.tryConvert(Integer.class, "gmail", EnumMatchMode.CASE_INSENSITIVE);
 * if (!result.isSuccess()) {
 *     log.finest("Rejected: " + result.getErrorMessage());
 * }
 * }</pre>
 *
 * @param <T> type of the successful value
 * @since 1.0.0
 */
public final class CastResult<T> {

    private final T value;
    private final Supplier<String> errorMessage;

    private CastResult(T value, Supplier<String> errorMessage) {
        this.value = value;
        this.errorMessage = errorMessage;
    }

    public static <T> CastResult<T> success(T value) {
        return new CastResult<>(Objects.requireNonNull(value, "value cannot be null"), null);
    }

    public static <T> CastResult<T> failure(String errorMessage) {
        Objects.requireNonNull(errorMessage, "errorMessage cannot be null");
        return new CastResult<>(null, () -> errorMessage);
    }

    /**
     * Creates a failure whose reason is only built when asked for.
     *
     * @param errorMessage supplier of the rejection reason
     */
    public static <T> CastResult<T> failure(Supplier<String> errorMessage) {
        return new CastResult<>(null, Objects.requireNonNull(errorMessage, "errorMessage cannot be null"));
    }

    public boolean isSuccess() {
        return errorMessage == null;
    }

    /**
     * Returns the cast value.
     *
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on failed cast: " + errorMessage.get());
        }
        return value;
    }

    /**
     * Returns the rejection reason, or {@code null} on success.
     */
    public String getErrorMessage() {
        return isSuccess() ? null : errorMessage.get();
    }

    /**
     * Transforms the value of a successful result; failures are propagated unchanged.
     */
    public <R> CastResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return new CastResult<>(null, errorMessage);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess() ? "CastResult[success, value=" + value + "]"
                : "CastResult[failure, error=" + errorMessage.get() + "]";
    }
}
