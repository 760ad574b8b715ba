package org.kidoni.cas.error;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of an engine operation: either a value or the {@link CasError} that prevented it.
 */
public sealed interface Result<T> {
    record Ok<T>(T value) implements Result<T> {
    }

    record Err<T>(CasError error) implements Result<T> {
    }

    static <T> Result<T> ok(final T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(final CasError error) {
        return new Err<>(error);
    }

    /**
     * Runs {@code computation}, turning an {@link ExpressionException} into an {@link Err}.
     */
    static <T> Result<T> of(final Supplier<T> computation) {
        try {
            return ok(computation.get());
        }
        catch (ExpressionException e) {
            return err(e.getError());
        }
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default Optional<CasError> failure() {
        if (this instanceof Err<T> err) {
            return Optional.of(err.error());
        }
        return Optional.empty();
    }

    default T orElseThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw new ExpressionException(((Err<T>) this).error());
    }

    default <U> Result<U> map(final Function<? super T, ? extends U> mapper) {
        if (this instanceof Ok<T> ok) {
            return Result.of(() -> mapper.apply(ok.value()));
        }
        return err(((Err<T>) this).error());
    }

    default <U> Result<U> flatMap(final Function<? super T, Result<U>> mapper) {
        if (this instanceof Ok<T> ok) {
            return mapper.apply(ok.value());
        }
        return err(((Err<T>) this).error());
    }
}
