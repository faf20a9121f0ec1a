package io.avery.cowlist.function;

import java.util.function.BiFunction;

/**
 * A {@link BiFunction} look-alike that may throw a checked exception. Used as the accumulator of
 * {@code CowLinkedList.reduce}.
 *
 * @param <T> the first argument type
 * @param <U> the second argument type
 * @param <R> the result type
 * @param <X> the exception type
 */
@FunctionalInterface
public interface ThrowingBiFunction<T, U, R, X extends Throwable> {
    R apply(T t, U u) throws X;

    static <T, U, R> ThrowingBiFunction<T, U, R, RuntimeException> of(BiFunction<T, U, R> f) {
        return f::apply;
    }
}
