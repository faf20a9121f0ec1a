package io.avery.cowlist.function;

import java.util.function.Predicate;

/**
 * A {@link Predicate} look-alike that may throw a checked exception.
 *
 * @param <T> the type tested
 * @param <X> the exception type
 */
@FunctionalInterface
public interface ThrowingPredicate<T, X extends Throwable> {
    boolean test(T t) throws X;

    static <T> ThrowingPredicate<T, RuntimeException> of(Predicate<T> p) {
        return p::test;
    }
}
