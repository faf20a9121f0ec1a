package io.avery.cowlist.function;

import java.util.function.Function;

/**
 * A {@link Function} look-alike that may throw a checked exception.
 *
 * <p>When a lambda throws nothing checked, {@code X} is inferred as {@code RuntimeException}, so callers that pass
 * plain lambdas do not need to declare or catch anything.
 *
 * @param <T> the argument type
 * @param <R> the result type
 * @param <X> the exception type
 */
@FunctionalInterface
public interface ThrowingFunction<T, R, X extends Throwable> {
    R apply(T t) throws X;

    /**
     * @param f the function to adapt
     * @return a {@code ThrowingFunction} that calls {@code f} and throws no checked exception
     */
    static <T, R> ThrowingFunction<T, R, RuntimeException> of(Function<T, R> f) {
        return f::apply;
    }
}
