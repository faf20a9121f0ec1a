package io.avery.cowlist;

/**
 * An element that exposes a stable identity, for use with {@link CowLinkedList#byId}:
 * {@code list.byId(Identified::id)}.
 *
 * <p>The identity must implement {@code equals} and {@code hashCode} consistently, and must not change while the
 * element is in a list.
 *
 * @param <K> the identity type
 */
@FunctionalInterface
public interface Identified<K> {
    K id();
}
