package io.avery.cowlist;

import java.util.Collection;
import java.util.List;

/**
 * A {@code List} that supports a constant-time copy ({@code fork}) whose result shares structure with the original
 * until either side is modified.
 *
 * <p>Modifying a list that shares its structure with a fork first copies the shared structure, so that neither list
 * ever observes modifications made through the other. Reading never copies.
 *
 * @param <E> the type of elements in this list
 */
public interface CowList<E> extends List<E> {
    /**
     * Returns a copy of this list. The elements themselves are not copied.
     *
     * @implSpec Implementations share structure between the copy and this list, and defer copying it until one of
     * them is modified. This must not impact the results of subsequent operations on either list, but may impact the
     * performance of the first subsequent modification of each.
     *
     * @return a copy of this list
     */
    CowList<E> fork();

    /**
     * Inserts the element at the front of this list.
     *
     * @param e the element to add
     */
    void prepend(E e);

    /**
     * Appends the element at the end of this list.
     *
     * @param e the element to add
     */
    void append(E e);

    /**
     * Like {@link #addAll(int, Collection)}, but named for symmetry with {@link #replaceRange}.
     *
     * @param index index at which to insert the first element from the specified collection
     * @param c collection containing elements to be inserted
     * @throws IndexOutOfBoundsException if {@code index < 0 || index > size()}
     */
    void insertAll(int index, Collection<? extends E> c);

    /**
     * Replaces the elements in {@code [fromIndex, toIndex)} with the elements of {@code c}, in iteration order. The
     * range may be empty (a pure insertion) and {@code c} may be empty (a pure removal).
     *
     * @param fromIndex index of the first element to replace
     * @param toIndex index after the last element to replace
     * @param c the replacement elements
     * @throws IndexOutOfBoundsException if {@code fromIndex < 0 || toIndex > size() || fromIndex > toIndex}
     */
    void replaceRange(int fromIndex, int toIndex, Collection<? extends E> c);

    /**
     * Removes and returns the first element, or returns {@code null} if this list is empty.
     *
     * @return the first element, or {@code null}
     */
    E popFirst();

    /**
     * Removes and returns the last element, or returns {@code null} if this list is empty.
     *
     * @return the last element, or {@code null}
     */
    E popLast();

    /**
     * Reverses this list in place.
     */
    void reverse();

    /**
     * Returns a new list holding the elements of this list in reverse order. This list is not modified.
     *
     * @return a reversed copy of this list
     */
    CowList<E> reversed();
}
