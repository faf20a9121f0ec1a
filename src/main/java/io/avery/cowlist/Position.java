package io.avery.cowlist;

import java.lang.ref.WeakReference;

/**
 * An opaque position in a {@link CowLinkedList}, either of an element or of the past-the-end slot.
 *
 * <p>A position is stamped with the generation of the list that issued it. It may be presented to that list, or to
 * any fork of it that still shares its structure. Once the list copies its structure (which happens the first time it
 * is modified while shared), or inserts, removes or reorders elements, every position issued before is rejected with
 * an {@link IllegalArgumentException}. Replacing element values in place does not affect positions.
 *
 * <p>A position refers to its list and element only weakly, so holding a position does not keep either alive.
 *
 * <p>Positions order by rank. Two positions are equal if they have the same rank and were issued against the same
 * generation.
 */
public final class Position implements Comparable<Position> {
    private final WeakReference<Object> generation;
    private final WeakReference<Object> node; // null => past-the-end
    private final int rank;

    Position(Object generation, Object node, int rank) {
        this.generation = new WeakReference<>(generation);
        this.node = node == null ? null : new WeakReference<>(node);
        this.rank = rank;
    }

    /**
     * Returns the zero-based rank of this position, which is the list's size for the past-the-end position.
     *
     * @return the rank of this position
     */
    public int rank() {
        return rank;
    }

    boolean isIssuedBy(Object currentGeneration) {
        return currentGeneration != null && generation.get() == currentGeneration;
    }

    boolean isEnd() {
        return node == null;
    }

    Object node() {
        return node == null ? null : node.get();
    }

    @Override
    public int compareTo(Position o) {
        return Integer.compare(rank, o.rank);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof Position other)) {
            return false;
        }
        Object g = generation.get();
        return rank == other.rank && g != null && g == other.generation.get();
    }

    @Override
    public int hashCode() {
        return rank;
    }

    @Override
    public String toString() {
        return "Position(" + rank + (node == null ? ", end)" : ")");
    }
}
