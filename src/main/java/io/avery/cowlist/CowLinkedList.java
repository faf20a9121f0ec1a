package io.avery.cowlist;

import io.avery.cowlist.function.ThrowingBiFunction;
import io.avery.cowlist.function.ThrowingFunction;
import io.avery.cowlist.function.ThrowingPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serial;
import java.io.Serializable;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

public class CowLinkedList<E> extends AbstractList<E> implements CowList<E>, Serializable {
    /* A doubly-linked list whose node chain can be shared by any number of lists.
     *
     * Notable features:
     *  1. fork() is O(1): the new list points at the same head/tail and registers itself on the chain's Share. Any
     *     list that is about to modify a chain with more than one registered holder first copies the chain (O(n)),
     *     moves to a fresh Share, and only then modifies its private copy. Reads never copy.
     *  2. Each list carries a generation token, shared with its forks. The token is replaced whenever the list stops
     *     sharing its chain, and dropped on every structural modification. Positions are stamped with the token they
     *     were issued against, so positions from another list, from before a copy, or from before an insertion or
     *     removal are rejected instead of pointing at a node that is no longer where the position says it is.
     *  3. A list releases its Share only after its copy is complete, so the remaining holders cannot start modifying
     *     the chain in place while it is still being copied. The holder count is atomic, allowing divergent forks to
     *     be modified from different threads.
     *  4. Holders are never deregistered when a list is garbage collected. At worst this costs one unnecessary copy
     *     in the last surviving holder.
     */

    private static final Logger LOGGER = LoggerFactory.getLogger(CowLinkedList.class);

    @Serial
    private static final long serialVersionUID = 1L;

    private transient Node<E> head;
    private transient Node<E> tail;
    private transient int size;
    private transient Share share = new Share();

    // Compared by identity against the stamp on Positions, and by ListIterators to detect that the chain was copied
    // under them. Null after a structural modification until the next Position is issued; a copy always installs a
    // fresh token, so that iterators can tell the two apart.
    private transient Object generation = new Object();

    public CowLinkedList() {
    }

    public CowLinkedList(Collection<? extends E> c) {
        if (c instanceof CowLinkedList<? extends E> other) {
            adopt(other);
            return;
        }
        for (E e : c) {
            linkLast(e);
        }
    }

    protected CowLinkedList(CowLinkedList<? extends E> toCopy) {
        adopt(toCopy);
    }

    /**
     * Returns a new list containing the given elements, in order.
     *
     * @param elements the elements
     * @return a new list
     * @param <E> the element type
     */
    @SafeVarargs
    public static <E> CowLinkedList<E> of(E... elements) {
        CowLinkedList<E> list = new CowLinkedList<>();
        for (E e : elements) {
            list.linkLast(e);
        }
        return list;
    }

    /**
     * Returns a list containing the elements of the given iterable, in iteration order. If the iterable is itself a
     * {@code CowLinkedList}, the result is a fork of it.
     *
     * @param elements the elements
     * @return a new list
     * @param <E> the element type
     */
    public static <E> CowLinkedList<E> copyOf(Iterable<? extends E> elements) {
        if (elements instanceof Collection<? extends E> c) {
            return new CowLinkedList<>(c);
        }
        CowLinkedList<E> list = new CowLinkedList<>();
        for (E e : elements) {
            list.linkLast(e);
        }
        return list;
    }

    // ========== Copy-on-write ==========

    @Override
    public CowLinkedList<E> fork() {
        return new CowLinkedList<>(this);
    }

    // Point this list at another list's chain. Elements of type '? extends E' are only ever read from the shared
    // chain - any write first copies it into nodes of our own.
    @SuppressWarnings("unchecked")
    private void adopt(CowLinkedList<? extends E> other) {
        Share otherShare = other.share.acquire();
        share.release();
        share = otherShare;
        head = (Node<E>) other.head;
        tail = (Node<E>) other.tail;
        size = other.size;
        generation = other.currentGeneration();
    }

    private Object currentGeneration() {
        Object g = generation;
        if (g == null) {
            generation = g = new Object();
        }
        return g;
    }

    // Every insertion, removal or reordering goes through here. Positions issued before it are rejected after it.
    private void structurallyModified() {
        modCount++;
        generation = null;
    }

    // Must be called before any write to node values or links.
    // Returns true if the chain was copied, in which case any node references held by the caller are stale.
    private boolean ensureUnique() {
        Share s = share;
        if (!s.isShared()) {
            return false;
        }
        if (head != null) {
            Segment<E> copy = Segment.copyOf(head);
            assert copy.size == size;
            head = copy.head;
            tail = copy.tail;
            LOGGER.trace("Copied shared chain of {} elements", size);
        }
        s.release();
        share = new Share();
        generation = new Object();
        return true;
    }

    private static final class Share {
        final AtomicInteger holders = new AtomicInteger(1);

        boolean isShared() {
            return holders.get() > 1;
        }

        Share acquire() {
            holders.incrementAndGet();
            return this;
        }

        void release() {
            holders.decrementAndGet();
        }
    }

    // ========== Nodes ==========

    private static final class Node<E> {
        E value;
        Node<E> next;
        Node<E> prev;

        Node(Node<E> prev, E value, Node<E> next) {
            this.prev = prev;
            this.value = value;
            this.next = next;
        }
    }

    // A detached run of nodes, linked in both directions.
    private static final class Segment<E> {
        Node<E> head;
        Node<E> tail;
        int size;

        void add(E e) {
            Node<E> n = new Node<>(tail, e, null);
            if (tail == null) {
                head = n;
            }
            else {
                tail.next = n;
            }
            tail = n;
            size++;
        }

        static <E> Segment<E> of(Iterable<? extends E> elements) {
            Segment<E> segment = new Segment<>();
            for (E e : elements) {
                segment.add(e);
            }
            return segment;
        }

        // Iterative, so that copying is not limited by stack depth.
        static <E> Segment<E> copyOf(Node<E> head) {
            Segment<E> segment = new Segment<>();
            for (Node<E> x = head; x != null; x = x.next) {
                segment.add(x.value);
            }
            return segment;
        }
    }

    private Node<E> node(int index) {
        assert index >= 0 && index < size;
        if (index < (size >> 1)) {
            Node<E> x = head;
            for (int i = 0; i < index; i++) {
                x = x.next;
            }
            return x;
        }
        Node<E> x = tail;
        for (int i = size - 1; i > index; i--) {
            x = x.prev;
        }
        return x;
    }

    // The link* and unlink* methods assume ensureUnique() has been called.

    private void linkFirst(E e) {
        Node<E> f = head;
        Node<E> n = new Node<>(null, e, f);
        head = n;
        if (f == null) {
            tail = n;
        }
        else {
            f.prev = n;
        }
        size++;
        structurallyModified();
    }

    private void linkLast(E e) {
        Node<E> l = tail;
        Node<E> n = new Node<>(l, e, null);
        tail = n;
        if (l == null) {
            head = n;
        }
        else {
            l.next = n;
        }
        size++;
        structurallyModified();
    }

    private void linkBefore(E e, Node<E> succ) {
        Node<E> pred = succ.prev;
        Node<E> n = new Node<>(pred, e, succ);
        succ.prev = n;
        if (pred == null) {
            head = n;
        }
        else {
            pred.next = n;
        }
        size++;
        structurallyModified();
    }

    private E unlink(Node<E> x) {
        E value = x.value;
        Node<E> next = x.next;
        Node<E> prev = x.prev;
        if (prev == null) {
            head = next;
        }
        else {
            prev.next = next;
            x.prev = null;
        }
        if (next == null) {
            tail = prev;
        }
        else {
            next.prev = prev;
            x.next = null;
        }
        size--;
        structurallyModified();
        return value;
    }

    // ========== Ends ==========

    @Override
    public void append(E e) {
        checkNewSize(size, 1);
        ensureUnique();
        linkLast(e);
    }

    @Override
    public void prepend(E e) {
        checkNewSize(size, 1);
        ensureUnique();
        linkFirst(e);
    }

    public void addFirst(E e) {
        prepend(e);
    }

    public void addLast(E e) {
        append(e);
    }

    @Override
    public boolean add(E e) {
        append(e);
        return true;
    }

    public E getFirst() {
        if (head == null) {
            throw new NoSuchElementException();
        }
        return head.value;
    }

    public E getLast() {
        if (tail == null) {
            throw new NoSuchElementException();
        }
        return tail.value;
    }

    public E peekFirst() {
        return head == null ? null : head.value;
    }

    public E peekLast() {
        return tail == null ? null : tail.value;
    }

    public E removeFirst() {
        if (head == null) {
            throw new NoSuchElementException("Cannot remove from an empty list");
        }
        ensureUnique();
        return unlink(head);
    }

    public E removeLast() {
        if (tail == null) {
            throw new NoSuchElementException("Cannot remove from an empty list");
        }
        ensureUnique();
        return unlink(tail);
    }

    @Override
    public E popFirst() {
        return head == null ? null : removeFirst();
    }

    @Override
    public E popLast() {
        return tail == null ? null : removeLast();
    }

    // ========== Indexed access ==========

    @Override
    public int size() {
        return size;
    }

    @Override
    public E get(int index) {
        Objects.checkIndex(index, size);
        return node(index).value;
    }

    /**
     * Returns the element at the given index, or {@code null} if the index is out of range.
     *
     * @param index the index of the element
     * @return the element, or {@code null}
     */
    public E getOrNull(int index) {
        if (index < 0 || index >= size) {
            return null;
        }
        return node(index).value;
    }

    @Override
    public E set(int index, E element) {
        Objects.checkIndex(index, size);
        ensureUnique();
        Node<E> x = node(index);
        E old = x.value;
        x.value = element;
        return old;
    }

    @Override
    public void add(int index, E element) {
        rangeCheckForAdd(index);
        checkNewSize(size, 1);
        ensureUnique();
        if (index == size) {
            linkLast(element);
        }
        else {
            linkBefore(element, node(index));
        }
    }

    public void insert(int index, E element) {
        add(index, element);
    }

    @Override
    public E remove(int index) {
        Objects.checkIndex(index, size);
        ensureUnique();
        return unlink(node(index));
    }

    /**
     * Exchanges the elements at the given indexes.
     *
     * @param i the index of one element
     * @param j the index of the other element
     * @throws IndexOutOfBoundsException if either index is out of range
     */
    public void swap(int i, int j) {
        Objects.checkIndex(i, size);
        Objects.checkIndex(j, size);
        swap(positionAt(i), positionAt(j));
    }

    // ========== Range replacement ==========

    @Override
    public void clear() {
        head = tail = null;
        size = 0;
        if (share.isShared()) {
            share.release();
            share = new Share();
        }
        structurallyModified();
    }

    @Override
    public boolean addAll(Collection<? extends E> c) {
        int oldSize = size;
        replace(size, size, c);
        return size != oldSize;
    }

    @Override
    public boolean addAll(int index, Collection<? extends E> c) {
        rangeCheckForAdd(index);
        int oldSize = size;
        replace(index, index, c);
        return size != oldSize;
    }

    @Override
    public void insertAll(int index, Collection<? extends E> c) {
        addAll(index, c);
    }

    public void appendAll(Collection<? extends E> c) {
        replace(size, size, c);
    }

    public void prependAll(Collection<? extends E> c) {
        replace(0, 0, c);
    }

    @Override
    public void removeRange(int fromIndex, int toIndex) {
        replaceRange(fromIndex, toIndex, List.of());
    }

    @Override
    public void replaceRange(int fromIndex, int toIndex, Collection<? extends E> c) {
        rangeCheck(fromIndex, toIndex);
        replace(fromIndex, toIndex, c);
    }

    // Range has been checked.
    private void replace(int fromIndex, int toIndex, Collection<? extends E> c) {
        if (fromIndex == 0 && toIndex == size && c instanceof CowLinkedList<? extends E> other) {
            // Replacing everything with another chain - just share that chain.
            if (other != this) {
                structurallyModified();
                adopt(other); // takes other's generation
            }
            return;
        }

        // Materialize the replacement before touching anything, so that c may be this list or a view of it.
        Segment<E> segment = Segment.of(c);
        int removed = toIndex - fromIndex;
        if (removed == 0 && segment.size == 0) {
            return;
        }
        if (segment.size > 0) {
            checkNewSize(size - removed, segment.size);
        }
        ensureUnique();
        structurallyModified();

        Node<E> before = fromIndex == 0 ? null : node(fromIndex - 1);
        Node<E> after = toIndex == size ? null : node(toIndex);
        Node<E> first = segment.head != null ? segment.head : after;
        Node<E> last = segment.tail != null ? segment.tail : before;

        if (before == null) {
            head = first;
        }
        else {
            before.next = first;
        }
        if (first != null) {
            first.prev = before;
        }
        if (after == null) {
            tail = last;
        }
        else {
            after.prev = last;
        }
        if (last != null) {
            last.next = after;
        }

        size = size - removed + segment.size;
    }

    /**
     * Returns a new list holding the elements in {@code [fromIndex, toIndex)}. Unlike {@link #subList}, the result is
     * independent of this list.
     *
     * @param fromIndex index of the first element to include
     * @param toIndex index after the last element to include
     * @return a new list
     * @throws IndexOutOfBoundsException if {@code fromIndex < 0 || toIndex > size() || fromIndex > toIndex}
     */
    public CowLinkedList<E> slice(int fromIndex, int toIndex) {
        rangeCheck(fromIndex, toIndex);
        CowLinkedList<E> result = new CowLinkedList<>();
        if (fromIndex == toIndex) {
            return result;
        }
        Node<E> x = node(fromIndex);
        for (int i = fromIndex; i < toIndex; i++, x = x.next) {
            result.linkLast(x.value);
        }
        return result;
    }

    // ========== Positions ==========

    /**
     * Returns the position of the first element, which is the past-the-end position if this list is empty.
     *
     * @return the start position
     */
    public Position start() {
        return new Position(currentGeneration(), head, 0);
    }

    /**
     * Returns the past-the-end position, whose rank is {@link #size()}.
     *
     * @return the end position
     */
    public Position end() {
        return new Position(currentGeneration(), null, size);
    }

    /**
     * Returns the position with the given rank.
     *
     * @param rank the rank, between {@code 0} and {@code size()} inclusive
     * @return the position
     * @throws IndexOutOfBoundsException if {@code rank < 0 || rank > size()}
     */
    public Position positionAt(int rank) {
        rangeCheckForAdd(rank);
        return rank == size ? end() : new Position(currentGeneration(), node(rank), rank);
    }

    public Position advance(Position p) {
        Node<E> x = deref(p);
        int rank = p.rank() + 1;
        return new Position(currentGeneration(), x.next, rank);
    }

    public Position retreat(Position p) {
        checkIssued(p);
        int rank = p.rank() - 1;
        if (rank < 0) {
            throw new IndexOutOfBoundsException("Cannot retreat before the start position");
        }
        Node<E> x;
        if (p.isEnd()) {
            Objects.checkIndex(rank, size);
            x = node(rank);
        }
        else {
            x = deref(p).prev;
        }
        return new Position(currentGeneration(), x, rank);
    }

    public E get(Position p) {
        return deref(p).value;
    }

    public E set(Position p, E element) {
        Node<E> x = deref(p);
        if (ensureUnique()) {
            x = node(p.rank());
        }
        E old = x.value;
        x.value = element;
        return old;
    }

    public void insert(Position p, E element) {
        checkIssued(p);
        add(p.rank(), element);
    }

    public void insertAll(Position p, Collection<? extends E> c) {
        checkIssued(p);
        addAll(p.rank(), c);
    }

    public E remove(Position p) {
        Node<E> x = deref(p);
        if (ensureUnique()) {
            x = node(p.rank());
        }
        return unlink(x);
    }

    public void replaceRange(Position from, Position to, Collection<? extends E> c) {
        checkIssued(from);
        checkIssued(to);
        replaceRange(from.rank(), to.rank(), c);
    }

    public void removeRange(Position from, Position to) {
        replaceRange(from, to, List.of());
    }

    public void swap(Position i, Position j) {
        Node<E> x = deref(i);
        Node<E> y = deref(j);
        if (x == y) {
            return;
        }
        if (ensureUnique()) {
            x = node(i.rank());
            y = node(j.rank());
        }
        E tmp = x.value;
        x.value = y.value;
        y.value = tmp;
    }

    private void checkIssued(Position p) {
        Objects.requireNonNull(p);
        if (!p.isIssuedBy(generation)) {
            throw new IllegalArgumentException(
                "Position is from another list, or from before this list was copied or structurally modified");
        }
    }

    // Resolve a position to its node, without dereferencing anything until the position is known to belong here.
    private Node<E> deref(Position p) {
        checkIssued(p);
        if (p.isEnd() || p.rank() >= size) {
            throw new IndexOutOfBoundsException("Position " + p.rank() + " is past the end, Size: " + size);
        }
        @SuppressWarnings("unchecked")
        Node<E> x = (Node<E>) p.node();
        if (x == null) {
            throw new IllegalArgumentException("Position no longer refers to an element of this list");
        }
        return x;
    }

    // ========== Traversal ==========

    @Override
    public Iterator<E> iterator() {
        return new ListItr(0);
    }

    @Override
    public ListIterator<E> listIterator() {
        return new ListItr(0);
    }

    @Override
    public ListIterator<E> listIterator(int index) {
        rangeCheckForAdd(index);
        return new ListItr(index);
    }

    /**
     * Returns an iterator over the elements of this list from last to first.
     *
     * @return a descending iterator
     */
    public Iterator<E> descendingIterator() {
        return new Iterator<>() {
            final ListItr itr = new ListItr(size);

            @Override
            public boolean hasNext() {
                return itr.hasPrevious();
            }

            @Override
            public E next() {
                return itr.previous();
            }

            @Override
            public void remove() {
                itr.remove();
            }
        };
    }

    @Override
    public void forEach(Consumer<? super E> action) {
        Objects.requireNonNull(action);
        int expectedModCount = modCount;
        for (Node<E> x = head; x != null && modCount == expectedModCount; x = x.next) {
            action.accept(x.value);
        }
        if (modCount != expectedModCount) {
            throw new ConcurrentModificationException();
        }
    }

    private class ListItr implements ListIterator<E> {
        Node<E> lastReturned;
        Node<E> next;
        int nextIndex;
        int lastRet = -1;
        int expectedModCount = modCount;
        Object expectedGeneration = generation;

        ListItr(int index) {
            next = index == size ? null : node(index);
            nextIndex = index;
        }

        @Override
        public boolean hasNext() {
            return nextIndex < size;
        }

        @Override
        public E next() {
            checkForComodification();
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            lastReturned = next;
            next = next.next;
            lastRet = nextIndex++;
            return lastReturned.value;
        }

        @Override
        public boolean hasPrevious() {
            return nextIndex > 0;
        }

        @Override
        public E previous() {
            checkForComodification();
            if (!hasPrevious()) {
                throw new NoSuchElementException();
            }
            lastReturned = next = (next == null) ? tail : next.prev;
            lastRet = --nextIndex;
            return lastReturned.value;
        }

        @Override
        public int nextIndex() {
            return nextIndex;
        }

        @Override
        public int previousIndex() {
            return nextIndex - 1;
        }

        @Override
        public void remove() {
            checkForComodification();
            if (lastReturned == null) {
                throw new IllegalStateException();
            }
            if (ensureUnique()) {
                reanchor();
            }
            Node<E> lastNext = lastReturned.next;
            unlink(lastReturned);
            if (next == lastReturned) {
                next = lastNext;
            }
            else {
                nextIndex--;
            }
            lastReturned = null;
            lastRet = -1;
            expectedModCount = modCount;
            expectedGeneration = generation;
        }

        @Override
        public void set(E e) {
            if (lastReturned == null) {
                throw new IllegalStateException();
            }
            checkForComodification();
            if (ensureUnique()) {
                reanchor();
            }
            lastReturned.value = e;
        }

        @Override
        public void add(E e) {
            checkForComodification();
            checkNewSize(size, 1);
            if (ensureUnique()) {
                reanchor();
            }
            lastReturned = null;
            lastRet = -1;
            if (next == null) {
                linkLast(e);
            }
            else {
                linkBefore(e, next);
            }
            nextIndex++;
            expectedModCount = modCount;
            expectedGeneration = generation;
        }

        // The list copied its chain since we last looked. Find our place again in the new one.
        void reanchor() {
            next = nextIndex == size ? null : node(nextIndex);
            if (lastReturned != null) {
                lastReturned = node(lastRet);
            }
            expectedGeneration = generation;
        }

        void checkForComodification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (generation != expectedGeneration) {
                reanchor();
            }
        }
    }

    // ========== Derived operations ==========

    /**
     * Returns a new list holding the result of applying {@code transform} to each element, in order. Anything thrown
     * by {@code transform} propagates unchanged, and no list is returned.
     *
     * @param transform the function to apply to each element
     * @return a new list of transformed elements
     * @param <R> the element type of the new list
     * @param <X> the exception type {@code transform} may throw
     * @throws X if {@code transform} throws
     */
    public <R, X extends Throwable> CowLinkedList<R> map(ThrowingFunction<? super E, ? extends R, X> transform) throws X {
        Objects.requireNonNull(transform);
        CowLinkedList<R> result = new CowLinkedList<>();
        for (Node<E> x = head; x != null; x = x.next) {
            result.linkLast(transform.apply(x.value));
        }
        return result;
    }

    /**
     * Like {@link #map}, but drops the elements for which {@code transform} returns an empty {@code Optional}.
     *
     * @param transform the function to apply to each element
     * @return a new list of the present results
     * @param <R> the element type of the new list
     * @param <X> the exception type {@code transform} may throw
     * @throws X if {@code transform} throws
     */
    public <R, X extends Throwable> CowLinkedList<R> compactMap(ThrowingFunction<? super E, Optional<? extends R>, X> transform) throws X {
        Objects.requireNonNull(transform);
        CowLinkedList<R> result = new CowLinkedList<>();
        for (Node<E> x = head; x != null; x = x.next) {
            Optional<? extends R> r = transform.apply(x.value);
            if (r.isPresent()) {
                result.linkLast(r.get());
            }
        }
        return result;
    }

    public <X extends Throwable> CowLinkedList<E> filter(ThrowingPredicate<? super E, X> predicate) throws X {
        Objects.requireNonNull(predicate);
        CowLinkedList<E> result = new CowLinkedList<>();
        for (Node<E> x = head; x != null; x = x.next) {
            if (predicate.test(x.value)) {
                result.linkLast(x.value);
            }
        }
        return result;
    }

    public <R, X extends Throwable> R reduce(R identity, ThrowingBiFunction<? super R, ? super E, ? extends R, X> accumulator) throws X {
        Objects.requireNonNull(accumulator);
        R result = identity;
        for (Node<E> x = head; x != null; x = x.next) {
            result = accumulator.apply(result, x.value);
        }
        return result;
    }

    @Override
    public void reverse() {
        if (size < 2) {
            return;
        }
        ensureUnique();
        structurallyModified();
        for (Node<E> x = head; x != null; ) {
            Node<E> next = x.next;
            x.next = x.prev;
            x.prev = next;
            x = next;
        }
        Node<E> h = head;
        head = tail;
        tail = h;
    }

    @Override
    public CowLinkedList<E> reversed() {
        CowLinkedList<E> result = new CowLinkedList<>();
        for (Node<E> x = tail; x != null; x = x.prev) {
            result.linkLast(x.value);
        }
        return result;
    }

    // ========== Identity-keyed operations ==========

    /**
     * Returns a view of this list that finds, removes and updates elements by an identity extracted from each
     * element. For elements that are {@link Identified}, use {@code byId(Identified::id)}.
     *
     * @param idOf extracts the identity of an element
     * @return a view of this list keyed by {@code idOf}
     * @param <K> the identity type
     */
    public <K> ById<K> byId(Function<? super E, ? extends K> idOf) {
        return new ById<>(Objects.requireNonNull(idOf));
    }

    /**
     * Identity-keyed operations on the enclosing list. Every operation is a single pass over the list. Operations that
     * modify the list copy shared structure only when there is something to modify.
     *
     * @param <K> the identity type
     */
    public final class ById<K> {
        private final Function<? super E, ? extends K> idOf;

        private ById(Function<? super E, ? extends K> idOf) {
            this.idOf = idOf;
        }

        private boolean matches(Node<E> x, Object id) {
            return Objects.equals(idOf.apply(x.value), id);
        }

        public E first(K id) {
            for (Node<E> x = head; x != null; x = x.next) {
                if (matches(x, id)) {
                    return x.value;
                }
            }
            return null;
        }

        public List<E> all(K id) {
            List<E> result = new ArrayList<>();
            for (Node<E> x = head; x != null; x = x.next) {
                if (matches(x, id)) {
                    result.add(x.value);
                }
            }
            return result;
        }

        public boolean contains(K id) {
            for (Node<E> x = head; x != null; x = x.next) {
                if (matches(x, id)) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Removes the first element with the given identity.
         *
         * @param id the identity to look for
         * @return the removed element, or {@code null} if there was none
         */
        public E removeFirst(K id) {
            int rank = 0;
            Node<E> x = head;
            while (x != null && !matches(x, id)) {
                x = x.next;
                rank++;
            }
            if (x == null) {
                return null;
            }
            if (ensureUnique()) {
                x = node(rank);
            }
            return unlink(x);
        }

        /**
         * Removes every element with the given identity.
         *
         * @param id the identity to look for
         * @return the removed elements, in order
         */
        public List<E> removeAll(K id) {
            int rank = 0;
            Node<E> x = head;
            while (x != null && !matches(x, id)) {
                x = x.next;
                rank++;
            }
            List<E> removed = new ArrayList<>();
            if (x == null) {
                return removed;
            }
            if (ensureUnique()) {
                x = node(rank);
            }
            while (x != null) {
                Node<E> next = x.next;
                if (matches(x, id)) {
                    removed.add(unlink(x));
                }
                x = next;
            }
            return removed;
        }

        /**
         * Replaces the first element with the given identity by the result of applying {@code transform} to it. If
         * {@code transform} throws, the exception propagates unchanged and the list is not modified.
         *
         * @param id the identity to look for
         * @param transform computes the replacement element
         * @return {@code true} if an element was replaced
         * @param <X> the exception type {@code transform} may throw
         * @throws X if {@code transform} throws
         */
        public <X extends Throwable> boolean updateFirst(K id, ThrowingFunction<? super E, ? extends E, X> transform) throws X {
            Objects.requireNonNull(transform);
            int rank = 0;
            Node<E> x = head;
            while (x != null && !matches(x, id)) {
                x = x.next;
                rank++;
            }
            if (x == null) {
                return false;
            }
            E updated = transform.apply(x.value);
            if (ensureUnique()) {
                x = node(rank);
            }
            x.value = updated;
            return true;
        }

        public CowLinkedList<E> filtered(Set<? extends K> ids) {
            Objects.requireNonNull(ids);
            CowLinkedList<E> result = new CowLinkedList<>();
            for (Node<E> x = head; x != null; x = x.next) {
                if (ids.contains(idOf.apply(x.value))) {
                    result.linkLast(x.value);
                }
            }
            return result;
        }

        /**
         * Maps each identity to its element. If several elements share an identity, the last one wins.
         *
         * @return a map in order of first appearance of each identity
         */
        public Map<K, E> indexed() {
            Map<K, E> result = new LinkedHashMap<>();
            for (Node<E> x = head; x != null; x = x.next) {
                result.put(idOf.apply(x.value), x.value);
            }
            return result;
        }

        /**
         * Maps each identity to all of its elements, in list order.
         *
         * @return a map in order of first appearance of each identity
         */
        public Map<K, List<E>> grouped() {
            Map<K, List<E>> result = new LinkedHashMap<>();
            for (Node<E> x = head; x != null; x = x.next) {
                result.computeIfAbsent(idOf.apply(x.value), k -> new ArrayList<>()).add(x.value);
            }
            return result;
        }
    }

    // ========== Object ==========

    @Override
    public boolean equals(Object o) {
        // Short-circuits on size mismatch, and on two lists sharing an unmodified chain.
        if (o == this) {
            return true;
        }
        if (!(o instanceof List<?> list)) {
            return false;
        }
        if (o instanceof CowLinkedList<?> other) {
            if (other.size != size) {
                return false;
            }
            if (other.head == head) {
                return true;
            }
        }
        Iterator<E> e1 = iterator();
        Iterator<?> e2 = list.iterator();
        while (e1.hasNext() && e2.hasNext()) {
            if (!Objects.equals(e1.next(), e2.next())) {
                return false;
            }
        }
        return !(e1.hasNext() || e2.hasNext());
    }

    @Override
    public int hashCode() {
        var box = new Object(){ int hashCode = 1; };
        forEach(e -> box.hashCode = 31*box.hashCode + (e==null ? 0 : e.hashCode()));
        return box.hashCode;
    }

    /**
     * Returns a multi-line rendering that includes the size, one element per line.
     *
     * @return a debugging representation of this list
     */
    public String toDebugString() {
        if (size == 0) {
            return "CowLinkedList(empty)";
        }
        StringBuilder sb = new StringBuilder("CowLinkedList(count: ").append(size).append(") {");
        for (Node<E> x = head; x != null; x = x.next) {
            sb.append("\n  ").append(x.value == this ? "(this list)" : String.valueOf(x.value));
        }
        return sb.append("\n}").toString();
    }

    // ========== Serialization ==========

    @Serial
    private void writeObject(ObjectOutputStream s) throws IOException {
        s.defaultWriteObject();
        s.writeInt(size);
        for (Node<E> x = head; x != null; x = x.next) {
            s.writeObject(x.value);
        }
    }

    @Serial
    @SuppressWarnings("unchecked")
    private void readObject(ObjectInputStream s) throws IOException, ClassNotFoundException {
        s.defaultReadObject();
        share = new Share();
        generation = new Object();
        int n = s.readInt();
        if (n < 0) {
            throw new java.io.InvalidObjectException("Negative size: " + n);
        }
        for (int i = 0; i < n; i++) {
            linkLast((E) s.readObject());
        }
    }

    // ========== Utils ==========

    // Method used to prevent integer overflow when increasing size.
    private static void checkNewSize(int oldSize, int toAdd) {
        if (oldSize + toAdd <= 0) {
            throw new OutOfMemoryError("Required size " + oldSize + " + " + toAdd + " is too large");
        }
    }

    // An inverted range is out of range too; nothing is clamped.
    private void rangeCheck(int fromIndex, int toIndex) {
        if (fromIndex < 0)
            throw new IndexOutOfBoundsException("fromIndex = " + fromIndex);
        if (toIndex > size)
            throw new IndexOutOfBoundsException("toIndex = " + toIndex + ", Size: " + size);
        if (fromIndex > toIndex)
            throw new IndexOutOfBoundsException("From Index: " + fromIndex + " > To Index: " + toIndex);
    }

    private void rangeCheckForAdd(int index) {
        if (index > size || index < 0) {
            throw new IndexOutOfBoundsException(outOfBoundsMsg(index));
        }
    }

    private String outOfBoundsMsg(int index) {
        return "Index: "+index+", Size: "+size;
    }
}
