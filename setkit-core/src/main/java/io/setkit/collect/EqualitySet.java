package io.setkit.collect;

import io.setkit.core.SetkitConfiguration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Set of elements that can only be compared through {@link Equatable#isEqualTo}.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>No two held elements are equal under {@code isEqualTo}.</li>
 *   <li>Elements keep insertion order.</li>
 *   <li>Membership is a linear scan, so insertion is O(n). No hash or order is assumed.</li>
 *   <li>Iterators read the live set. Mutating the set while iterating is unspecified.</li>
 * </ul>
 * Not thread-safe.
 *
 * @param <T> element type
 */
public final class EqualitySet<T extends Equatable<T>> implements BasicSet, Iterable<T> {
    private final ArrayList<T> elems;

    public EqualitySet() {
        this(SetkitConfiguration.defaults());
    }

    public EqualitySet(SetkitConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.elems = new ArrayList<>(configuration.initialCapacity());
    }

    @Override
    public boolean isEmpty() {
        return elems.isEmpty();
    }

    @Override
    public int size() {
        return elems.size();
    }

    @Override
    public void reset() {
        elems.clear();
    }

    /**
     * Adds an element unless an equal one is already present.
     *
     * @param elem element to add
     * @return true if the element was inserted
     * @throws IllegalArgumentException if elem is null
     */
    public boolean add(T elem) {
        if (elem == null) {
            throw new IllegalArgumentException("elem required");
        }
        if (contains(elem)) {
            return false;
        }
        elems.add(elem);
        return true;
    }

    /**
     * Adds every element in turn. Each one is checked against the set as it
     * stands at that point, so duplicates within {@code source} are dropped too.
     * Null entries are skipped.
     *
     * @param source elements to add, may be null
     */
    public void addMany(Iterable<? extends T> source) {
        if (source == null) {
            return;
        }
        for (T elem : source) {
            if (elem != null && !contains(elem)) {
                elems.add(elem);
            }
        }
    }

    /**
     * Adds every element of {@code other}.
     *
     * @param other set to merge in, may be null
     * @return number of elements actually added, 0 when other is null
     */
    public int union(EqualitySet<T> other) {
        if (other == null || other == this) {
            return 0;
        }
        var count = 0;
        for (T elem : other.elems) {
            if (!contains(elem)) {
                elems.add(elem);
                count++;
            }
        }
        return count;
    }

    public boolean contains(T elem) {
        if (elem == null) {
            return false;
        }
        for (var i = 0; i < elems.size(); i++) {
            if (elem.isEqualTo(elems.get(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a snapshot copy of the elements in insertion order.
     * The returned list is safe to modify.
     */
    public List<T> toList() {
        return new ArrayList<>(elems);
    }

    /**
     * Returns a fresh read-only iterator in insertion order.
     */
    @Override
    public Iterator<T> iterator() {
        return Collections.unmodifiableList(elems).iterator();
    }

    public Stream<T> stream() {
        return StreamSupport.stream(
                Spliterators.spliterator(iterator(), elems.size(), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }
}
