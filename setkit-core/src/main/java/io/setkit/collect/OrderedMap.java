package io.setkit.collect;

import io.setkit.core.SetkitConfiguration;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiConsumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Key-value map whose iteration follows ascending key order.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Values live in a hash map; keys are also held in a sorted, duplicate-free list.</li>
 *   <li>Both structures hold exactly the same keys after every public call.</li>
 *   <li>{@link #get} uses the hash map only; {@link #contains} uses binary search over the key list only.</li>
 *   <li>Insert and remove are O(n) (list shift), lookups O(1)/O(log n), iteration needs no sorting.</li>
 *   <li>Iterators read the live map. Mutating the map while iterating is unspecified.</li>
 * </ul>
 * Keys must have a {@code compareTo} consistent with {@code equals}; the stored
 * key, not the argument, is used on both sides when an existing key is updated
 * or removed. Null keys and null values are rejected on insertion. Not thread-safe.
 *
 * @param <K> key type, totally ordered
 * @param <V> value type
 */
public final class OrderedMap<K extends Comparable<? super K>, V> implements BasicSet {
    private final HashMap<K, V> values;
    private final ArrayList<K> keys;

    public OrderedMap() {
        this(SetkitConfiguration.defaults());
    }

    public OrderedMap(SetkitConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.values = new HashMap<>(configuration.initialCapacity());
        this.keys = new ArrayList<>(configuration.initialCapacity());
    }

    @Override
    public boolean isEmpty() {
        return keys.isEmpty();
    }

    @Override
    public int size() {
        return keys.size();
    }

    @Override
    public void reset() {
        if (keys.isEmpty()) {
            return;
        }
        keys.clear();
        values.clear();
    }

    public Optional<V> get(K key) {
        if (key == null || keys.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(key));
    }

    public boolean contains(K key) {
        if (key == null || keys.isEmpty()) {
            return false;
        }
        return Collections.binarySearch(keys, key) >= 0;
    }

    /**
     * Adds a mapping unless the key is already present (first writer wins).
     *
     * @throws IllegalArgumentException if key or value is null
     */
    public void add(K key, V value) {
        requireEntry(key, value);
        var pos = Collections.binarySearch(keys, key);
        if (pos >= 0) {
            return;
        }
        keys.add(-pos - 1, key);
        values.put(key, value);
    }

    /**
     * Like {@link #add} but overwrites the value of an existing key.
     * The key itself is inserted at most once.
     *
     * @throws IllegalArgumentException if key or value is null
     */
    public void forceAdd(K key, V value) {
        requireEntry(key, value);
        var pos = Collections.binarySearch(keys, key);
        if (pos < 0) {
            keys.add(-pos - 1, key);
            values.put(key, value);
        } else {
            values.put(keys.get(pos), value);
        }
    }

    public void remove(K key) {
        if (key == null) {
            return;
        }
        var pos = Collections.binarySearch(keys, key);
        if (pos < 0) {
            return;
        }
        values.remove(keys.remove(pos));
    }

    /**
     * Returns a snapshot copy of all mappings, iterating in key order.
     * The returned map is safe to modify.
     */
    public Map<K, V> map() {
        var copy = new LinkedHashMap<K, V>(Math.max(16, keys.size() * 2));
        for (var key : keys) {
            copy.put(key, values.get(key));
        }
        return copy;
    }

    /**
     * Returns a snapshot copy of the keys in ascending order.
     * The returned list is safe to modify.
     */
    public List<K> keys() {
        return new ArrayList<>(keys);
    }

    /**
     * Returns a snapshot copy of the values, ordered by their keys.
     */
    public List<V> values() {
        var result = new ArrayList<V>(keys.size());
        for (var key : keys) {
            result.add(values.get(key));
        }
        return result;
    }

    public Optional<K> firstKey() {
        return keys.isEmpty() ? Optional.empty() : Optional.of(keys.get(0));
    }

    public Optional<K> lastKey() {
        return keys.isEmpty() ? Optional.empty() : Optional.of(keys.get(keys.size() - 1));
    }

    /**
     * Returns the entries in ascending key order. Each call to
     * {@code iterator()} starts a new lazy traversal; callers may stop early.
     * Entries are immutable.
     */
    public Iterable<Map.Entry<K, V>> entries() {
        return EntryIterator::new;
    }

    public Stream<Map.Entry<K, V>> stream() {
        return StreamSupport.stream(
                Spliterators.spliterator(new EntryIterator(), keys.size(),
                        Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL),
                false);
    }

    public void forEach(BiConsumer<? super K, ? super V> action) {
        if (action == null) {
            throw new IllegalArgumentException("action required");
        }
        for (var key : keys) {
            action.accept(key, values.get(key));
        }
    }

    private static void requireEntry(Object key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
    }

    private final class EntryIterator implements Iterator<Map.Entry<K, V>> {
        private final Iterator<K> keyIterator = keys.iterator();

        @Override
        public boolean hasNext() {
            return keyIterator.hasNext();
        }

        @Override
        public Map.Entry<K, V> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var key = keyIterator.next();
            return new AbstractMap.SimpleImmutableEntry<>(key, values.get(key));
        }
    }
}
