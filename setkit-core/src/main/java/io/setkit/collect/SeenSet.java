package io.setkit.collect;

import io.setkit.collect.internal.Dedup;
import io.setkit.core.SetkitConfiguration;
import io.setkit.core.SetkitConfiguration.DedupStrategy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Hash-backed record of which values have been observed.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Membership only grows until {@link #reset()}; there is no way to unsee a value.</li>
 *   <li>Values are compared with {@code equals}/{@code hashCode}.</li>
 *   <li>Null is never seen.</li>
 *   <li>Filters never modify their input and return duplicate-free lists in input order.</li>
 * </ul>
 * Not thread-safe.
 *
 * @param <T> value type
 */
public final class SeenSet<T> implements BasicSet {
    private final HashSet<T> table;
    private final DedupStrategy dedupStrategy;

    public SeenSet() {
        this(SetkitConfiguration.defaults());
    }

    public SeenSet(SetkitConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.table = new HashSet<>(configuration.initialCapacity());
        this.dedupStrategy = configuration.dedupStrategy();
    }

    @Override
    public boolean isEmpty() {
        return table.isEmpty();
    }

    @Override
    public int size() {
        return table.size();
    }

    @Override
    public void reset() {
        table.clear();
    }

    /**
     * Marks a value as seen.
     *
     * @param value value to mark
     * @return true if the value was not seen before this call
     * @throws IllegalArgumentException if value is null
     */
    public boolean see(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        return table.add(value);
    }

    /**
     * Marks a value as seen, ignoring whether it already was.
     *
     * @param value value to mark
     * @throws IllegalArgumentException if value is null
     */
    public void setSeen(T value) {
        see(value);
    }

    /**
     * Marks every non-null value as seen.
     *
     * @param values values to mark, may be null
     * @return number of values that were newly marked
     */
    public int seeAll(Iterable<? extends T> values) {
        if (values == null) {
            return 0;
        }
        var count = 0;
        for (T value : values) {
            if (value != null && table.add(value)) {
                count++;
            }
        }
        return count;
    }

    public boolean has(T value) {
        return value != null && table.contains(value);
    }

    /**
     * Returns the seen values of {@code elems}, in their original order and
     * without duplicates.
     *
     * @param elems values to classify, may be null
     * @return a new list, empty when nothing matches
     */
    public List<T> filterSeen(List<? extends T> elems) {
        return filter(elems, true);
    }

    /**
     * Returns the values of {@code elems} that are not seen, in their original
     * order and without duplicates.
     *
     * @param elems values to classify, may be null
     * @return a new list, empty when nothing matches
     */
    public List<T> filterNotSeen(List<? extends T> elems) {
        return filter(elems, false);
    }

    private List<T> filter(List<? extends T> elems, boolean seen) {
        if (elems == null || elems.isEmpty()) {
            return new ArrayList<>();
        }
        var result = new ArrayList<T>(elems.size());
        for (T elem : elems) {
            if (has(elem) == seen) {
                result.add(elem);
            }
        }
        return dedup(result);
    }

    private List<T> dedup(List<T> list) {
        return switch (dedupStrategy) {
            case COMPACTING -> Dedup.compacting(list);
            case HASHED -> Dedup.hashed(list);
        };
    }
}
