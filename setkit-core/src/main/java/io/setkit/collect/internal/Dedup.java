package io.setkit.collect.internal;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Stable, in-place duplicate removal.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Only the first occurrence of every value is kept (equality is {@link Objects#equals}).</li>
 *   <li>Kept values stay in their original relative order.</li>
 *   <li>The given list is compacted and truncated in place and then returned.
 *       Callers must treat the argument as consumed.</li>
 *   <li>The list must support {@code set} and {@code subList(..).clear()}.</li>
 * </ul>
 */
public final class Dedup {

    private Dedup() {
    }

    /**
     * Removes duplicates by repeated anchor-and-compact passes. O(n^2) comparisons,
     * no allocation.
     *
     * @param list list to deduplicate, modified in place
     * @return {@code list}, truncated to its distinct values
     */
    public static <T> List<T> compacting(List<T> list) {
        if (list.isEmpty()) {
            return list;
        }
        var size = list.size();
        for (var i = 0; i < size - 1; i++) {
            var anchor = list.get(i);
            var top = i + 1;
            for (var j = i + 1; j < size; j++) {
                var candidate = list.get(j);
                if (!Objects.equals(candidate, anchor)) {
                    if (top != j) {
                        list.set(top, candidate);
                    }
                    top++;
                }
            }
            size = top;
        }
        truncate(list, size);
        return list;
    }

    /**
     * Removes duplicates in a single pass, tracking kept values in a hash set.
     * Same result as {@link #compacting(List)}.
     *
     * @param list list to deduplicate, modified in place
     * @return {@code list}, truncated to its distinct values
     */
    public static <T> List<T> hashed(List<T> list) {
        if (list.isEmpty()) {
            return list;
        }
        var kept = new HashSet<T>(Math.max(16, list.size() * 2));
        var top = 0;
        for (var i = 0; i < list.size(); i++) {
            var candidate = list.get(i);
            if (kept.add(candidate)) {
                if (top != i) {
                    list.set(top, candidate);
                }
                top++;
            }
        }
        truncate(list, top);
        return list;
    }

    private static <T> void truncate(List<T> list, int size) {
        if (size < list.size()) {
            list.subList(size, list.size()).clear();
        }
    }
}
