package io.setkit.collect;

/**
 * Pairwise equality capability for element types that are neither hashable
 * nor ordered. Implementations must be symmetric.
 *
 * @param <T> the type compared against
 */
@FunctionalInterface
public interface Equatable<T> {
    boolean isEqualTo(T other);
}
