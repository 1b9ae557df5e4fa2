package io.setkit.collect;

/**
 * Minimal surface shared by every setkit container.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>{@code size() == 0} if and only if {@code isEmpty()}.</li>
 *   <li>After {@code reset()}, {@code isEmpty()} is true.</li>
 *   <li>{@code reset()} on an empty container is a no-op.</li>
 * </ul>
 * Implementations are not thread-safe; callers sharing a container across
 * threads must lock externally.
 *
 * @see Containers for null-tolerant access to possibly absent containers
 */
public interface BasicSet {
    /**
     * Tests whether the container holds no elements.
     * @return true if empty
     */
    boolean isEmpty();

    /**
     * Returns the number of logical elements.
     * @return element count (always non-negative)
     */
    int size();

    /**
     * Removes all elements.
     */
    void reset();
}
