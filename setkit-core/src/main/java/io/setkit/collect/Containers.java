package io.setkit.collect;

/**
 * Null-tolerant helpers over {@link BasicSet}.
 * <p>
 * A {@code null} reference behaves like an empty container: it is empty, has
 * size zero, and resetting it does nothing.
 */
public final class Containers {

    private Containers() {
    }

    public static boolean isEmpty(BasicSet set) {
        return set == null || set.isEmpty();
    }

    public static int size(BasicSet set) {
        return set == null ? 0 : set.size();
    }

    public static void reset(BasicSet set) {
        if (set != null) {
            set.reset();
        }
    }
}
