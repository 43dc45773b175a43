package org.stackgraphs.arena;

/**
 * Typed index into an {@link Arena}.
 * <p>
 * The type parameter separates handles of different entity kinds at compile time. The
 * {@code ownerId} records which arena family issued the handle, so that a handle obtained
 * from one stack graph is rejected when used against another.
 *
 * @param ownerId identifier of the issuing arena family (one per stack graph)
 * @param index   zero-based position inside the arena
 * @param <T>     the entity kind this handle refers to
 */
public record Handle<T>(int ownerId, int index) implements Comparable<Handle<T>> {

    public Handle {
        if (index < 0) {
            throw new IllegalArgumentException("Handle index must be non-negative: " + index);
        }
    }

    /**
     * Orders by issuing arena family, then by position, consistent with {@code equals}.
     */
    @Override
    public int compareTo(Handle<T> other) {
        int byOwner = Integer.compare(ownerId, other.ownerId);
        return byOwner != 0 ? byOwner : Integer.compare(index, other.index);
    }

    @Override
    public String toString() {
        return "#" + index;
    }
}
