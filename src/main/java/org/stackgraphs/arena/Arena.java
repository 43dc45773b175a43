package org.stackgraphs.arena;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Append-only owner of entities of one kind. Entities are addressed by {@link Handle}s and are
 * never removed, so a handle stays valid for the lifetime of the arena.
 *
 * @param <T> the entity kind
 */
public class Arena<T> implements Iterable<Handle<T>> {

    private final int ownerId;
    private final List<T> items = new ArrayList<>();

    public Arena(int ownerId) {
        this.ownerId = ownerId;
    }

    public Handle<T> add(T item) {
        items.add(item);
        return new Handle<>(ownerId, items.size() - 1);
    }

    public T get(Handle<T> handle) {
        checkOwned(handle);
        return items.get(handle.index());
    }

    /**
     * Returns whether the handle was issued by this arena family and is in range.
     */
    public boolean owns(Handle<T> handle) {
        return handle != null && handle.ownerId() == ownerId && handle.index() < items.size();
    }

    public void checkOwned(Handle<T> handle) {
        if (handle == null) {
            throw new IllegalArgumentException("Handle must not be null");
        }
        if (handle.ownerId() != ownerId) {
            throw new IllegalArgumentException(
                "Handle " + handle + " was issued by a different stack graph (owner " + handle.ownerId()
                    + ", expected " + ownerId + ")");
        }
        if (handle.index() >= items.size()) {
            throw new IllegalArgumentException("Handle " + handle + " is out of range (size " + items.size() + ")");
        }
    }

    /**
     * Creates a handle for an index of this arena without going through {@link #add}.
     */
    public Handle<T> handleAt(int index) {
        Handle<T> handle = new Handle<>(ownerId, index);
        checkOwned(handle);
        return handle;
    }

    public int size() {
        return items.size();
    }

    public int ownerId() {
        return ownerId;
    }

    @Override
    public Iterator<Handle<T>> iterator() {
        final int limit = items.size();
        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < limit;
            }

            @Override
            public Handle<T> next() {
                if (next >= limit) {
                    throw new NoSuchElementException();
                }
                return new Handle<>(ownerId, next++);
            }
        };
    }
}
