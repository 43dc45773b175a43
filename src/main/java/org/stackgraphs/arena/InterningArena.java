package org.stackgraphs.arena;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Optional;

/**
 * Arena that stores each distinct value once. Adding an equal value again returns the handle of
 * the first copy, so handle equality is value equality.
 *
 * @param <T> the interned value type; must implement {@code equals}/{@code hashCode}
 */
public class InterningArena<T> extends Arena<T> {

    private final Object2IntOpenHashMap<T> indexByValue = new Object2IntOpenHashMap<>();

    public InterningArena(int ownerId) {
        super(ownerId);
        indexByValue.defaultReturnValue(-1);
    }

    @Override
    public Handle<T> add(T item) {
        int existing = indexByValue.getInt(item);
        if (existing >= 0) {
            return new Handle<>(ownerId(), existing);
        }
        Handle<T> handle = super.add(item);
        indexByValue.put(item, handle.index());
        return handle;
    }

    public Optional<Handle<T>> lookup(T item) {
        int existing = indexByValue.getInt(item);
        return existing >= 0 ? Optional.of(new Handle<>(ownerId(), existing)) : Optional.empty();
    }
}
