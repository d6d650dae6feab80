package de.t14d3.kvstore.core;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Assigns each tracked instance a stable numeric handle, based on reference identity.
 * <p>
 * The unit of work keys all of its tables by handle, so entity classes are free to
 * override {@code equals}/{@code hashCode} however they like.
 */
final class InstanceHandles {
    private final Map<Object, Long> handles = new IdentityHashMap<>();
    private long nextHandle = 1;

    /**
     * Returns the handle of the instance, assigning a new one on first use.
     */
    long register(Object instance) {
        Long handle = handles.get(instance);
        if (handle == null) {
            handle = nextHandle++;
            handles.put(instance, handle);
        }
        return handle;
    }

    /**
     * Returns the handle of the instance, or {@code null} if it was never registered.
     */
    Long peek(Object instance) {
        return handles.get(instance);
    }

    void release(Object instance) {
        handles.remove(instance);
    }

    void clear() {
        handles.clear();
    }
}
