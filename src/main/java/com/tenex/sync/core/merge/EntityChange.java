package com.tenex.sync.core.merge;

/**
 * Change notification published by a {@link MergeStore} after a successful mutation.
 *
 * <p>{@code entity} is the immutable value stored after the change ({@link Type#REMOVED}: the
 * value that was removed).</p>
 */
public record EntityChange<T>(Type type, String identity, T entity) {

    public enum Type {
        /** First value observed for the identity. */
        CREATED,
        /** A record changed the stored value. */
        UPDATED,
        /** An optimistic value was rolled back. */
        REMOVED
    }
}
