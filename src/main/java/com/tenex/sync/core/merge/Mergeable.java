package com.tenex.sync.core.merge;

import java.time.Instant;
import java.util.List;

/**
 * Contract every entity kept in a {@link MergeStore} fulfils.
 *
 * <h2>Identity</h2>
 * {@link #identity()} decides which slot of the store a value belongs to: an addressable identity
 * ({@code kind:creator:slug}) for mutable logical entities, or a record id for append-only ones.
 *
 * <h2>Version</h2>
 * {@link #recordedAt()} is the creation timestamp of the record this value was parsed from.
 * The store compares it against the version of what it already holds and ignores anything that
 * is not strictly newer, unless the entity {@linkplain #foldsHistory() folds its history}.
 *
 * <h2>Field-update policy</h2>
 * {@link #mergeNewer(Mergeable)} is called only with a strictly newer value for the same identity.
 * Implementations either merge non-destructively (a field is taken from {@code newer} only when
 * {@code newer} supplies a real value) or replace wholesale (presence snapshots).
 *
 * @param <T> the entity type itself
 */
public interface Mergeable<T extends Mergeable<T>> {

    String identity();

    Instant recordedAt();

    T mergeNewer(T newer);

    /**
     * Whether the store keeps every version of the identity and re-derives the value by folding
     * them oldest first with {@link #mergeNewer}. Entities refreshed by partial update records
     * return true, so an original that arrives after its updates still contributes the fields
     * the updates left empty.
     */
    default boolean foldsHistory() {
        return false;
    }

    /**
     * Non-destructive pick for a scalar field: {@code newer} wins only if it is non-blank and not
     * the documented placeholder the parser uses for an absent value.
     */
    static String pick(String newer, String stored, String placeholder) {
        if (newer == null || newer.isBlank() || newer.equals(placeholder)) {
            return stored;
        }
        return newer;
    }

    /**
     * Non-destructive pick for an optional (nullable) field.
     */
    static String pick(String newer, String stored) {
        return pick(newer, stored, null);
    }

    /**
     * Non-destructive pick for a list field: an empty list never erases a known one.
     */
    static <E> List<E> pick(List<E> newer, List<E> stored) {
        return newer == null || newer.isEmpty() ? stored : newer;
    }
}
