package com.tenex.sync.core.merge;

/**
 * Outcome of {@link MergeStore#upsert}: the value now stored for the identity, and whether the
 * call changed it.
 */
public record UpsertResult<T>(T entity, boolean changed) {}
