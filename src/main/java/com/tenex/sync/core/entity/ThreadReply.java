package com.tenex.sync.core.entity;

import com.tenex.sync.core.merge.Mergeable;

import java.time.Instant;

/**
 * A reply inside a thread: a conversation reply or a comment on a lesson.
 *
 * <p>{@code rootId} is the record the thread hangs off, {@code parentId} the record replied to
 * (equal to the root for top-level replies). Immutable.</p>
 */
public record ThreadReply(
        String id,
        String rootId,
        String parentId,
        String projectIdentity,
        String authorId,
        String content,
        Instant createdAt
) implements Mergeable<ThreadReply> {

    @Override
    public String identity() {
        return id;
    }

    @Override
    public Instant recordedAt() {
        return createdAt;
    }

    @Override
    public ThreadReply mergeNewer(ThreadReply newer) {
        return this;
    }
}
