package com.tenex.sync.core.entity;

import com.tenex.sync.core.merge.Mergeable;

import java.time.Instant;

/**
 * A lesson learned by an agent, keyed by record id and immutable.
 *
 * <p>{@code agentName} and {@code lessonType} are nullable. Comments on a lesson are
 * {@link ThreadReply} records whose root is the lesson id.</p>
 */
public record Lesson(
        String id,
        String agentId,
        String projectIdentity,
        String title,
        String content,
        String agentName,
        String lessonType,
        Instant createdAt
) implements Mergeable<Lesson> {

    public static final String UNTITLED = "Untitled Lesson";

    @Override
    public String identity() {
        return id;
    }

    @Override
    public Instant recordedAt() {
        return createdAt;
    }

    @Override
    public Lesson mergeNewer(Lesson newer) {
        return this;
    }
}
