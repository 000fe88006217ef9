package com.tenex.sync.core.entity;

import com.tenex.sync.core.merge.Mergeable;

import java.time.Instant;
import java.util.List;

/**
 * Root of a conversation thread, keyed by its record id and attached to exactly one project.
 *
 * <p>Immutable after creation except for the title, which a later record referencing this
 * conversation may backfill. {@code recordedAt} is the timestamp of the record the value was
 * parsed from: the creation record, or the referencing update.</p>
 */
public record Conversation(
        String id,
        String projectIdentity,
        String authorId,
        String title,
        String content,
        List<String> mentionedAgentIds,
        Instant createdAt,
        Instant recordedAt
) implements Mergeable<Conversation> {

    public static final String UNTITLED = "Untitled";

    public Conversation {
        mentionedAgentIds = List.copyOf(mentionedAgentIds);
    }

    @Override
    public String identity() {
        return id;
    }

    @Override
    public boolean foldsHistory() {
        return true;
    }

    @Override
    public Conversation mergeNewer(Conversation newer) {
        return new Conversation(
                id,
                projectIdentity.isEmpty() ? newer.projectIdentity : projectIdentity,
                authorId,
                Mergeable.pick(newer.title, title, UNTITLED),
                content.isEmpty() ? newer.content : content,
                mentionedAgentIds,
                createdAt,
                newer.recordedAt
        );
    }
}
