package com.tenex.sync.core.entity;

import com.tenex.sync.core.merge.Mergeable;

import java.time.Instant;
import java.util.List;

/**
 * A task inside a project, keyed by the id of the record that created it.
 *
 * <p>Later task records that reference this id refresh {@code status}, {@code assignees} and
 * {@code branch}; {@code title} and {@code content} are only overwritten by non-empty values.
 * {@code status}, {@code branch} and {@code relatedConversationId} are nullable.</p>
 */
public record Task(
        String id,
        String projectIdentity,
        String authorId,
        String title,
        String content,
        String status,
        List<String> assignees,
        String branch,
        String relatedConversationId,
        Instant recordedAt
) implements Mergeable<Task> {

    public static final String UNTITLED = "Untitled Task";

    public Task {
        assignees = List.copyOf(assignees);
    }

    @Override
    public String identity() {
        return id;
    }

    @Override
    public boolean foldsHistory() {
        return true;
    }

    public boolean isAssignedTo(String agentId) {
        return assignees.contains(agentId);
    }

    @Override
    public Task mergeNewer(Task newer) {
        return new Task(
                id,
                Mergeable.pick(newer.projectIdentity, projectIdentity),
                authorId,
                Mergeable.pick(newer.title, title, UNTITLED),
                Mergeable.pick(newer.content, content),
                Mergeable.pick(newer.status, status),
                Mergeable.pick(newer.assignees, assignees),
                Mergeable.pick(newer.branch, branch),
                Mergeable.pick(newer.relatedConversationId, relatedConversationId),
                newer.recordedAt
        );
    }
}
