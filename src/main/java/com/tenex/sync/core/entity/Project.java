package com.tenex.sync.core.entity;

import com.tenex.sync.core.merge.Mergeable;

import java.time.Instant;
import java.util.List;

/**
 * A project, identified by its addressable identity {@code 31933:<creator>:<slug>}.
 *
 * <p>Updated in place by later records with the same identity; never deleted by the core.
 * {@code description}, {@code repoUrl} and {@code picture} are nullable.</p>
 *
 * <p>An absent {@code title} tag resolves to the slug, so a title equal to the slug counts as
 * "not supplied" when merging.</p>
 */
public record Project(
        String identity,
        String creatorId,
        String slug,
        String title,
        String description,
        String repoUrl,
        String picture,
        List<String> hashtags,
        List<String> agentIds,
        List<String> toolIds,
        Instant recordedAt
) implements Mergeable<Project> {

    public Project {
        hashtags = List.copyOf(hashtags);
        agentIds = List.copyOf(agentIds);
        toolIds = List.copyOf(toolIds);
    }

    @Override
    public Project mergeNewer(Project newer) {
        return new Project(
                identity,
                creatorId,
                slug,
                Mergeable.pick(newer.title, title, newer.slug),
                Mergeable.pick(newer.description, description),
                Mergeable.pick(newer.repoUrl, repoUrl),
                Mergeable.pick(newer.picture, picture),
                Mergeable.pick(newer.hashtags, hashtags),
                Mergeable.pick(newer.agentIds, agentIds),
                Mergeable.pick(newer.toolIds, toolIds),
                newer.recordedAt
        );
    }
}
