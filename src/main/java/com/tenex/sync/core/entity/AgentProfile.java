package com.tenex.sync.core.entity;

import com.tenex.sync.core.merge.Mergeable;

import java.time.Instant;
import java.util.List;

/**
 * Definition of an agent, addressable by {@code 4199:<creator>:<id>}.
 *
 * <p>{@code id} is the {@code d} tag of the record when present, else the record id, so that
 * updates published with {@code d = <original id>} land on the same profile.
 * Optional descriptive fields are nullable. Updates are non-destructive.</p>
 */
public record AgentProfile(
        String identity,
        String id,
        String creatorId,
        String displayName,
        String instructionsMarkdown,
        String description,
        String role,
        String usageCriteria,
        String version,
        List<String> labels,
        Instant recordedAt
) implements Mergeable<AgentProfile> {

    public static final String UNTITLED = "Untitled Agent";

    public AgentProfile {
        labels = List.copyOf(labels);
    }

    @Override
    public AgentProfile mergeNewer(AgentProfile newer) {
        return new AgentProfile(
                identity,
                id,
                creatorId,
                Mergeable.pick(newer.displayName, displayName, UNTITLED),
                Mergeable.pick(newer.instructionsMarkdown, instructionsMarkdown),
                Mergeable.pick(newer.description, description),
                Mergeable.pick(newer.role, role),
                Mergeable.pick(newer.usageCriteria, usageCriteria),
                Mergeable.pick(newer.version, version),
                Mergeable.pick(newer.labels, labels),
                newer.recordedAt
        );
    }
}
