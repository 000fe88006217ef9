package com.tenex.sync.core.entity;

import com.tenex.sync.core.merge.Mergeable;

import java.time.Instant;
import java.util.List;

/**
 * Presence snapshot of a project: the agents currently available in it.
 *
 * <p>A snapshot, not a diff. Every newer status for the same project replaces the agent list
 * entirely.</p>
 */
public record ProjectStatus(
        String projectIdentity,
        Instant observedAt,
        List<AgentAvailability> availableAgents
) implements Mergeable<ProjectStatus> {

    public ProjectStatus {
        availableAgents = List.copyOf(availableAgents);
    }

    /**
     * One agent listed by a status record.
     */
    public record AgentAvailability(String agentId, String slug, String name) {}

    @Override
    public String identity() {
        return projectIdentity;
    }

    @Override
    public Instant recordedAt() {
        return observedAt;
    }

    @Override
    public ProjectStatus mergeNewer(ProjectStatus newer) {
        return newer;
    }
}
