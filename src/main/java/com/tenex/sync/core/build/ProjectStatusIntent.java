package com.tenex.sync.core.build;

import com.tenex.sync.core.entity.ProjectStatus.AgentAvailability;

import java.time.Instant;
import java.util.List;

/**
 * Announce which agents are available in a project.
 */
public record ProjectStatusIntent(
        String author,
        String projectIdentity,
        List<AgentAvailability> agents,
        Instant createdAt
) {}
