package com.tenex.sync.core.build;

import java.time.Instant;
import java.util.List;

/**
 * Publish an agent definition. {@code agentId} is nullable: when set the record is addressed to
 * that existing profile (update), when null the signed record id becomes the profile id.
 */
public record AgentProfileIntent(
        String author,
        String agentId,
        String displayName,
        String instructionsMarkdown,
        String description,
        String role,
        String usageCriteria,
        String version,
        List<String> labels,
        Instant createdAt
) {}
