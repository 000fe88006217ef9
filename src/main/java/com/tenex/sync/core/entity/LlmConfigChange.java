package com.tenex.sync.core.entity;

import com.tenex.sync.core.merge.Mergeable;

import java.time.Instant;

/**
 * Latest LLM configuration requested for a project. Every field but the project is nullable;
 * a newer change replaces the previous one wholesale.
 */
public record LlmConfigChange(
        String projectIdentity,
        String model,
        Double temperature,
        Integer maxTokens,
        String provider,
        Instant observedAt
) implements Mergeable<LlmConfigChange> {

    @Override
    public String identity() {
        return projectIdentity;
    }

    @Override
    public Instant recordedAt() {
        return observedAt;
    }

    @Override
    public LlmConfigChange mergeNewer(LlmConfigChange newer) {
        return newer;
    }
}
