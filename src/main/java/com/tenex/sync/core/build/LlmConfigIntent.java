package com.tenex.sync.core.build;

import java.time.Instant;

/**
 * Change the LLM configuration of a project. Every setting is nullable and left out when null.
 */
public record LlmConfigIntent(
        String author,
        String projectIdentity,
        String model,
        Double temperature,
        Integer maxTokens,
        String provider,
        Instant createdAt
) {}
