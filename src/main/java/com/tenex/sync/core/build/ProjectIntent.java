package com.tenex.sync.core.build;

import java.time.Instant;
import java.util.List;

/**
 * Create or update a project. Nullable: {@code description}, {@code repoUrl}, {@code picture}.
 */
public record ProjectIntent(
        String author,
        String slug,
        String title,
        String description,
        String repoUrl,
        String picture,
        List<String> hashtags,
        List<String> agentIds,
        List<String> toolIds,
        Instant createdAt
) {}
