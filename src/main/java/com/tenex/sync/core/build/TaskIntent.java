package com.tenex.sync.core.build;

import java.time.Instant;
import java.util.List;

/**
 * Create a task. Nullable: {@code status}, {@code branch}, {@code conversationId}.
 */
public record TaskIntent(
        String author,
        String projectIdentity,
        String title,
        String content,
        String status,
        List<String> assignees,
        String branch,
        String conversationId,
        Instant createdAt
) {}
