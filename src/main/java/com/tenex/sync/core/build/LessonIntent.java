package com.tenex.sync.core.build;

import java.time.Instant;

/**
 * Record a lesson. Nullable: {@code agentName}, {@code lessonType}.
 */
public record LessonIntent(
        String author,
        String projectIdentity,
        String title,
        String content,
        String agentName,
        String lessonType,
        Instant createdAt
) {}
