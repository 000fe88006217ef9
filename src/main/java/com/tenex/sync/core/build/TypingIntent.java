package com.tenex.sync.core.build;

import java.time.Instant;

/**
 * Start ({@code typing = true}) or stop a typing indicator. {@code phase} is nullable.
 */
public record TypingIntent(
        String author,
        String conversationId,
        String projectIdentity,
        String message,
        String phase,
        boolean typing,
        Instant createdAt
) {}
