package com.tenex.sync.core.build;

import java.time.Instant;

/**
 * Backfill the title of an existing conversation.
 */
public record ConversationTitleIntent(
        String author,
        String conversationId,
        String projectIdentity,
        String title,
        Instant createdAt
) {}
