package com.tenex.sync.core.build;

import java.time.Instant;
import java.util.List;

/**
 * Start a conversation in a project, optionally mentioning agents. {@code title} is nullable.
 */
public record ConversationIntent(
        String author,
        String projectIdentity,
        String title,
        String content,
        List<String> mentionedAgentIds,
        Instant createdAt
) {}
