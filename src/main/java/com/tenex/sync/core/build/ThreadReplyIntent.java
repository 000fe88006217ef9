package com.tenex.sync.core.build;

import java.time.Instant;

/**
 * Reply in a thread. {@code parentId} is nullable (top-level reply to the root);
 * {@code projectIdentity} is nullable.
 */
public record ThreadReplyIntent(
        String author,
        String rootId,
        String parentId,
        String projectIdentity,
        String content,
        Instant createdAt
) {}
