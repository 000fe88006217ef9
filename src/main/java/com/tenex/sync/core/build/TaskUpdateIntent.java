package com.tenex.sync.core.build;

import java.time.Instant;
import java.util.List;

/**
 * Refresh fields of an existing task. Null or empty fields are left out of the record, so they
 * do not touch the stored task.
 */
public record TaskUpdateIntent(
        String author,
        String taskId,
        String projectIdentity,
        String status,
        List<String> assignees,
        String branch,
        Instant createdAt
) {}
