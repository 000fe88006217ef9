package com.tenex.sync.core.build;

import java.time.Instant;

public record TaskAbortIntent(String author, String taskId, Instant createdAt) {}
