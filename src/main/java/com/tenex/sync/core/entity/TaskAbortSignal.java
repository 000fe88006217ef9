package com.tenex.sync.core.entity;

import java.time.Instant;

/**
 * Fire-and-forget instruction to abort a running task. Consumed once by whoever drives the task;
 * never kept as entity state.
 */
public record TaskAbortSignal(String recordId, String taskId, String requesterId, Instant observedAt) {}
