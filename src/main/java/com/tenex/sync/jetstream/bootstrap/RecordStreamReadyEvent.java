package com.tenex.sync.jetstream.bootstrap;

/**
 * =====================================================================
 * RecordStreamReadyEvent
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Signals that the record stream exists and matches its declared
 * configuration, so subscriptions may open pull consumers on it.
 *
 *   ┌──────────────────────────┐
 *   │ RecordStreamBootstrapper │
 *   └────────────┬─────────────┘
 *                │ publishes
 *                ▼
 *   ┌──────────────────────────┐
 *   │ ProjectSyncService start │
 *   └──────────────────────────┘
 *
 * Published once, synchronously, on the bootstrapping thread. Listeners must
 * tolerate never receiving it: bootstrap is disabled on nodes that do not own
 * the stream.
 */
public record RecordStreamReadyEvent(String streamName) {
}
