package com.tenex.sync.core.transport;

import com.tenex.sync.core.model.SyncRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * =====================================================================
 * RecordTransport
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The pub/sub client the synchronization core consumes. The core treats it as
 * a black box: connection management, relays and signature verification live
 * behind this interface.
 *
 *   [ Orchestrator / Mutation service ]
 *                 │
 *                 ▼
 *        [ RecordTransport ]  ← YOU ARE HERE
 *                 │
 *                 ▼
 *      [ JetStream / relays / ... ]
 *
 * FAILURE SEMANTICS
 * -----------------
 * - No client bound: every operation fails with
 *   {@link TransportNotConfiguredException}
 * - Subscribe/publish/collect failures: {@link TransportUnavailableException},
 *   retryable by the caller
 * - A failure terminates only the stream that issued it
 *
 * DELIVERY
 * --------
 * Streams may deliver duplicates and out-of-order records. Callers must not
 * assume otherwise.
 *
 * THREAD SAFETY
 * -------------
 * Implementations MUST be thread-safe; they are shared singletons.
 */
public interface RecordTransport {

    /**
     * Continuous stream of records matching {@code filter}. Never completes on its own unless
     * {@code cachePolicy} is {@link CachePolicy#CACHE_ONLY}. Cancelling the subscription releases
     * the underlying transport resources.
     */
    Flux<SyncRecord> subscribe(RecordFilter filter, CachePolicy cachePolicy);

    /**
     * Bounded one-shot variant: collects what arrives within {@code timeout}.
     */
    Mono<List<SyncRecord>> collectOnce(RecordFilter filter, Duration timeout);

    /**
     * Publishes a signed record.
     *
     * @return destinations that acknowledged receipt
     */
    Mono<Set<String>> publish(SyncRecord record);

    /**
     * @return false when no client is bound and every operation would fail with
     *         {@link TransportNotConfiguredException}
     */
    default boolean isConfigured() {
        return true;
    }
}
