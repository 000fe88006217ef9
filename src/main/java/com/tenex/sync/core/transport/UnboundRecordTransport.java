package com.tenex.sync.core.transport;

import com.tenex.sync.core.model.SyncRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Stand-in used when no transport client is configured. Every operation fails with
 * {@link TransportNotConfiguredException}.
 */
public final class UnboundRecordTransport implements RecordTransport {

    private static final String MESSAGE = "No record transport bound (tenex.sync.transport.enabled=false)";

    @Override
    public Flux<SyncRecord> subscribe(RecordFilter filter, CachePolicy cachePolicy) {
        return Flux.error(new TransportNotConfiguredException(MESSAGE));
    }

    @Override
    public Mono<List<SyncRecord>> collectOnce(RecordFilter filter, Duration timeout) {
        return Mono.error(new TransportNotConfiguredException(MESSAGE));
    }

    @Override
    public Mono<Set<String>> publish(SyncRecord record) {
        return Mono.error(new TransportNotConfiguredException(MESSAGE));
    }

    @Override
    public boolean isConfigured() {
        return false;
    }
}
