package com.tenex.sync.core.transport;

import com.tenex.sync.core.model.SyncRecord;
import reactor.core.publisher.Mono;

/**
 * Signs outgoing records: assigns the record id and binds the creator identity. Provided by the
 * host application; the synchronization core never holds keys.
 */
@FunctionalInterface
public interface RecordSigner {

    Mono<SyncRecord> sign(SyncRecord unsigned);
}
