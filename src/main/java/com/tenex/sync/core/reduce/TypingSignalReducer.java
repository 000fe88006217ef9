package com.tenex.sync.core.reduce;

import com.tenex.sync.core.entity.TypingSignal;
import com.tenex.sync.core.merge.MergeStore;
import com.tenex.sync.core.merge.UpsertResult;
import com.tenex.sync.core.model.RecordKind;
import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.parse.EntityParsers;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Latest typing signal per agent per conversation.
 *
 * <p>A stop record replaces the start record for the same agent, so at most one signal per agent
 * is held. Validity is decided on every read against the caller's clock; expired entries stay in
 * the store and are simply not reported.</p>
 */
public class TypingSignalReducer {

    private final MergeStore<TypingSignal> store;
    private final Duration validity;

    public TypingSignalReducer(MergeStore<TypingSignal> store) {
        this(store, TypingSignal.VALIDITY_WINDOW);
    }

    public TypingSignalReducer(MergeStore<TypingSignal> store, Duration validity) {
        this.store = store;
        this.validity = validity;
    }

    public Optional<TypingSignal> apply(SyncRecord record) {
        if (record.kind() != RecordKind.TYPING_START && record.kind() != RecordKind.TYPING_STOP) {
            return Optional.empty();
        }
        TypingSignal candidate = EntityParsers.typingSignal(record);
        if (candidate.conversationId().isEmpty()) {
            return Optional.empty();
        }
        UpsertResult<TypingSignal> r = store.upsert(candidate);
        return r.changed() ? Optional.of(r.entity()) : Optional.empty();
    }

    /**
     * Agents currently typing in {@code conversationId}, oldest signal first.
     */
    public List<TypingSignal> activeTyping(String conversationId, Instant now) {
        return store.snapshot().stream()
                .filter(s -> s.conversationId().equals(conversationId))
                .filter(TypingSignal::active)
                .filter(s -> s.isValid(now, validity))
                .sorted(Comparator.comparing(TypingSignal::observedAt))
                .toList();
    }

    public Duration validity() {
        return validity;
    }
}
