package com.tenex.sync.core.reduce;

import com.tenex.sync.core.entity.ThreadReply;
import com.tenex.sync.core.merge.MergeStore;
import com.tenex.sync.core.merge.UpsertResult;
import com.tenex.sync.core.model.RecordKind;
import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.parse.EntityParsers;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Groups thread replies (conversation replies, lesson comments) by the record they hang off.
 * Replies are unique by id; a redelivered reply changes nothing.
 */
public class ThreadReplyReducer {

    private static final Comparator<ThreadReply> THREAD_ORDER =
            Comparator.comparing(ThreadReply::createdAt).thenComparing(ThreadReply::id);

    private final MergeStore<ThreadReply> store;

    public ThreadReplyReducer(MergeStore<ThreadReply> store) {
        this.store = store;
    }

    public Optional<ThreadReply> apply(SyncRecord record) {
        if (record.kind() != RecordKind.THREAD_REPLY || record.id().isEmpty()) {
            return Optional.empty();
        }
        UpsertResult<ThreadReply> r = store.upsert(EntityParsers.threadReply(record));
        return r.changed() ? Optional.of(r.entity()) : Optional.empty();
    }

    /**
     * Replies under {@code rootId}, oldest first.
     */
    public List<ThreadReply> repliesTo(String rootId) {
        return store.snapshot().stream()
                .filter(r -> r.rootId().equals(rootId))
                .sorted(THREAD_ORDER)
                .toList();
    }
}
