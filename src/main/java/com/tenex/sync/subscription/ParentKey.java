package com.tenex.sync.subscription;

import com.tenex.sync.core.identity.AddressableId;
import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.model.Tags;
import com.tenex.sync.core.parse.TagKeys;

import java.time.Instant;

/**
 * What a hierarchical watch knows about a parent entity: its identity, the record currently
 * representing it and that record's timestamp.
 */
public record ParentKey(String identity, String recordId, Instant version) {

    /**
     * Key of an addressable parent ({@code kind:creator:slug}), or null when the record carries no
     * slug.
     */
    public static ParentKey addressable(SyncRecord record) {
        String slug = Tags.value(record.tags(), TagKeys.SLUG).orElse("");
        if (slug.isEmpty()) {
            return null;
        }
        String identity = AddressableId.of(record.kind(), record.creator(), slug).toString();
        return new ParentKey(identity, record.id(), record.createdAt());
    }
}
