package com.tenex.sync.core.transport;

import com.tenex.sync.core.identity.AddressableId;
import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.parse.TagKeys;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Interest description passed to the transport.
 *
 * <p>An empty set means "no constraint" for that dimension. A tag constraint {@code key -> values}
 * matches when the record has a {@code key} group whose value is one of {@code values}. Project
 * references ({@code a}) are compared in normalized form, so a stored relay hint never prevents a
 * match.</p>
 */
public record RecordFilter(Set<String> authors, Set<Integer> kinds, Map<String, Set<String>> tagConstraints) {

    public RecordFilter {
        authors = authors == null ? Set.of() : Set.copyOf(authors);
        kinds = kinds == null ? Set.of() : Set.copyOf(kinds);
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        if (tagConstraints != null) {
            tagConstraints.forEach((k, v) -> copy.put(k, v == null ? Set.of() : Set.copyOf(v)));
        }
        tagConstraints = Map.copyOf(copy);
    }

    public static RecordFilter ofKinds(Integer... kinds) {
        return new RecordFilter(Set.of(), Set.of(kinds), Map.of());
    }

    public RecordFilter withAuthors(String... authors) {
        return new RecordFilter(Set.of(authors), kinds, tagConstraints);
    }

    public RecordFilter withTag(String key, String... values) {
        Map<String, Set<String>> next = new LinkedHashMap<>(tagConstraints);
        next.put(key, Set.of(values));
        return new RecordFilter(authors, kinds, next);
    }

    public boolean matches(SyncRecord record) {
        if (!authors.isEmpty() && !authors.contains(record.creator())) {
            return false;
        }
        if (!kinds.isEmpty() && !kinds.contains(record.kind())) {
            return false;
        }
        for (Map.Entry<String, Set<String>> c : tagConstraints.entrySet()) {
            if (!c.getValue().isEmpty() && !hasTagValue(record, c.getKey(), c.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasTagValue(SyncRecord record, String key, Set<String> accepted) {
        boolean address = TagKeys.ADDRESS.equals(key);
        for (List<String> group : record.tags()) {
            if (group.size() < 2 || !key.equals(group.get(0))) {
                continue;
            }
            String v = address ? AddressableId.normalize(group.get(1)) : group.get(1);
            if (accepted.contains(v)) {
                return true;
            }
        }
        return false;
    }
}
