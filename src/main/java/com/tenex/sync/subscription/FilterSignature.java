package com.tenex.sync.subscription;

import com.tenex.sync.core.transport.CachePolicy;
import com.tenex.sync.core.transport.RecordFilter;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Semantic key of a logical subscription, used to share one transport subscription among every
 * consumer interested in the same records.
 *
 * <h2>Canonical format (LOCKED)</h2>
 * <pre>
 * k=&lt;kinds&gt;|a=&lt;authors&gt;|#&lt;tag&gt;=&lt;values&gt;...|&lt;cachePolicy&gt;
 * </pre>
 *
 * <p>Every set is sorted and comma-joined and tag constraints are ordered by key, so two filters
 * that describe the same interest always produce the same signature regardless of insertion
 * order. Empty dimensions are written empty rather than omitted, which keeps the format
 * positional.</p>
 *
 * <p><b>Examples</b></p>
 * <pre>
 * k=31933|a=pk1|CACHE_THEN_NETWORK
 * k=24010|a=|#a=31933:pk1:proj1|NETWORK_ONLY
 * </pre>
 *
 * <p>The cache policy is part of the key: a cache-only replay and a live subscription over the
 * same filter are different transport subscriptions.</p>
 */
public record FilterSignature(String value, RecordFilter filter, CachePolicy cachePolicy) {

    public static FilterSignature of(RecordFilter filter, CachePolicy cachePolicy) {
        StringBuilder sb = new StringBuilder();
        sb.append("k=").append(join(filter.kinds()));
        sb.append("|a=").append(join(filter.authors()));
        Map<String, Set<String>> tags = new TreeMap<>(filter.tagConstraints());
        tags.forEach((key, values) -> sb.append("|#").append(key).append('=').append(join(values)));
        sb.append('|').append(cachePolicy.name());
        return new FilterSignature(sb.toString(), filter, cachePolicy);
    }

    private static String join(Set<?> values) {
        return values.stream()
                .map(String::valueOf)
                .collect(Collectors.toCollection(TreeSet::new))
                .stream()
                .collect(Collectors.joining(","));
    }

    /**
     * Only the canonical value takes part in equality; two signatures built from equivalent filters
     * are the same registry key.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FilterSignature)) {
            return false;
        }
        return value.equals(((FilterSignature) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
