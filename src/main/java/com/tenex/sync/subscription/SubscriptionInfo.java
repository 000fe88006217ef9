package com.tenex.sync.subscription;

import com.tenex.sync.core.transport.CachePolicy;

/**
 * Read-only view of one registry entry, for diagnostics.
 */
public record SubscriptionInfo(
        String signature,
        CachePolicy cachePolicy,
        SubscriptionState state,
        int consumers,
        long delivered,
        String lastError
) {}
