package com.tenex.sync.subscription;

/**
 * Lifecycle of one logical subscription.
 */
public enum SubscriptionState {

    /** Transport subscription running, records are delivered. */
    ACTIVE,

    /** Transport failed mid-stream; no live updates until a caller retries. */
    FAILED,

    /** Finite (cache-only) subscription delivered everything it had. */
    COMPLETED,

    /** Cancelled by its consumer. Terminal. */
    CANCELLED
}
