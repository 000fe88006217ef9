package com.tenex.sync.subscription;

/**
 * Cancellation handle returned by {@link SubscriptionOrchestrator#watch}.
 *
 * <p>{@link #cancel()} stops delivery to this consumer and releases the transport subscription
 * once no other consumer shares it. It is safe to call more than once and from any thread.</p>
 */
public interface SubscriptionHandle {

    FilterSignature signature();

    SubscriptionState state();

    void cancel();

    default boolean isCancelled() {
        return state() == SubscriptionState.CANCELLED;
    }
}
