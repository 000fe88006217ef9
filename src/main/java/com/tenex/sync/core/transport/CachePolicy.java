package com.tenex.sync.core.transport;

/**
 * How a transport may serve locally stored (possibly stale) records relative to live delivery.
 * The synchronization core is correct under all three because merge only ever advances state.
 */
public enum CachePolicy {

    /**
     * Replay what is already stored, then complete. No live delivery.
     */
    CACHE_ONLY,

    /**
     * Live delivery only; nothing published before the subscription started.
     */
    NETWORK_ONLY,

    /**
     * Replay what is stored, then keep delivering live records.
     */
    CACHE_THEN_NETWORK;

    public boolean replaysStored() {
        return this != NETWORK_ONLY;
    }

    public boolean isLive() {
        return this != CACHE_ONLY;
    }
}
