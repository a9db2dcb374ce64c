package org.sn.realtime.subscription;


/**
 * The client side cache of query results kept fresh by subscriptions.
 */
public interface QueryCache {
    /**
     * Mark the cached results named by the descriptor as stale so that they are recomputed.
     * The tokens of a list descriptor together name one query key, matched as a prefix.
     */
    void invalidate(CacheKeyDescriptor descriptor);

    void invalidateAll();
}
