package org.sn.realtime.subscription;

import java.util.Collection;


/**
 * Tells the query cache which results to recompute.
 * Invalidation is fire and forget: failures are logged and neither retried nor reported to the caller,
 * as the next change event or reconnect invalidates again.
 */
public class CacheInvalidationBridge {
    private static final System.Logger LOGGER = System.getLogger(CacheInvalidationBridge.class.getName());

    private final QueryCache cache;

    public CacheInvalidationBridge(QueryCache cache) {
        this.cache = cache;
    }

    /**
     * Invalidate the cache entries named by descriptor after a change to table.
     */
    public void onChange(String table, CacheKeyDescriptor descriptor) {
        LOGGER.log(System.Logger.Level.TRACE, "Invalidating {0} after change to {1}", descriptor, table);
        invalidate(descriptor);
    }

    /**
     * Invalidate every cache entry of each table, whether or not a subscription covers it.
     * The entries of a table are those whose query key starts with the table name.
     */
    public void onForceRefresh(Collection<String> tables) {
        LOGGER.log(System.Logger.Level.DEBUG, "Invalidating all entries of tables {0}", tables);
        for (String table : tables) {
            invalidate(CacheKeyDescriptor.of(table));
        }
    }

    public void invalidateAll() {
        LOGGER.log(System.Logger.Level.INFO, "Invalidating all cached queries");
        try {
            cache.invalidateAll();
        } catch (RuntimeException e) {
            LOGGER.log(System.Logger.Level.WARNING, "Failed to invalidate all cached queries", e);
        }
    }

    private void invalidate(CacheKeyDescriptor descriptor) {
        try {
            cache.invalidate(descriptor);
        } catch (RuntimeException e) {
            LOGGER.log(System.Logger.Level.WARNING, "Failed to invalidate " + descriptor, e);
        }
    }
}
