package org.sn.realtime.subscription;

import java.util.concurrent.atomic.AtomicBoolean;


/**
 * What a caller of subscribe holds on to.
 * Every call to subscribe returns a new handle, even when the subscription already existed,
 * and the subscription is removed once all of its handles are released.
 *
 * <p>A handle refers to the logical subscription through its key,
 * so it keeps working across reconnects of the underlying channel.
 */
public class SubscriptionHandle {
    private final SubscriptionRegistry registry;
    private final SubscriptionKey key;
    private final long lineageId;
    private final AtomicBoolean released = new AtomicBoolean();

    SubscriptionHandle(SubscriptionRegistry registry, SubscriptionKey key, long lineageId) {
        this.registry = registry;
        this.key = key;
        this.lineageId = lineageId;
    }

    public SubscriptionKey key() {
        return key;
    }

    long lineageId() {
        return lineageId;
    }

    /**
     * Release this handle. Calling it a second time does nothing.
     */
    public void unsubscribe() {
        registry.unsubscribe(this);
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Return true the first time this is called.
     */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "SubscriptionHandle(" + key + ")";
    }
}
