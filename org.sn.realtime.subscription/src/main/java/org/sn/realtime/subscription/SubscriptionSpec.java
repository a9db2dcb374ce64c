package org.sn.realtime.subscription;

import java.util.Objects;
import javax.annotation.Nullable;


/**
 * One element of a batch subscribe.
 */
public record SubscriptionSpec(String table, CacheKeyDescriptor descriptor, @Nullable ChannelFilter filter, Priority priority) {
    public SubscriptionSpec {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(priority, "priority");
    }

    public SubscriptionSpec(String table, CacheKeyDescriptor descriptor) {
        this(table, descriptor, null, Priority.MEDIUM);
    }

    public SubscriptionKey key() {
        return new SubscriptionKey(table, descriptor);
    }
}
