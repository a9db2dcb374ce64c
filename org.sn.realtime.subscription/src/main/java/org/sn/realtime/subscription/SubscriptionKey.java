package org.sn.realtime.subscription;

import java.util.Objects;


/**
 * The stable identity of a subscription: the table and the cache entries it keeps fresh.
 * The string form is <code>table::descriptor</code>.
 */
public record SubscriptionKey(String table, CacheKeyDescriptor descriptor) {
    private static final String SEPARATOR = "::";

    public SubscriptionKey {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(descriptor, "descriptor");
        if (table.isEmpty() || table.contains(SEPARATOR)) {
            throw new IllegalArgumentException("invalid table name: '" + table + "'");
        }
    }

    /**
     * Parse the string form of a key.
     *
     * @throws IllegalArgumentException if value has no separator
     */
    public static SubscriptionKey parse(String value) {
        int index = value.indexOf(SEPARATOR);
        if (index < 0) {
            throw new IllegalArgumentException("not a subscription key: '" + value + "'");
        }
        return new SubscriptionKey(value.substring(0, index), CacheKeyDescriptor.parse(value.substring(index + SEPARATOR.length())));
    }

    public String asString() {
        return table + SEPARATOR + descriptor.asString();
    }

    @Override
    public String toString() {
        return asString();
    }
}
