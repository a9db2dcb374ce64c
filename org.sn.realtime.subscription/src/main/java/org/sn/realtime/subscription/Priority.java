package org.sn.realtime.subscription;

import java.time.Duration;
import java.util.Optional;


/**
 * How strictly a subscription is held to being fresh.
 * Declared in the order in which subscriptions are checked and reconnected.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Return how long a subscription of this priority may go without activity before it is considered stale.
     * LOW priority subscriptions never go stale.
     */
    public Optional<Duration> staleAfter(RealtimeConfig config) {
        return switch (this) {
            case HIGH -> Optional.of(config.highPriorityStaleAfter());
            case MEDIUM -> Optional.of(config.mediumPriorityStaleAfter());
            case LOW -> Optional.empty();
        };
    }

    public boolean isHigherThan(Priority other) {
        return ordinal() < other.ordinal();
    }
}
