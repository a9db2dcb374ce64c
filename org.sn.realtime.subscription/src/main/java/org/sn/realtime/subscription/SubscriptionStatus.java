package org.sn.realtime.subscription;

import javax.annotation.Nullable;


/**
 * Snapshot of the health of one subscription.
 *
 * @param connected true if the transport last reported the binding as live
 * @param state the detailed state
 * @param lastActivity the time of the last change event, presence ping, or successful bind, in epoch millis
 * @param priority the priority, null if there is no such subscription
 * @param errorCount the number of errors since the binding was last live
 */
public record SubscriptionStatus(boolean connected,
                                 SubscriptionState state,
                                 long lastActivity,
                                 @Nullable Priority priority,
                                 int errorCount) {
    /**
     * The status reported for a key that has no subscription.
     */
    public static final SubscriptionStatus NOT_SUBSCRIBED = new SubscriptionStatus(false, SubscriptionState.DISCONNECTED, 0, null, 0);
}
