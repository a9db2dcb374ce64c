package org.sn.realtime.subscription;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;


/**
 * One live registration against one change feed channel.
 * Owned by the {@link SubscriptionRegistry} and only read or modified while holding its lock.
 *
 * <p>A reconnect replaces the Subscription object under the same key with a {@link #successor()},
 * so callbacks of the previous channel can tell that they no longer apply.
 * The lineage id stays the same across successors and changes when the key is unsubscribed and subscribed again.
 */
@NotThreadSafe
final class Subscription {
    private final SubscriptionKey key;
    private final long lineageId;
    private final @Nullable ChannelFilter filter;
    private Priority priority;
    private int refCount;
    private @Nullable ChannelHandle channelHandle;
    private long lastActivityTimestamp;
    private boolean connected;
    private SubscriptionState state = SubscriptionState.CONNECTING;
    private int errorCount;
    private boolean binding;

    Subscription(SubscriptionKey key, long lineageId, @Nullable ChannelFilter filter, Priority priority, long now) {
        this.key = key;
        this.lineageId = lineageId;
        this.filter = filter;
        this.priority = priority;
        this.refCount = 1;
        this.lastActivityTimestamp = now;
        this.binding = true;
    }

    /**
     * Create the object that replaces this one on reconnect.
     * It has no channel yet and is marked as binding.
     */
    Subscription successor() {
        var successor = new Subscription(key, lineageId, filter, priority, lastActivityTimestamp);
        successor.refCount = refCount;
        successor.errorCount = errorCount;
        return successor;
    }

    SubscriptionKey getKey() {
        return key;
    }

    long getLineageId() {
        return lineageId;
    }

    @Nullable ChannelFilter getFilter() {
        return filter;
    }

    Priority getPriority() {
        return priority;
    }

    void setPriority(Priority priority) {
        this.priority = priority;
    }

    int incrementRefCount() {
        return ++refCount;
    }

    int decrementRefCount() {
        return --refCount;
    }

    @Nullable ChannelHandle getChannelHandle() {
        return channelHandle;
    }

    void setChannelHandle(@Nullable ChannelHandle channelHandle) {
        this.channelHandle = channelHandle;
    }

    long getLastActivityTimestamp() {
        return lastActivityTimestamp;
    }

    void touch(long now) {
        lastActivityTimestamp = Math.max(lastActivityTimestamp, now);
    }

    boolean isConnected() {
        return connected;
    }

    int getErrorCount() {
        return errorCount;
    }

    boolean isBinding() {
        return binding;
    }

    void setBinding(boolean binding) {
        this.binding = binding;
    }

    void markLive(long now) {
        connected = true;
        state = SubscriptionState.CONNECTED;
        errorCount = 0;
        touch(now);
    }

    void markError() {
        connected = false;
        state = SubscriptionState.ERROR;
        errorCount++;
    }

    /**
     * The transport closed the channel while it was still wanted. Counts as an error.
     */
    void markClosed() {
        connected = false;
        state = SubscriptionState.DISCONNECTED;
        errorCount++;
    }

    void markDisconnected() {
        connected = false;
        if (state != SubscriptionState.ERROR) {
            state = SubscriptionState.DISCONNECTED;
        }
    }

    SubscriptionStatus toStatus() {
        return new SubscriptionStatus(connected, state, lastActivityTimestamp, priority, errorCount);
    }

    @Override
    public String toString() {
        return key + "(" + priority + ", " + state + ")";
    }
}
