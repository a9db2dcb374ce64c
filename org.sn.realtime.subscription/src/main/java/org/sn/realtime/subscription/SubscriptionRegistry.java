package org.sn.realtime.subscription;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import org.sn.realtime.util.MultimapUtils;


/**
 * Owns the set of live subscriptions, at most one per key, and their channels.
 *
 * <p>Subscriptions are indexed by table and by UI route.
 * The subscription map and both indices are guarded by one lock.
 * Calls to the transport and the cache are made without holding the lock.
 *
 * <p>Every path that opens a channel goes through {@link #rebind(SubscriptionKey)} or the initial bind in subscribe.
 * A bind that finishes after its key was unsubscribed closes the new channel instead of registering it.
 * Callbacks from a channel that has been replaced are ignored.
 */
public class SubscriptionRegistry {
    private static final System.Logger LOGGER = System.getLogger(SubscriptionRegistry.class.getName());

    /**
     * Receives the health events of channels, used to schedule reconnects.
     */
    public interface ChannelEventListener {
        /**
         * A channel could not be opened, or the transport reported an error on it.
         */
        void onChannelError(SubscriptionKey key);

        /**
         * The transport reported the channel as subscribed.
         */
        void onChannelLive(SubscriptionKey key);

        /**
         * The subscription of key was removed, by its last unsubscribe or by a teardown.
         */
        void onSubscriptionRemoved(SubscriptionKey key);
    }

    private static final ChannelEventListener NO_LISTENER = new ChannelEventListener() {
        @Override
        public void onChannelError(SubscriptionKey key) {
        }

        @Override
        public void onChannelLive(SubscriptionKey key) {
        }

        @Override
        public void onSubscriptionRemoved(SubscriptionKey key) {
        }
    };

    private final ChangeFeedTransport transport;
    private final CacheInvalidationBridge bridge;
    private final LongSupplier clock;
    private final AtomicLong nextLineageId = new AtomicLong();
    private volatile ChannelEventListener channelEventListener = NO_LISTENER;

    private final ReentrantLock lock = new ReentrantLock();
    @GuardedBy("lock") private final Map<SubscriptionKey, Subscription> subscriptions = new LinkedHashMap<>();
    @GuardedBy("lock") private final Map<String /*table*/, Collection<SubscriptionKey>> tableMap = new LinkedHashMap<>();
    @GuardedBy("lock") private final Map<String /*route*/, Collection<SubscriptionKey>> routeMap = new LinkedHashMap<>();
    @GuardedBy("lock") private final MultimapUtils<String, SubscriptionKey> tableIndex = new MultimapUtils<>(tableMap, LinkedHashSet::new);
    @GuardedBy("lock") private final MultimapUtils<String, SubscriptionKey> routeIndex = new MultimapUtils<>(routeMap, LinkedHashSet::new);

    /**
     * Create a registry.
     *
     * @param transport the change feed
     * @param bridge where change events are forwarded
     * @param clock the current time in epoch millis
     */
    public SubscriptionRegistry(ChangeFeedTransport transport, CacheInvalidationBridge bridge, LongSupplier clock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void setChannelEventListener(ChannelEventListener listener) {
        this.channelEventListener = Objects.requireNonNull(listener, "listener");
    }

    // Subscribe and unsubscribe:

    public SubscriptionHandle subscribe(String table, CacheKeyDescriptor descriptor) {
        return subscribe(table, descriptor, null, Priority.MEDIUM);
    }

    /**
     * Subscribe to changes of table, invalidating the cache entries named by descriptor on each change.
     *
     * <p>If a subscription with the same table and descriptor exists, no channel is opened.
     * The existing subscription gains a reference, its priority is raised to the given one if higher,
     * and the filter argument is ignored.
     * Otherwise a new subscription is created and its channel is opened in the background.
     * Failure to open the channel is not reported to the caller, and is retried.
     *
     * @return a new handle, which must be released by unsubscribe
     */
    public SubscriptionHandle subscribe(String table, CacheKeyDescriptor descriptor, @Nullable ChannelFilter filter, Priority priority) {
        var key = new SubscriptionKey(table, descriptor);
        Objects.requireNonNull(priority, "priority");
        Subscription created = null;
        SubscriptionHandle handle;
        lock.lock();
        try {
            Subscription existing = subscriptions.get(key);
            if (existing != null) {
                int refCount = existing.incrementRefCount();
                if (priority.isHigherThan(existing.getPriority())) {
                    existing.setPriority(priority);
                }
                LOGGER.log(System.Logger.Level.DEBUG, "Reusing subscription {0}: references={1}", key, refCount);
                handle = new SubscriptionHandle(this, key, existing.getLineageId());
            } else {
                created = new Subscription(key, nextLineageId.incrementAndGet(), filter, priority, clock.getAsLong());
                subscriptions.put(key, created);
                tableIndex.put(table, key);
                handle = new SubscriptionHandle(this, key, created.getLineageId());
            }
        } finally {
            lock.unlock();
        }
        if (created != null) {
            LOGGER.log(System.Logger.Level.INFO, "Subscribing to {0}: priority={1}", key, priority);
            bind(created);
        }
        return handle;
    }

    /**
     * Subscribe to each spec in turn.
     */
    public CompositeSubscriptionHandle subscribeMany(List<SubscriptionSpec> specs) {
        List<SubscriptionHandle> handles = new ArrayList<>(specs.size());
        for (var spec : specs) {
            handles.add(subscribe(spec.table(), spec.descriptor(), spec.filter(), spec.priority()));
        }
        return new CompositeSubscriptionHandle(handles);
    }

    /**
     * Release a handle.
     * When the last handle of a subscription is released the subscription is removed from both indices and its channel is closed.
     * Releasing a handle that was already released, or whose subscription was torn down with its route, does nothing.
     */
    public void unsubscribe(SubscriptionHandle handle) {
        if (!handle.markReleased()) {
            LOGGER.log(System.Logger.Level.TRACE, "Handle already released: {0}", handle.key());
            return;
        }
        SubscriptionKey key = handle.key();
        ChannelHandle channel;
        lock.lock();
        try {
            Subscription subscription = subscriptions.get(key);
            if (subscription == null || subscription.getLineageId() != handle.lineageId()) {
                return;
            }
            int refCount = subscription.decrementRefCount();
            if (refCount > 0) {
                LOGGER.log(System.Logger.Level.DEBUG, "Released reference to {0}: references={1}", key, refCount);
                return;
            }
            channel = removeLocked(key).getChannelHandle();
        } finally {
            lock.unlock();
        }
        LOGGER.log(System.Logger.Level.INFO, "Unsubscribed from {0}", key);
        channelEventListener.onSubscriptionRemoved(key);
        closeQuietly(key, channel);
    }

    /**
     * Remove every subscription regardless of outstanding handles and close all channels.
     *
     * @return the number of subscriptions removed
     */
    public int unsubscribeAll() {
        Map<SubscriptionKey, ChannelHandle> channels = new LinkedHashMap<>();
        lock.lock();
        try {
            subscriptions.forEach((key, subscription) -> channels.put(key, subscription.getChannelHandle()));
            subscriptions.clear();
            tableMap.clear();
            routeMap.clear();
        } finally {
            lock.unlock();
        }
        LOGGER.log(System.Logger.Level.INFO, "Unsubscribed from all {0} subscriptions", channels.size());
        channels.forEach(this::closeRemoved);
        return channels.size();
    }

    private void closeRemoved(SubscriptionKey key, @Nullable ChannelHandle channel) {
        channelEventListener.onSubscriptionRemoved(key);
        closeQuietly(key, channel);
    }

    @GuardedBy("lock")
    private @Nonnull Subscription removeLocked(SubscriptionKey key) {
        Subscription subscription = subscriptions.remove(key);
        tableIndex.remove(key.table(), key);
        routeIndex.removeFromAll(key);
        return subscription;
    }

    // Routes:

    /**
     * Tag the subscription of a handle with a UI route.
     * A handle outlived by its subscription tags nothing, even if the key has been subscribed again since.
     *
     * @return false if the handle was released or its subscription no longer exists
     */
    public boolean registerForRoute(String route, SubscriptionHandle handle) {
        Objects.requireNonNull(route, "route");
        if (handle.isReleased()) {
            return false;
        }
        lock.lock();
        try {
            Subscription subscription = subscriptions.get(handle.key());
            if (subscription == null || subscription.getLineageId() != handle.lineageId()) {
                return false;
            }
            routeIndex.put(route, handle.key());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tag an existing subscription with a UI route.
     * A subscription may be tagged with any number of routes.
     *
     * @return false if there is no subscription for key
     */
    public boolean registerForRoute(String route, SubscriptionKey key) {
        Objects.requireNonNull(route, "route");
        lock.lock();
        try {
            if (!subscriptions.containsKey(key)) {
                return false;
            }
            routeIndex.put(route, key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unsubscribe every subscription tagged with route, even those that still have handles elsewhere.
     * The subscriptions are removed from the table index and every other route, and their channels are closed.
     *
     * @return the number of subscriptions removed
     */
    public int teardownRoute(String route) {
        Map<SubscriptionKey, ChannelHandle> channels = new LinkedHashMap<>();
        lock.lock();
        try {
            Collection<SubscriptionKey> keys = routeMap.remove(route);
            if (keys == null) {
                return 0;
            }
            for (var key : keys) {
                if (subscriptions.containsKey(key)) {
                    channels.put(key, removeLocked(key).getChannelHandle());
                }
            }
        } finally {
            lock.unlock();
        }
        LOGGER.log(System.Logger.Level.INFO, "Tore down route {0}: subscriptions={1}", route, channels.keySet());
        channels.forEach(this::closeRemoved);
        return channels.size();
    }

    // Binding:

    /**
     * Close the channel of a subscription and open a new one, keeping the key, priority, filter, and references.
     * The cache entries of the subscription are invalidated once the new channel is open.
     *
     * <p>If a bind of the same key is in progress, this does nothing and returns COALESCED,
     * as the bind in progress leads to the same end state.
     *
     * @return the outcome, which is ABANDONED if there is no subscription for key
     */
    public CompletionStage<BindResult> rebind(SubscriptionKey key) {
        Subscription successor;
        ChannelHandle oldChannel;
        lock.lock();
        try {
            Subscription previous = subscriptions.get(key);
            if (previous == null) {
                LOGGER.log(System.Logger.Level.DEBUG, "Not rebinding {0} as it is not subscribed", key);
                return CompletableFuture.completedFuture(BindResult.ABANDONED);
            }
            if (previous.isBinding()) {
                LOGGER.log(System.Logger.Level.DEBUG, "Not rebinding {0} as a bind is in progress", key);
                return CompletableFuture.completedFuture(BindResult.COALESCED);
            }
            oldChannel = previous.getChannelHandle();
            successor = previous.successor();
            subscriptions.put(key, successor);
        } finally {
            lock.unlock();
        }
        LOGGER.log(System.Logger.Level.DEBUG, "Rebinding {0}", key);
        closeQuietly(key, oldChannel);
        return bind(successor);
    }

    private CompletionStage<BindResult> bind(Subscription subscription) {
        SubscriptionKey key = subscription.getKey();
        CompletionStage<ChannelHandle> opened;
        try {
            opened = transport.openChannel(key.table(), subscription.getFilter());
        } catch (RuntimeException e) {
            opened = CompletableFuture.failedFuture(e);
        }
        return opened.handle((channel, error) -> {
            if (error != null) {
                return onBindFailed(subscription, error);
            }
            if (channel == null) {
                return onBindFailed(subscription, new ChangeFeedException("transport opened no channel for table " + key.table()));
            }
            return onChannelOpened(subscription, channel);
        });
    }

    private BindResult onChannelOpened(Subscription subscription, ChannelHandle channel) {
        SubscriptionKey key = subscription.getKey();
        boolean current;
        lock.lock();
        try {
            subscription.setBinding(false);
            current = subscriptions.get(key) == subscription;
            if (current) {
                subscription.setChannelHandle(channel);
                subscription.touch(clock.getAsLong());
            }
        } finally {
            lock.unlock();
        }
        if (!current) {
            LOGGER.log(System.Logger.Level.DEBUG, "Closing channel {0} as {1} was unsubscribed while it opened", channel.channelName(), key);
            closeQuietly(key, channel);
            return BindResult.ABANDONED;
        }
        transport.onChange(channel, (eventType, payload) -> onChannelChange(subscription, channel, eventType));
        transport.onPresence(channel, () -> onChannelPresence(subscription, channel));
        transport.onBindStatus(channel, status -> onChannelStatus(subscription, channel, status));
        LOGGER.log(System.Logger.Level.DEBUG, "Opened channel {0} for {1}", channel.channelName(), key);
        bridge.onChange(key.table(), key.descriptor());
        return BindResult.BOUND;
    }

    private BindResult onBindFailed(Subscription subscription, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        SubscriptionKey key = subscription.getKey();
        boolean current;
        lock.lock();
        try {
            subscription.setBinding(false);
            current = subscriptions.get(key) == subscription;
            if (current) {
                subscription.markError();
            }
        } finally {
            lock.unlock();
        }
        if (!current) {
            LOGGER.log(System.Logger.Level.DEBUG, "Ignoring failure to open channel for {0} as it was unsubscribed: {1}", key, cause.toString());
            return BindResult.ABANDONED;
        }
        LOGGER.log(System.Logger.Level.WARNING, "Failed to open channel for " + key + ": " + cause);
        channelEventListener.onChannelError(key);
        return BindResult.FAILED;
    }

    // Channel callbacks:

    private void onChannelChange(Subscription subscription, ChannelHandle channel, ChangeEventType eventType) {
        SubscriptionKey key = subscription.getKey();
        if (!touchIfCurrent(subscription, channel)) {
            LOGGER.log(System.Logger.Level.TRACE, "Ignoring {0} event from replaced channel {1}", eventType, channel.channelName());
            return;
        }
        LOGGER.log(System.Logger.Level.TRACE, "Received {0} event for {1}", eventType, key);
        bridge.onChange(key.table(), key.descriptor());
    }

    private void onChannelPresence(Subscription subscription, ChannelHandle channel) {
        if (touchIfCurrent(subscription, channel)) {
            LOGGER.log(System.Logger.Level.TRACE, "Presence on {0}", subscription.getKey());
        }
    }

    private void onChannelStatus(Subscription subscription, ChannelHandle channel, BindStatus status) {
        SubscriptionKey key = subscription.getKey();
        boolean current;
        lock.lock();
        try {
            current = isCurrentLocked(subscription, channel);
            if (current) {
                switch (status) {
                    case SUBSCRIBED -> subscription.markLive(clock.getAsLong());
                    case ERROR -> subscription.markError();
                    case CLOSED -> subscription.markClosed();
                    default -> throw new UnsupportedOperationException(status.toString());
                }
            }
        } finally {
            lock.unlock();
        }
        if (!current) {
            LOGGER.log(System.Logger.Level.TRACE, "Ignoring status {0} from replaced channel {1}", status, channel.channelName());
            return;
        }
        switch (status) {
            case SUBSCRIBED -> {
                LOGGER.log(System.Logger.Level.DEBUG, "Channel {0} subscribed for {1}", channel.channelName(), key);
                channelEventListener.onChannelLive(key);
            }
            case ERROR -> {
                LOGGER.log(System.Logger.Level.WARNING, "Channel error on {0}", key);
                channelEventListener.onChannelError(key);
            }
            default -> {
                LOGGER.log(System.Logger.Level.WARNING, "Channel {0} closed by transport for {1}", channel.channelName(), key);
                channelEventListener.onChannelError(key);
            }
        }
    }

    private boolean touchIfCurrent(Subscription subscription, ChannelHandle channel) {
        lock.lock();
        try {
            if (!isCurrentLocked(subscription, channel)) {
                return false;
            }
            subscription.touch(clock.getAsLong());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private boolean isCurrentLocked(Subscription subscription, ChannelHandle channel) {
        return subscriptions.get(subscription.getKey()) == subscription && subscription.getChannelHandle() == channel;
    }

    private void closeQuietly(SubscriptionKey key, @Nullable ChannelHandle channel) {
        if (channel == null) {
            return;
        }
        try {
            transport.closeChannel(channel).whenComplete((unused, error) -> {
                if (error != null) {
                    LOGGER.log(System.Logger.Level.DEBUG, "Ignoring error closing channel {0} of {1}: {2}", channel.channelName(), key, error.toString());
                }
            });
        } catch (RuntimeException e) {
            LOGGER.log(System.Logger.Level.DEBUG, "Ignoring error closing channel {0} of {1}: {2}", channel.channelName(), key, e.toString());
        }
    }

    // Bulk operations used by the health monitor:

    /**
     * Rebind every subscription of the given tables and invalidate their cache entries right away,
     * then invalidate every cache entry of the tables.
     */
    public void forceRefresh(Collection<String> tables) {
        List<SubscriptionKey> keys = new ArrayList<>();
        lock.lock();
        try {
            for (String table : tables) {
                Collection<SubscriptionKey> tableKeys = tableIndex.get(table);
                if (tableKeys != null) {
                    keys.addAll(tableKeys);
                }
            }
        } finally {
            lock.unlock();
        }
        LOGGER.log(System.Logger.Level.INFO, "Force refresh of tables {0}: subscriptions={1}", tables, keys.size());
        for (var key : keys) {
            rebind(key);
            bridge.onChange(key.table(), key.descriptor());
        }
        bridge.onForceRefresh(tables);
    }

    /**
     * Mark every subscription as disconnected without removing any.
     */
    public void markAllDisconnected() {
        lock.lock();
        try {
            subscriptions.values().forEach(Subscription::markDisconnected);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return a snapshot of all keys, HIGH priority first.
     */
    public List<SubscriptionKey> keysByPriority() {
        lock.lock();
        try {
            return subscriptions.values().stream()
                                .sorted(Comparator.comparing(Subscription::getPriority))
                                .map(Subscription::getKey)
                                .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return the keys of subscriptions that have gone without activity for longer than their priority allows,
     * or that have had more errors than allowed, HIGH priority first.
     * Subscriptions whose channel is being opened are not stale.
     */
    public List<SubscriptionKey> staleKeys(long now, RealtimeConfig config) {
        lock.lock();
        try {
            return subscriptions.values().stream()
                                .filter(subscription -> !subscription.isBinding() && isStale(subscription, now, config))
                                .sorted(Comparator.comparing(Subscription::getPriority))
                                .map(Subscription::getKey)
                                .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    private static boolean isStale(Subscription subscription, long now, RealtimeConfig config) {
        if (subscription.getErrorCount() > config.errorCountThreshold()) {
            return true;
        }
        Optional<Duration> staleAfter = subscription.getPriority().staleAfter(config);
        return staleAfter.isPresent() && now - subscription.getLastActivityTimestamp() > staleAfter.get().toMillis();
    }

    /**
     * Compute the global status from the subscriptions.
     * CONNECTED if any HIGH priority subscription is connected, else CONNECTED if any subscription is connected, else DISCONNECTED.
     *
     * @return the status, or empty if there are no subscriptions
     */
    public Optional<ConnectionStatus> aggregateStatus() {
        lock.lock();
        try {
            if (subscriptions.isEmpty()) {
                return Optional.empty();
            }
            boolean highConnected = subscriptions.values().stream()
                                                 .anyMatch(subscription -> subscription.getPriority() == Priority.HIGH && subscription.isConnected());
            if (highConnected || subscriptions.values().stream().anyMatch(Subscription::isConnected)) {
                return Optional.of(ConnectionStatus.CONNECTED);
            }
            return Optional.of(ConnectionStatus.DISCONNECTED);
        } finally {
            lock.unlock();
        }
    }

    // Introspection:

    public SubscriptionStatus getStatus(String table, CacheKeyDescriptor descriptor) {
        return getStatus(new SubscriptionKey(table, descriptor));
    }

    /**
     * Return the status of the subscription for key, or {@link SubscriptionStatus#NOT_SUBSCRIBED}.
     */
    public SubscriptionStatus getStatus(SubscriptionKey key) {
        lock.lock();
        try {
            Subscription subscription = subscriptions.get(key);
            return subscription != null ? subscription.toStatus() : SubscriptionStatus.NOT_SUBSCRIBED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return the descriptors subscribed to for each table, in the string form of {@link CacheKeyDescriptor#asString()}.
     */
    public Map<String, List<String>> getSubscriptionsByTable() {
        lock.lock();
        try {
            Map<String, List<String>> result = new LinkedHashMap<>();
            tableMap.forEach((table, keys) -> result.put(table, keys.stream()
                                                                     .map(key -> key.descriptor().asString())
                                                                     .collect(Collectors.toList())));
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return the keys tagged with each route, in the string form of {@link SubscriptionKey#asString()}.
     */
    public Map<String, List<String>> getSubscriptionsByRoute() {
        lock.lock();
        try {
            Map<String, List<String>> result = new LinkedHashMap<>();
            routeMap.forEach((route, keys) -> result.put(route, keys.stream().map(SubscriptionKey::asString).collect(Collectors.toList())));
            return result;
        } finally {
            lock.unlock();
        }
    }

    public int getSubscriptionCount() {
        lock.lock();
        try {
            return subscriptions.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return the string form of every key.
     */
    public List<String> getActiveSubscriptions() {
        lock.lock();
        try {
            return subscriptions.keySet().stream().map(SubscriptionKey::asString).collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }
}
