package org.sn.realtime.subscription;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.LongSupplier;
import javax.annotation.Nullable;
import org.sn.realtime.util.Shutdowneable;
import org.sn.realtime.util.concurrent.MoreExecutors;


/**
 * Keeps a pool of live change feed subscriptions, keeps the query cache consistent with them,
 * and recovers from network and backend failures on its own.
 *
 * <p>Create one instance at application start, call {@link #start()}, and call {@link #shutdown()} at exit.
 * An instance that becomes unreachable without being shut down is shut down by a cleaner.
 * Callers of subscribe only ever get a handle: connection problems are not reported as exceptions
 * but can be observed through {@link #getStatus} and {@link #getGlobalConnectionStatus()}.
 *
 * <p>Timers run on the given scheduler, which is also the clock.
 * The scheduler is owned by the caller and is not shut down by this class.
 */
public class RealtimeSubscriptionManager extends Shutdowneable {
    private final SubscriptionRegistry registry;
    private final ReconnectionCoordinator coordinator;
    private final ConnectionHealthMonitor monitor;

    public static RealtimeSubscriptionManager create(ChangeFeedTransport transport, QueryCache cache, ScheduledExecutorService scheduler) {
        return create(transport, cache, scheduler, RealtimeConfig.defaults());
    }

    public static RealtimeSubscriptionManager create(ChangeFeedTransport transport,
                                                     QueryCache cache,
                                                     ScheduledExecutorService scheduler,
                                                     RealtimeConfig config) {
        var manager = new RealtimeSubscriptionManager(transport, cache, scheduler, config);
        manager.registerCleanable();
        return manager;
    }

    private RealtimeSubscriptionManager(ChangeFeedTransport transport, QueryCache cache, ScheduledExecutorService scheduler, RealtimeConfig config) {
        LongSupplier clock = () -> MoreExecutors.currentTimeMillis(scheduler);
        var bridge = new CacheInvalidationBridge(cache);
        this.registry = new SubscriptionRegistry(transport, bridge, clock);
        this.coordinator = new ReconnectionCoordinator(registry, scheduler, config);
        this.monitor = new ConnectionHealthMonitor(registry, coordinator, bridge, transport, scheduler, config, clock);
        registry.setChannelEventListener(coordinator);
    }

    /**
     * Start the periodic reachability probe and staleness sweep.
     */
    public void start() {
        checkNotShutdown();
        monitor.start();
    }

    @Override
    protected Runnable shutdownAction() {
        return new ShutdownAction(registry, coordinator, monitor);
    }

    private record ShutdownAction(SubscriptionRegistry registry, ReconnectionCoordinator coordinator, ConnectionHealthMonitor monitor) implements Runnable {
        @Override
        public void run() {
            monitor.stop();
            coordinator.shutdown();
            registry.unsubscribeAll();
        }
    }

    private void checkNotShutdown() {
        if (isShutdown()) {
            throw new IllegalStateException("RealtimeSubscriptionManager is shut down");
        }
    }

    public SubscriptionHandle subscribe(String table, CacheKeyDescriptor descriptor) {
        checkNotShutdown();
        return registry.subscribe(table, descriptor);
    }

    /**
     * Subscribe to changes of table.
     *
     * @see SubscriptionRegistry#subscribe(String, CacheKeyDescriptor, ChannelFilter, Priority)
     */
    public SubscriptionHandle subscribe(String table, CacheKeyDescriptor descriptor, @Nullable ChannelFilter filter, Priority priority) {
        checkNotShutdown();
        return registry.subscribe(table, descriptor, filter, priority);
    }

    public CompositeSubscriptionHandle subscribeMany(List<SubscriptionSpec> specs) {
        checkNotShutdown();
        return registry.subscribeMany(specs);
    }

    public void unsubscribe(SubscriptionHandle handle) {
        registry.unsubscribe(handle);
    }

    public boolean registerForRoute(String route, SubscriptionHandle handle) {
        checkNotShutdown();
        return registry.registerForRoute(route, handle);
    }

    public int teardownRoute(String route) {
        return registry.teardownRoute(route);
    }

    public void forceRefresh(Collection<String> tables) {
        checkNotShutdown();
        registry.forceRefresh(tables);
    }

    /**
     * Reconnect every subscription now, HIGH priority first.
     */
    public void reconnectAll() {
        checkNotShutdown();
        coordinator.reconnectAll();
    }

    public SubscriptionStatus getStatus(String table, CacheKeyDescriptor descriptor) {
        return registry.getStatus(table, descriptor);
    }

    public ConnectionStatus getGlobalConnectionStatus() {
        return monitor.getGlobalConnectionStatus();
    }

    public Map<String, List<String>> getSubscriptionsByTable() {
        return registry.getSubscriptionsByTable();
    }

    public int getSubscriptionCount() {
        return registry.getSubscriptionCount();
    }

    public List<String> getActiveSubscriptions() {
        return registry.getActiveSubscriptions();
    }

    /**
     * Return the object to which the host reports network, foreground, and user activity events.
     */
    public LivenessSignalSource getLivenessSignalSource() {
        return monitor;
    }
}
