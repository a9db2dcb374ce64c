package org.sn.realtime.subscription;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import javax.annotation.concurrent.GuardedBy;


/**
 * Decides when the connection to the backend is lost or suspect, and asks the {@link ReconnectionCoordinator} to recover.
 *
 * <p>Two periodic tasks run on the scheduler:
 * a reachability probe, where a number of consecutive failures means the backend is unreachable and the same number of successes means it is back,
 * and a staleness sweep, which reconnects everything if any subscription has gone without activity for longer than its priority allows,
 * has had too many errors, or if there has been no user activity for a long time.
 * The sweep does not trust the transport to report lost channels.
 * Neither task does anything while the host reports the network as down.
 *
 * <p>The host reports network and user activity through the {@link LivenessSignalSource} functions.
 *
 * <p>The monitor never changes the registry's subscriptions directly.
 */
public class ConnectionHealthMonitor implements LivenessSignalSource {
    private static final System.Logger LOGGER = System.getLogger(ConnectionHealthMonitor.class.getName());

    private final SubscriptionRegistry registry;
    private final ReconnectionCoordinator coordinator;
    private final CacheInvalidationBridge bridge;
    private final ChangeFeedTransport transport;
    private final ScheduledExecutorService scheduler;
    private final RealtimeConfig config;
    private final LongSupplier clock;

    private final ReentrantLock lock = new ReentrantLock();
    @GuardedBy("lock") private ConnectionStatus lastObservedStatus = ConnectionStatus.CONNECTING;
    @GuardedBy("lock") private boolean networkOnline = true;
    @GuardedBy("lock") private int consecutiveProbeFailures;
    @GuardedBy("lock") private int consecutiveProbeSuccesses;
    @GuardedBy("lock") private long lastGlobalActivity;
    @GuardedBy("lock") private final List<ScheduledFuture<?>> periodicTasks = new ArrayList<>();

    public ConnectionHealthMonitor(SubscriptionRegistry registry,
                                   ReconnectionCoordinator coordinator,
                                   CacheInvalidationBridge bridge,
                                   ChangeFeedTransport transport,
                                   ScheduledExecutorService scheduler,
                                   RealtimeConfig config,
                                   LongSupplier clock) {
        this.registry = registry;
        this.coordinator = coordinator;
        this.bridge = bridge;
        this.transport = transport;
        this.scheduler = scheduler;
        this.config = config;
        this.clock = clock;
        this.lastGlobalActivity = clock.getAsLong();
    }

    /**
     * Schedule the probe and the sweep.
     *
     * @throws IllegalStateException if already started
     */
    public void start() {
        lock.lock();
        try {
            if (!periodicTasks.isEmpty()) {
                throw new IllegalStateException("health monitor already started");
            }
            long probeMillis = config.probeInterval().toMillis();
            long sweepMillis = config.sweepInterval().toMillis();
            periodicTasks.add(scheduler.scheduleAtFixedRate(() -> runLogged("reachability probe", this::runProbe),
                                                            probeMillis, probeMillis, TimeUnit.MILLISECONDS));
            periodicTasks.add(scheduler.scheduleAtFixedRate(() -> runLogged("staleness sweep", this::runStalenessSweep),
                                                            sweepMillis, sweepMillis, TimeUnit.MILLISECONDS));
        } finally {
            lock.unlock();
        }
        LOGGER.log(System.Logger.Level.INFO, "Started health monitor: probeInterval={0}, sweepInterval={1}",
                   config.probeInterval(), config.sweepInterval());
    }

    public void stop() {
        lock.lock();
        try {
            periodicTasks.forEach(task -> task.cancel(false));
            periodicTasks.clear();
        } finally {
            lock.unlock();
        }
    }

    private static void runLogged(String name, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOGGER.log(System.Logger.Level.ERROR, "Unexpected error in " + name, e);
        }
    }

    // Probe:

    void runProbe() {
        if (!isNetworkOnline()) {
            LOGGER.log(System.Logger.Level.TRACE, "Skipping reachability probe as the network is down");
            return;
        }
        CompletionStage<Boolean> probe;
        try {
            probe = transport.reachabilityProbe();
        } catch (RuntimeException e) {
            probe = CompletableFuture.failedFuture(e);
        }
        probe.whenComplete((reachable, error) -> {
            if (error != null) {
                LOGGER.log(System.Logger.Level.DEBUG, "Reachability probe failed: {0}", error.toString());
            }
            runLogged("reachability probe", () -> recordProbeResult(error == null && Boolean.TRUE.equals(reachable)));
        });
    }

    private void recordProbeResult(boolean reachable) {
        boolean wentDown = false;
        boolean cameBack = false;
        lock.lock();
        try {
            if (reachable) {
                consecutiveProbeFailures = 0;
                consecutiveProbeSuccesses++;
                if (consecutiveProbeSuccesses >= config.probeSuccessThreshold() && lastObservedStatus != ConnectionStatus.CONNECTED) {
                    cameBack = lastObservedStatus == ConnectionStatus.DISCONNECTED;
                    lastObservedStatus = ConnectionStatus.CONNECTED;
                }
            } else {
                consecutiveProbeSuccesses = 0;
                consecutiveProbeFailures++;
                if (consecutiveProbeFailures >= config.probeFailureThreshold() && lastObservedStatus != ConnectionStatus.DISCONNECTED) {
                    lastObservedStatus = ConnectionStatus.DISCONNECTED;
                    wentDown = true;
                }
            }
        } finally {
            lock.unlock();
        }
        if (wentDown) {
            LOGGER.log(System.Logger.Level.WARNING, "Backend unreachable after {0} failed probes", config.probeFailureThreshold());
            registry.markAllDisconnected();
        }
        if (cameBack) {
            LOGGER.log(System.Logger.Level.INFO, "Backend reachable again");
            coordinator.reconnectAll();
        }
    }

    // Sweep:

    void runStalenessSweep() {
        long now = clock.getAsLong();
        boolean inactive;
        long idleMillis;
        lock.lock();
        try {
            if (!networkOnline) {
                LOGGER.log(System.Logger.Level.TRACE, "Skipping staleness sweep as the network is down");
                return;
            }
            idleMillis = now - lastGlobalActivity;
            inactive = idleMillis > config.globalInactivityThreshold().toMillis();
            if (inactive) {
                lastGlobalActivity = now;
            }
        } finally {
            lock.unlock();
        }
        List<SubscriptionKey> stale = registry.staleKeys(now, config);
        if (inactive) {
            LOGGER.log(System.Logger.Level.INFO, "No user activity for {0}", Duration.ofMillis(idleMillis));
        }
        if (!stale.isEmpty()) {
            LOGGER.log(System.Logger.Level.INFO, "Stale subscriptions: {0}", stale);
        }
        if (inactive || !stale.isEmpty()) {
            coordinator.reconnectAll();
        } else {
            LOGGER.log(System.Logger.Level.TRACE, "All subscriptions fresh");
        }
    }

    // Signals from the host:

    @Override
    public void onNetworkUp() {
        lock.lock();
        try {
            networkOnline = true;
            lastObservedStatus = ConnectionStatus.CONNECTING;
            consecutiveProbeFailures = 0;
        } finally {
            lock.unlock();
        }
        LOGGER.log(System.Logger.Level.INFO, "Network up, reconnecting in {0}", config.networkSettleDelay());
        coordinator.scheduleReconnectAll(config.networkSettleDelay());
    }

    @Override
    public void onNetworkDown() {
        lock.lock();
        try {
            networkOnline = false;
            lastObservedStatus = ConnectionStatus.DISCONNECTED;
            consecutiveProbeSuccesses = 0;
        } finally {
            lock.unlock();
        }
        LOGGER.log(System.Logger.Level.WARNING, "Network down");
        coordinator.cancelReconnectAll();
        registry.markAllDisconnected();
    }

    /**
     * Refresh the activity time, invalidate the whole cache if the application was away for long,
     * and check for stale subscriptions right away.
     */
    @Override
    public void onForegroundRegained(Duration idleDuration) {
        lock.lock();
        try {
            lastGlobalActivity = Math.max(lastGlobalActivity, clock.getAsLong());
        } finally {
            lock.unlock();
        }
        if (idleDuration.compareTo(config.foregroundGapThreshold()) > 0) {
            LOGGER.log(System.Logger.Level.INFO, "Back in foreground after {0}", idleDuration);
            bridge.invalidateAll();
        }
        runStalenessSweep();
    }

    @Override
    public void onUserActivity() {
        lock.lock();
        try {
            lastGlobalActivity = Math.max(lastGlobalActivity, clock.getAsLong());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return the status computed from the subscriptions, or the last status observed by the probe or network signals if there are none.
     */
    public ConnectionStatus getGlobalConnectionStatus() {
        return registry.aggregateStatus().orElseGet(this::getLastObservedStatus);
    }

    private boolean isNetworkOnline() {
        lock.lock();
        try {
            return networkOnline;
        } finally {
            lock.unlock();
        }
    }

    ConnectionStatus getLastObservedStatus() {
        lock.lock();
        try {
            return lastObservedStatus;
        } finally {
            lock.unlock();
        }
    }
}
