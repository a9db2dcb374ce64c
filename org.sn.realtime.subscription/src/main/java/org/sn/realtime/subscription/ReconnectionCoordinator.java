package org.sn.realtime.subscription;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import org.sn.realtime.util.concurrent.Backoff;


/**
 * Recreates channel bindings when they fail or go stale, without changing the identity of the subscriptions.
 *
 * <p>An error on one channel schedules a reconnect of that channel only.
 * The first reconnect happens after the channel error delay and each further failure
 * of the same key waits twice as long, up to a maximum, with some jitter.
 * At most one reconnect per key is pending at a time.
 *
 * <p>All reconnects go through {@link SubscriptionRegistry#rebind(SubscriptionKey)}.
 */
public class ReconnectionCoordinator implements SubscriptionRegistry.ChannelEventListener {
    private static final System.Logger LOGGER = System.getLogger(ReconnectionCoordinator.class.getName());

    private final SubscriptionRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final RealtimeConfig config;
    private final int capRetries;

    private final ReentrantLock lock = new ReentrantLock();
    @GuardedBy("lock") private final Map<SubscriptionKey, ScheduledFuture<?>> pendingReconnects = new HashMap<>();
    @GuardedBy("lock") private final Map<SubscriptionKey, Integer> failedAttempts = new HashMap<>();
    @GuardedBy("lock") private @Nullable ScheduledFuture<?> pendingReconnectAll;
    @GuardedBy("lock") private boolean shutdown;

    public ReconnectionCoordinator(SubscriptionRegistry registry, ScheduledExecutorService scheduler, RealtimeConfig config) {
        this.registry = registry;
        this.scheduler = scheduler;
        this.config = config;
        this.capRetries = Backoff.retriesToReach(config.channelErrorDelay().toMillis(), config.maxReconnectDelay().toMillis());
    }

    /**
     * Close the channel of key and open a new one, right away.
     * Cancels a pending reconnect of the same key.
     */
    public CompletionStage<BindResult> reconnectOne(SubscriptionKey key) {
        cancelPending(key);
        return registry.rebind(key).whenComplete((result, error) -> {
            if (error != null) {
                LOGGER.log(System.Logger.Level.ERROR, "Unexpected error reconnecting " + key, error);
            } else if (result == BindResult.ABANDONED) {
                forget(key);
            }
        });
    }

    /**
     * Reconnect every subscription, HIGH priority first.
     * The keys are taken from a snapshot, so subscriptions added or removed meanwhile do not affect the pass.
     */
    public void reconnectAll() {
        List<SubscriptionKey> keys = registry.keysByPriority();
        LOGGER.log(System.Logger.Level.INFO, "Reconnecting all subscriptions: count={0}", keys.size());
        for (var key : keys) {
            reconnectOne(key);
        }
    }

    /**
     * Reconnect all subscriptions after delay.
     * Replaces a reconnect of everything that is already scheduled, so a burst of calls leads to one pass.
     */
    public void scheduleReconnectAll(Duration delay) {
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            if (pendingReconnectAll != null) {
                pendingReconnectAll.cancel(false);
            }
            pendingReconnectAll = scheduler.schedule(this::runScheduledReconnectAll, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.log(System.Logger.Level.WARNING, "Unable to schedule reconnect of all subscriptions: " + e);
            pendingReconnectAll = null;
        } finally {
            lock.unlock();
        }
        LOGGER.log(System.Logger.Level.DEBUG, "Scheduled reconnect of all subscriptions in {0}", delay);
    }

    public void cancelReconnectAll() {
        lock.lock();
        try {
            if (pendingReconnectAll != null) {
                pendingReconnectAll.cancel(false);
                pendingReconnectAll = null;
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isReconnectAllPending() {
        lock.lock();
        try {
            return pendingReconnectAll != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Schedule a reconnect of key alone, unless one is already pending.
     */
    @Override
    public void onChannelError(SubscriptionKey key) {
        long delayMillis;
        int attempt;
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            if (pendingReconnects.containsKey(key)) {
                LOGGER.log(System.Logger.Level.DEBUG, "Reconnect of {0} already pending", key);
                return;
            }
            attempt = failedAttempts.merge(key, 1, Integer::sum);
            delayMillis = computeDelayMillis(attempt);
            pendingReconnects.put(key, scheduler.schedule(() -> runScheduledReconnect(key), delayMillis, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            LOGGER.log(System.Logger.Level.WARNING, "Unable to schedule reconnect of " + key + ": " + e);
            return;
        } finally {
            lock.unlock();
        }
        LOGGER.log(System.Logger.Level.INFO, "Scheduled reconnect of {0} in {1}ms: attempt={2}", key, delayMillis, attempt);
    }

    @Override
    public void onChannelLive(SubscriptionKey key) {
        lock.lock();
        try {
            failedAttempts.remove(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancel a pending reconnect of key and forget its failed attempts.
     */
    @Override
    public void onSubscriptionRemoved(SubscriptionKey key) {
        lock.lock();
        try {
            ScheduledFuture<?> pending = pendingReconnects.remove(key);
            if (pending != null) {
                pending.cancel(false);
            }
            failedAttempts.remove(key);
        } finally {
            lock.unlock();
        }
    }

    int getFailedAttempts(SubscriptionKey key) {
        lock.lock();
        try {
            return failedAttempts.getOrDefault(key, 0);
        } finally {
            lock.unlock();
        }
    }

    private long computeDelayMillis(int attempt) {
        long base = config.channelErrorDelay().toMillis();
        if (attempt == 1) {
            return base;
        }
        long backoff = Backoff.computeExponentialBackoff(base, attempt, capRetries, config.reconnectJitter());
        return Math.min(backoff, config.maxReconnectDelay().toMillis());
    }

    public boolean isReconnectPending(SubscriptionKey key) {
        lock.lock();
        try {
            return pendingReconnects.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    private void runScheduledReconnect(SubscriptionKey key) {
        lock.lock();
        try {
            pendingReconnects.remove(key);
        } finally {
            lock.unlock();
        }
        try {
            reconnectOne(key);
        } catch (RuntimeException e) {
            LOGGER.log(System.Logger.Level.ERROR, "Unexpected error reconnecting " + key, e);
        }
    }

    private void runScheduledReconnectAll() {
        lock.lock();
        try {
            pendingReconnectAll = null;
        } finally {
            lock.unlock();
        }
        try {
            reconnectAll();
        } catch (RuntimeException e) {
            LOGGER.log(System.Logger.Level.ERROR, "Unexpected error reconnecting all subscriptions", e);
        }
    }

    private void cancelPending(SubscriptionKey key) {
        lock.lock();
        try {
            ScheduledFuture<?> pending = pendingReconnects.remove(key);
            if (pending != null) {
                pending.cancel(false);
            }
        } finally {
            lock.unlock();
        }
    }

    private void forget(SubscriptionKey key) {
        lock.lock();
        try {
            failedAttempts.remove(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancel every pending reconnect. Channel errors reported afterwards are ignored.
     */
    public void shutdown() {
        List<ScheduledFuture<?>> pending;
        lock.lock();
        try {
            shutdown = true;
            pending = new ArrayList<>(pendingReconnects.values());
            if (pendingReconnectAll != null) {
                pending.add(pendingReconnectAll);
            }
            pendingReconnects.clear();
            failedAttempts.clear();
            pendingReconnectAll = null;
        } finally {
            lock.unlock();
        }
        pending.forEach(future -> future.cancel(false));
    }
}
