package org.sn.realtime.subscription;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.sn.realtime.testutils.TestUtil.assertException;
import static org.sn.realtime.testutils.TestUtil.myThreadFactory;

import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.sn.realtime.testutils.TestBase;
import org.sn.realtime.util.concurrent.MoreExecutors;
import org.sn.realtime.util.concurrent.VirtualTimeScheduledExecutor;


public class ConnectionHealthMonitorTest extends TestBase {
    private static final long START_TIME = 1_000_000L;
    private static final long MINUTE = 60_000L;
    private static final CacheKeyDescriptor JOBS_LIST = CacheKeyDescriptor.of("jobs-list");
    private static final SubscriptionKey JOBS_KEY = new SubscriptionKey("jobs", JOBS_LIST);

    private final FakeChangeFeedTransport transport = new FakeChangeFeedTransport();
    private final RecordingQueryCache cache = new RecordingQueryCache();
    private VirtualTimeScheduledExecutor service;
    private SubscriptionRegistry registry;
    private ReconnectionCoordinator coordinator;
    private ConnectionHealthMonitor monitor;

    @BeforeEach
    void createMonitor() {
        service = MoreExecutors.newVirtualTimeScheduledThreadPool(1, myThreadFactory(), START_TIME);
        monitor = createMonitor(transport);
        monitor.start();
    }

    private ConnectionHealthMonitor createMonitor(ChangeFeedTransport transport) {
        var config = RealtimeConfig.defaults();
        var bridge = new CacheInvalidationBridge(cache);
        registry = new SubscriptionRegistry(transport, bridge, service::currentTimeMillis);
        coordinator = new ReconnectionCoordinator(registry, service, config);
        registry.setChannelEventListener(coordinator);
        return new ConnectionHealthMonitor(registry, coordinator, bridge, transport, service, config, service::currentTimeMillis);
    }

    @AfterEach
    void shutdownService() {
        monitor.stop();
        coordinator.shutdown();
        service.shutdownNow();
    }

    private void advanceTo(long millisSinceStart) {
        long delta = START_TIME + millisSinceStart - service.currentTimeMillis();
        MoreExecutors.advanceTime(service, delta, TimeUnit.MILLISECONDS);
    }

    @Test
    void testStartTwice() {
        assertException(() -> monitor.start(), IllegalStateException.class, "health monitor already started");
    }

    @Test
    void testStaleHighPrioritySubscriptionIsReconnected() {
        registry.subscribe("jobs", JOBS_LIST, null, Priority.HIGH);

        advanceTo(5 * MINUTE);
        assertEquals(1, transport.getOpenRequestCount("jobs"));

        advanceTo(6 * MINUTE);
        assertEquals(2, transport.getOpenRequestCount("jobs"));
        assertTrue(registry.getStatus(JOBS_KEY).connected());
        assertEquals(START_TIME + 6 * MINUTE, registry.getStatus(JOBS_KEY).lastActivity());
    }

    @Test
    void testActivityKeepsSubscriptionFresh() {
        registry.subscribe("jobs", JOBS_LIST, null, Priority.HIGH);

        advanceTo(4 * MINUTE);
        transport.lastChannel("jobs").firePresence();
        advanceTo(8 * MINUTE);
        transport.lastChannel("jobs").fireChange(ChangeEventType.UPDATE);
        advanceTo(12 * MINUTE);
        assertEquals(1, transport.getOpenRequestCount("jobs"));
    }

    @Test
    void testStaleMediumPrioritySubscriptionIsReconnected() {
        registry.subscribe("crew", CacheKeyDescriptor.of("crew"), null, Priority.MEDIUM);

        advanceTo(10 * MINUTE);
        assertEquals(1, transport.getOpenRequestCount("crew"));
        advanceTo(11 * MINUTE);
        assertEquals(2, transport.getOpenRequestCount("crew"));
    }

    @Test
    void testGlobalInactivityReconnectsEverything() {
        registry.subscribe("crew", CacheKeyDescriptor.of("crew"), null, Priority.LOW);

        advanceTo(20 * MINUTE);
        monitor.onUserActivity();

        advanceTo(50 * MINUTE);
        assertEquals(1, transport.getOpenRequestCount("crew"));

        advanceTo(51 * MINUTE);
        assertEquals(2, transport.getOpenRequestCount("crew"));

        // the inactivity clock restarts after triggering
        advanceTo(81 * MINUTE);
        assertEquals(2, transport.getOpenRequestCount("crew"));
        advanceTo(82 * MINUTE);
        assertEquals(3, transport.getOpenRequestCount("crew"));
    }

    @Test
    void testProbeFailuresAndRecovery() {
        registry.subscribe("crew", CacheKeyDescriptor.of("crew"), null, Priority.MEDIUM);
        transport.setReachable(false);

        advanceTo(MINUTE);
        assertTrue(registry.getStatus("crew", CacheKeyDescriptor.of("crew")).connected());

        advanceTo(2 * MINUTE);
        assertFalse(registry.getStatus("crew", CacheKeyDescriptor.of("crew")).connected());
        assertEquals(ConnectionStatus.DISCONNECTED, monitor.getGlobalConnectionStatus());
        assertEquals(1, registry.getSubscriptionCount());

        transport.setReachable(true);
        advanceTo(3 * MINUTE);
        assertEquals(1, transport.getOpenRequestCount("crew"));

        advanceTo(4 * MINUTE);
        assertEquals(2, transport.getOpenRequestCount("crew"));
        assertEquals(ConnectionStatus.CONNECTED, monitor.getGlobalConnectionStatus());
    }

    @Test
    void testStatusWithoutSubscriptions() {
        assertEquals(ConnectionStatus.CONNECTING, monitor.getGlobalConnectionStatus());

        advanceTo(2 * MINUTE);
        assertEquals(ConnectionStatus.CONNECTED, monitor.getGlobalConnectionStatus());
        assertEquals(2, transport.getProbeCount());

        transport.setReachable(false);
        advanceTo(4 * MINUTE);
        assertEquals(ConnectionStatus.DISCONNECTED, monitor.getGlobalConnectionStatus());
    }

    @Test
    void testGlobalStatusAggregation() {
        registry.subscribe("jobs", JOBS_LIST, null, Priority.HIGH);
        registry.subscribe("crew", CacheKeyDescriptor.of("crew"), null, Priority.MEDIUM);
        registry.subscribe("timesheets", CacheKeyDescriptor.of("timesheets"), null, Priority.LOW);
        transport.lastChannel("crew").fireStatus(BindStatus.CLOSED);
        transport.lastChannel("timesheets").fireStatus(BindStatus.CLOSED);
        assertEquals(ConnectionStatus.CONNECTED, monitor.getGlobalConnectionStatus());

        transport.lastChannel("jobs").fireStatus(BindStatus.CLOSED);
        assertEquals(ConnectionStatus.DISCONNECTED, monitor.getGlobalConnectionStatus());
    }

    @Test
    void testNetworkDownAndUp() {
        registry.subscribe("jobs", JOBS_LIST, null, Priority.HIGH);

        monitor.onNetworkDown();
        assertFalse(registry.getStatus(JOBS_KEY).connected());
        assertEquals(ConnectionStatus.DISCONNECTED, monitor.getGlobalConnectionStatus());
        assertEquals(ConnectionStatus.DISCONNECTED, monitor.getLastObservedStatus());

        // no sweeps or probes while offline
        advanceTo(10 * MINUTE);
        assertEquals(1, transport.getOpenRequestCount("jobs"));
        assertEquals(0, transport.getProbeCount());
        assertEquals(1, registry.getSubscriptionCount());

        monitor.onNetworkUp();
        assertEquals(ConnectionStatus.CONNECTING, monitor.getLastObservedStatus());
        advanceTo(10 * MINUTE + 1000);
        monitor.onNetworkUp(); // flapping network restarts the settle delay
        advanceTo(10 * MINUTE + 2999);
        assertEquals(1, transport.getOpenRequestCount("jobs"));

        advanceTo(10 * MINUTE + 3000);
        assertEquals(2, transport.getOpenRequestCount("jobs"));
        assertTrue(registry.getStatus(JOBS_KEY).connected());
        assertEquals(ConnectionStatus.CONNECTED, monitor.getGlobalConnectionStatus());
    }

    @Test
    void testNetworkDownCancelsPendingReconnect() {
        registry.subscribe("jobs", JOBS_LIST, null, Priority.HIGH);
        monitor.onNetworkDown();
        monitor.onNetworkUp();
        monitor.onNetworkDown();

        advanceTo(5000);
        assertEquals(1, transport.getOpenRequestCount("jobs"));
    }

    @Test
    void testForegroundRegained() {
        registry.subscribe("jobs", JOBS_LIST, null, Priority.HIGH);

        monitor.onForegroundRegained(Duration.ofMinutes(1));
        assertEquals(0, cache.getInvalidateAllCount());

        monitor.onForegroundRegained(Duration.ofMinutes(3));
        assertEquals(1, cache.getInvalidateAllCount());
        assertEquals(1, transport.getOpenRequestCount("jobs"));

        // regaining the foreground checks for stale subscriptions without waiting for the next sweep
        advanceTo(5 * MINUTE + 30_000);
        assertEquals(1, transport.getOpenRequestCount("jobs"));
        monitor.onForegroundRegained(Duration.ofSeconds(30));
        assertEquals(2, transport.getOpenRequestCount("jobs"));
    }

    @Test
    void testProbeThatThrowsCountsAsFailure() {
        var throwingTransport = new FakeChangeFeedTransport() {
            @Override
            public CompletionStage<Boolean> reachabilityProbe() {
                throw new ChangeFeedException("no route to host");
            }
        };
        var otherMonitor = createMonitor(throwingTransport);
        otherMonitor.runProbe();
        assertEquals(ConnectionStatus.CONNECTING, otherMonitor.getLastObservedStatus());
        otherMonitor.runProbe();
        assertEquals(ConnectionStatus.DISCONNECTED, otherMonitor.getLastObservedStatus());
    }
}
