package org.sn.realtime.subscription;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.sn.realtime.testutils.TestUtil.assertException;
import static org.sn.realtime.testutils.TestUtil.myThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.sn.realtime.subscription.FakeChangeFeedTransport.FakeChannel;
import org.sn.realtime.testutils.TestBase;
import org.sn.realtime.util.concurrent.MoreExecutors;
import org.sn.realtime.util.concurrent.VirtualTimeScheduledExecutor;


public class RealtimeSubscriptionManagerTest extends TestBase {
    private static final CacheKeyDescriptor JOBS_LIST = CacheKeyDescriptor.of(List.of("jobs-list"));

    private final FakeChangeFeedTransport transport = new FakeChangeFeedTransport();
    private final RecordingQueryCache cache = new RecordingQueryCache();
    private VirtualTimeScheduledExecutor service;
    private RealtimeSubscriptionManager manager;

    @BeforeEach
    void createManager() {
        service = MoreExecutors.newVirtualTimeScheduledThreadPool(1, myThreadFactory(), 1_000_000L);
        manager = RealtimeSubscriptionManager.create(transport, cache, service);
        manager.start();
    }

    @AfterEach
    void shutdownManager() {
        manager.shutdown();
        service.shutdownNow();
    }

    @Test
    void testBindErrorIsRecoveredAfterDelay() {
        manager.subscribe("jobs", JOBS_LIST, null, Priority.HIGH);
        assertTrue(manager.getStatus("jobs", CacheKeyDescriptor.of("jobs-list")).connected());
        int invalidationsBeforeError = cache.getInvalidationCount(JOBS_LIST);

        transport.lastChannel("jobs").fireStatus(BindStatus.ERROR);
        assertFalse(manager.getStatus("jobs", CacheKeyDescriptor.of("jobs-list")).connected());

        MoreExecutors.advanceTime(service, 5, TimeUnit.SECONDS);

        assertTrue(manager.getStatus("jobs", CacheKeyDescriptor.of("jobs-list")).connected());
        assertThat(cache.getInvalidationCount(JOBS_LIST), Matchers.greaterThan(invalidationsBeforeError));
        assertEquals(2, transport.getOpenRequestCount("jobs"));
        assertThat(transport.getOpenChannels(), Matchers.hasSize(1));
    }

    @Test
    void testLowPriorityChannelClosedByTransportComesBack() {
        manager.subscribe("crew", CacheKeyDescriptor.of("crew"), null, Priority.LOW);
        transport.lastChannel("crew").fireStatus(BindStatus.CLOSED);
        assertEquals(ConnectionStatus.DISCONNECTED, manager.getGlobalConnectionStatus());

        // the user stays active, so only the closed channel itself can trigger recovery
        for (int minute = 0; minute < 10; minute++) {
            manager.getLivenessSignalSource().onUserActivity();
            MoreExecutors.advanceTime(service, 1, TimeUnit.MINUTES);
        }

        assertTrue(manager.getStatus("crew", CacheKeyDescriptor.of("crew")).connected());
        assertEquals(ConnectionStatus.CONNECTED, manager.getGlobalConnectionStatus());
        assertEquals(2, transport.getOpenRequestCount("crew"));
    }

    @Test
    void testDuplicateSubscribeKeepsChannelUntilLastRelease() {
        SubscriptionHandle first = manager.subscribe("jobs", JOBS_LIST);
        SubscriptionHandle second = manager.subscribe("jobs", JOBS_LIST);
        FakeChannel channel = transport.lastChannel("jobs");
        assertEquals(1, transport.getOpenRequestCount("jobs"));

        manager.unsubscribe(first);
        assertFalse(channel.isClosed());
        assertEquals(1, manager.getSubscriptionCount());

        manager.unsubscribe(second);
        assertTrue(channel.isClosed());
        assertEquals(0, manager.getSubscriptionCount());
    }

    @Test
    void testRoutes() {
        SubscriptionHandle jobs = manager.subscribe("jobs", JOBS_LIST);
        SubscriptionHandle crew = manager.subscribe("crew", CacheKeyDescriptor.of("crew", "7"));
        manager.registerForRoute("/jobs/7", jobs);
        manager.registerForRoute("/jobs/7", crew);
        assertEquals(Map.of("jobs", List.of("jobs-list"), "crew", List.of("[\"crew\",\"7\"]")), manager.getSubscriptionsByTable());

        assertEquals(2, manager.teardownRoute("/jobs/7"));
        assertThat(manager.getActiveSubscriptions(), Matchers.empty());
        assertThat(transport.getOpenChannels(), Matchers.empty());
    }

    @Test
    void testForceRefreshAndReconnectAll() {
        manager.subscribe("jobs", JOBS_LIST);
        manager.subscribe("crew", CacheKeyDescriptor.of("crew"));

        manager.forceRefresh(List.of("crew"));
        assertEquals(1, transport.getOpenRequestCount("jobs"));
        assertEquals(2, transport.getOpenRequestCount("crew"));

        manager.reconnectAll();
        assertEquals(2, transport.getOpenRequestCount("jobs"));
        assertEquals(3, transport.getOpenRequestCount("crew"));
        assertEquals(ConnectionStatus.CONNECTED, manager.getGlobalConnectionStatus());
    }

    @Test
    void testLivenessSignals() {
        manager.subscribe("jobs", JOBS_LIST, null, Priority.HIGH);
        LivenessSignalSource signals = manager.getLivenessSignalSource();

        signals.onNetworkDown();
        assertEquals(ConnectionStatus.DISCONNECTED, manager.getGlobalConnectionStatus());

        signals.onNetworkUp();
        MoreExecutors.advanceTime(service, 2, TimeUnit.SECONDS);
        assertEquals(ConnectionStatus.CONNECTED, manager.getGlobalConnectionStatus());

        signals.onForegroundRegained(Duration.ofMinutes(10));
        assertEquals(1, cache.getInvalidateAllCount());
    }

    @Test
    void testShutdown() {
        manager.subscribe("jobs", JOBS_LIST);
        transport.lastChannel("jobs").fireStatus(BindStatus.ERROR);

        manager.shutdown();
        assertTrue(manager.isShutdown());
        assertThat(transport.getOpenChannels(), Matchers.empty());
        assertEquals(0, manager.getSubscriptionCount());

        MoreExecutors.advanceTime(service, 10, TimeUnit.MINUTES);
        assertEquals(1, transport.getOpenRequestCount("jobs"));
        assertEquals(0, transport.getProbeCount());

        assertException(() -> manager.subscribe("jobs", JOBS_LIST), IllegalStateException.class, "RealtimeSubscriptionManager is shut down");
        assertException(manager::start, IllegalStateException.class);
        manager.shutdown();
    }
}
