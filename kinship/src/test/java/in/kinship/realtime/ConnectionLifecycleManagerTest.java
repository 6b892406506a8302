package in.kinship.realtime;

import in.kinship.domain.realtime.CloseReason;
import in.kinship.domain.realtime.ConnectionState;
import in.kinship.domain.realtime.EventName;
import in.kinship.infrastructure.metrics.EventMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConnectionLifecycleManagerTest {

    @Mock
    private EventMetrics metrics;

    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final TopicRouter router = new TopicRouter(registry);
    private HeartbeatScheduler heartbeats;
    private ConnectionLifecycleManager lifecycle;

    @AfterEach
    void tearDown() {
        if (heartbeats != null) {
            heartbeats.shutdown();
        }
    }

    private void start(Duration heartbeatInterval) {
        heartbeats = new HeartbeatScheduler(heartbeatInterval);
        lifecycle = new ConnectionLifecycleManager(registry, new EventFrameCodec(), heartbeats,
            new ConnectionIdGenerator(), metrics);
    }

    private static void awaitTrue(java.util.function.BooleanSupplier condition, String message)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail(message);
            }
            Thread.sleep(20);
        }
    }

    @Test
    void openWritesConnectedFrameFirstAndSubscribesUserTopic() {
        start(Duration.ofHours(1));
        RecordingSink sink = new RecordingSink();

        LiveConnection connection = lifecycle.open("u1", sink);

        assertEquals(ConnectionState.OPEN, connection.state());
        assertTrue(connection.id().startsWith("u1-"));
        assertEquals(List.of("event: connected\ndata: {\"clientId\":\"" + connection.id() + "\"}\n\n"), sink.frames());
        assertEquals(Set.of(connection.id()), router.listenersOf("user:u1"));
        assertTrue(heartbeats.isScheduled(connection.id()));
        verify(metrics).recordConnectionOpened();
    }

    @Test
    void everyOpenGetsADistinctId() {
        start(Duration.ofHours(1));

        LiveConnection first = lifecycle.open("u1", new RecordingSink());
        LiveConnection second = lifecycle.open("u1", new RecordingSink());

        assertNotEquals(first.id(), second.id());
        assertEquals(2, registry.connectionsOf("u1").size());
    }

    @Test
    void failedGreetingClosesImmediately() {
        start(Duration.ofHours(1));
        RecordingSink sink = new RecordingSink();
        sink.failWrites();

        LiveConnection connection = lifecycle.open("u1", sink);

        assertTrue(connection.isClosed());
        assertFalse(registry.exists(connection.id()));
        assertFalse(heartbeats.isScheduled(connection.id()));
        assertTrue(sink.isClosed());
        verify(metrics).recordConnectionClosed(CloseReason.WRITE_FAILED);
    }

    @Test
    void heartbeatWritesPingFrames() throws InterruptedException {
        start(Duration.ofMillis(100));
        RecordingSink sink = new RecordingSink();

        lifecycle.open("u1", sink);

        awaitTrue(() -> sink.eventNames().contains("ping"), "no ping within 5s");
        assertEquals("connected", sink.eventNames().get(0));
        String ping = sink.frames().get(1);
        assertTrue(ping.matches("event: ping\ndata: \\{\"time\":\\d+}\n\n"), ping);
    }

    @Test
    void heartbeatFailureClosesTheConnection() throws InterruptedException {
        start(Duration.ofMillis(100));
        RecordingSink sink = new RecordingSink();
        LiveConnection connection = lifecycle.open("u1", sink);

        sink.failWrites();

        awaitTrue(() -> !registry.exists(connection.id()), "connection not closed after failed ping");
        assertTrue(sink.isClosed());
        assertFalse(heartbeats.isScheduled(connection.id()));
        verify(metrics, timeout(2000)).recordConnectionClosed(CloseReason.HEARTBEAT_FAILED);
    }

    @Test
    void closeIsIdempotent() {
        start(Duration.ofHours(1));
        RecordingSink sink = new RecordingSink();
        LiveConnection connection = lifecycle.open("u1", sink);

        lifecycle.close(connection.id(), CloseReason.CLIENT_DISCONNECTED);
        lifecycle.close(connection.id(), CloseReason.CLIENT_DISCONNECTED);
        lifecycle.close("unknown", CloseReason.CLIENT_DISCONNECTED);

        assertEquals(ConnectionState.CLOSED, connection.state());
        assertEquals(1, sink.closeCalls());
        assertFalse(heartbeats.isScheduled(connection.id()));
        verify(metrics, times(1)).recordConnectionClosed(any());
    }

    @Test
    void removalByFailedPublishAlsoReleasesTransport() {
        start(Duration.ofHours(1));
        RecordingSink sink = new RecordingSink();
        LiveConnection connection = lifecycle.open("u1", sink);
        router.subscribe(connection.id(), "conversation:55");
        LocalEventPublisher publisher = new LocalEventPublisher(registry, router, new EventFrameCodec(), EventMetrics.NOOP);

        sink.failWrites();
        publisher.publish("conversation:55", EventName.MESSAGE_CREATED, Map.of("id", "m1"));

        assertFalse(registry.exists(connection.id()));
        assertTrue(sink.isClosed());
        assertFalse(heartbeats.isScheduled(connection.id()));
        verify(metrics).recordConnectionClosed(CloseReason.WRITE_FAILED);
    }

    @Test
    void writesAfterCloseAreRefused() {
        start(Duration.ofHours(1));
        RecordingSink sink = new RecordingSink();
        LiveConnection connection = lifecycle.open("u1", sink);

        lifecycle.close(connection.id(), CloseReason.CLIENT_DISCONNECTED);

        assertFalse(connection.deliver("event: ping\ndata: {}\n\n"));
        assertEquals(1, sink.frames().size());
    }

    @Test
    void shutdownClosesEveryConnection() {
        start(Duration.ofHours(1));
        RecordingSink a = new RecordingSink();
        RecordingSink b = new RecordingSink();
        lifecycle.open("u1", a);
        lifecycle.open("u2", b);

        lifecycle.shutdown();

        assertEquals(0, registry.connectionCount());
        assertEquals(0, registry.topicCount());
        assertTrue(a.isClosed());
        assertTrue(b.isClosed());
        assertEquals(0, heartbeats.activeCount());
        verify(metrics, times(2)).recordConnectionClosed(CloseReason.SERVER_SHUTDOWN);
    }

    @Test
    void failureAfterRegistrationLeavesNothingRegistered() {
        heartbeats = new HeartbeatScheduler(Duration.ofHours(1)) {
            @Override
            public void schedule(String connectionId, Runnable tick, Consumer<Throwable> onFailure) {
                throw new RejectedExecutionException("scheduler stopped");
            }
        };
        lifecycle = new ConnectionLifecycleManager(registry, new EventFrameCodec(), heartbeats,
            new ConnectionIdGenerator(), metrics);
        RecordingSink sink = new RecordingSink();

        assertThrows(RejectedExecutionException.class, () -> lifecycle.open("u1", sink));

        assertEquals(0, registry.connectionCount());
        assertEquals(Set.of(), router.listenersOf("user:u1"));
        assertTrue(sink.isClosed());
        verify(metrics).recordConnectionClosed(CloseReason.SERVER_SHUTDOWN);
    }
}
