package in.kinship.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.kinship.domain.realtime.CloseReason;
import in.kinship.domain.realtime.EventName;
import in.kinship.infrastructure.metrics.EventMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Opens and closes live connections.
 *
 * States: CONNECTING -> OPEN -> CLOSED. Opening registers the connection (which subscribes it to
 * its user topic), writes the {@code connected} frame first, then starts heartbeats. Every removal
 * from the registry, whatever triggered it, ends here: heartbeat cancelled, sink closed.
 * The server never reconnects; clients open a new stream and get a new id.
 */
public final class ConnectionLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycleManager.class);

    private final ConnectionRegistry registry;
    private final EventFrameCodec codec;
    private final HeartbeatScheduler heartbeats;
    private final ConnectionIdGenerator idGenerator;
    private final EventMetrics metrics;
    private final Clock clock;

    public ConnectionLifecycleManager(ConnectionRegistry registry, EventFrameCodec codec,
                                      HeartbeatScheduler heartbeats, ConnectionIdGenerator idGenerator,
                                      EventMetrics metrics) {
        this(registry, codec, heartbeats, idGenerator, metrics, Clock.systemUTC());
    }

    public ConnectionLifecycleManager(ConnectionRegistry registry, EventFrameCodec codec,
                                      HeartbeatScheduler heartbeats, ConnectionIdGenerator idGenerator,
                                      EventMetrics metrics, Clock clock) {
        this.registry = registry;
        this.codec = codec;
        this.heartbeats = heartbeats;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
        registry.addRemovalListener(this::onRemoved);
    }

    /**
     * Open a connection for an authenticated user.
     *
     * @return the connection; {@link LiveConnection#isClosed()} is true if the greeting could not
     *         be written
     * @throws RuntimeException if opening failed; a connection registered by this call is closed first
     */
    public LiveConnection open(String userId, EventSink sink) {
        String clientId = idGenerator.next(userId);
        LiveConnection connection = new LiveConnection(clientId, userId, sink);
        try {
            start(connection);
        } catch (RuntimeException e) {
            log.error("Opening connection {} for user {} failed", clientId, userId, e);
            // a duplicate id belongs to another live connection
            if (registry.find(clientId).filter(live -> live == connection).isPresent()) {
                close(clientId, e instanceof RejectedExecutionException
                    ? CloseReason.SERVER_SHUTDOWN : CloseReason.WRITE_FAILED);
            }
            throw e;
        }
        return connection;
    }

    private void start(LiveConnection connection) {
        String clientId = connection.id();
        String userId = connection.userId();

        boolean greeted = connection.exclusively(() -> {
            registry.register(connection);
            metrics.recordConnectionOpened();
            return connection.deliver(frame(EventName.CONNECTED, Map.of("clientId", clientId)));
        });

        if (!greeted) {
            close(clientId, CloseReason.WRITE_FAILED);
            return;
        }
        if (!connection.markOpen()) {
            // removed between registration and here
            heartbeats.cancel(clientId);
            return;
        }

        heartbeats.schedule(clientId,
            () -> heartbeat(connection),
            error -> close(clientId, CloseReason.HEARTBEAT_FAILED));
        if (connection.isClosed()) {
            heartbeats.cancel(clientId);
            return;
        }

        log.info("SSE connected: user={}, clientId={} (open={})", userId, clientId, registry.connectionCount());
    }

    /**
     * Close a connection. Idempotent; unknown ids are ignored.
     */
    public void close(String clientId, CloseReason reason) {
        heartbeats.cancel(clientId);
        registry.remove(clientId, reason);
    }

    /**
     * Close every live connection and stop heartbeats.
     */
    public void shutdown() {
        int open = registry.connectionCount();
        for (String clientId : registry.connectionIds()) {
            close(clientId, CloseReason.SERVER_SHUTDOWN);
        }
        heartbeats.shutdown();
        log.info("SSE lifecycle stopped ({} connections closed)", open);
    }

    private void heartbeat(LiveConnection connection) {
        String ping = frame(EventName.PING, Map.of("time", clock.millis()));
        if (!connection.deliver(ping)) {
            close(connection.id(), CloseReason.HEARTBEAT_FAILED);
        }
    }

    private void onRemoved(LiveConnection connection, CloseReason reason) {
        heartbeats.cancel(connection.id());
        try {
            connection.sink().close();
        } catch (RuntimeException e) {
            log.warn("Closing sink of {} failed: {}", connection.id(), e.toString());
        }
        metrics.recordConnectionClosed(reason);

        long lifetimeSeconds = Duration.between(connection.connectedAt(), Instant.now()).getSeconds();
        log.info("SSE closed: user={}, clientId={}, reason={}, lifetime={}s",
            connection.userId(), connection.id(), reason, lifetimeSeconds);
    }

    private String frame(EventName event, Object payload) {
        try {
            return codec.encode(event.wireName(), payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + event + " frame", e);
        }
    }
}
