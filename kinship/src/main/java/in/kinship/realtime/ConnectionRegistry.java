package in.kinship.realtime;

import in.kinship.domain.realtime.CloseReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Table of live connections plus the topic index that points into it.
 *
 * Concurrency:
 * - Connection table and topic index are concurrent maps; lookups never lock.
 * - Register, remove and topic changes for one connection are serialized on that connection's
 *   monitor, so a removal can never leave the connection behind in any topic.
 * - Removal listeners run after the monitor is released.
 */
public final class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    /**
     * Notified once for every connection removed from the registry.
     */
    @FunctionalInterface
    public interface RemovalListener {
        void onRemoved(LiveConnection connection, CloseReason reason);
    }

    private final ConcurrentMap<String, LiveConnection> connections = new ConcurrentHashMap<>();
    private final TopicIndex index = new TopicIndex();
    private final List<RemovalListener> removalListeners = new CopyOnWriteArrayList<>();

    public void addRemovalListener(RemovalListener listener) {
        removalListeners.add(listener);
    }

    /**
     * Register a new connection and subscribe it to its own user topic.
     *
     * Only live ids are checked here. Ids are never reused because every connection gets a fresh
     * one from {@link ConnectionIdGenerator}; the registry keeps no record of removed ids.
     *
     * @throws DuplicateConnectionException if the id is already live
     */
    public LiveConnection register(String connectionId, String userId, EventSink sink) {
        LiveConnection connection = new LiveConnection(connectionId, userId, sink);
        register(connection);
        return connection;
    }

    public void register(LiveConnection connection) {
        synchronized (connection) {
            LiveConnection existing = connections.putIfAbsent(connection.id(), connection);
            if (existing != null) {
                throw new DuplicateConnectionException(connection.id());
            }
            String userTopic = connection.userTopic();
            connection.addTopic(userTopic);
            index.add(userTopic, connection.id());
        }
        log.debug("Registered connection {} for user {}", connection.id(), connection.userId());
    }

    /**
     * Remove a connection that went away. Idempotent.
     */
    public void remove(String connectionId) {
        remove(connectionId, CloseReason.CLIENT_DISCONNECTED);
    }

    /**
     * Remove a connection from the table and from every topic. Idempotent: an unknown id is a no-op.
     */
    public void remove(String connectionId, CloseReason reason) {
        if (connectionId == null) {
            return;
        }
        LiveConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return;
        }

        synchronized (connection) {
            connection.markClosed();
            for (String topic : connection.drainTopics()) {
                index.remove(topic, connectionId);
            }
        }
        log.debug("Removed connection {} (user={}, reason={})", connectionId, connection.userId(), reason);

        for (RemovalListener listener : removalListeners) {
            try {
                listener.onRemoved(connection, reason);
            } catch (Exception e) {
                log.error("Removal listener failed for connection {}", connectionId, e);
            }
        }
    }

    public boolean exists(String connectionId) {
        return connectionId != null && connections.containsKey(connectionId);
    }

    public Optional<LiveConnection> find(String connectionId) {
        return connectionId == null ? Optional.empty() : Optional.ofNullable(connections.get(connectionId));
    }

    public List<LiveConnection> connectionsOf(String userId) {
        List<LiveConnection> result = new ArrayList<>();
        for (LiveConnection connection : connections.values()) {
            if (connection.userId().equals(userId)) {
                result.add(connection);
            }
        }
        return result;
    }

    public Set<String> connectionIds() {
        return Set.copyOf(connections.keySet());
    }

    public int connectionCount() {
        return connections.size();
    }

    public int userCount() {
        return connections.values().stream()
            .map(LiveConnection::userId)
            .collect(Collectors.toSet())
            .size();
    }

    public int topicCount() {
        return index.topicCount();
    }

    // ═══════════════════════════════════════════════════════════════
    // Topic membership (used by TopicRouter)
    // ═══════════════════════════════════════════════════════════════

    /**
     * @return false if the connection is unknown or already closed
     */
    boolean attach(String connectionId, String topic) {
        LiveConnection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        synchronized (connection) {
            if (connection.isClosed()) {
                return false;
            }
            if (connection.addTopic(topic)) {
                index.add(topic, connectionId);
            }
        }
        return true;
    }

    /**
     * @return false if the connection is unknown or already closed
     */
    boolean detach(String connectionId, String topic) {
        LiveConnection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        synchronized (connection) {
            if (connection.isClosed()) {
                return false;
            }
            if (topic.equals(connection.userTopic())) {
                // the own user topic stays for the connection's whole life
                log.debug("Ignoring unsubscribe of {} from its own topic {}", connectionId, topic);
                return true;
            }
            if (connection.removeTopic(topic)) {
                index.remove(topic, connectionId);
            }
        }
        return true;
    }

    Set<String> listenersOf(String topic) {
        return index.listenersOf(topic);
    }
}
