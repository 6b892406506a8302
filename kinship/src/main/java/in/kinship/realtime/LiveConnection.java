package in.kinship.realtime;

import in.kinship.domain.realtime.ConnectionState;
import in.kinship.domain.realtime.Topics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * One open server-to-client event stream.
 *
 * Topic membership is guarded by this object's monitor and only changed through
 * {@link ConnectionRegistry}. Writes are serialized by a separate write lock so frames for one
 * connection reach the sink in call order and never interleave.
 */
public final class LiveConnection {
    private static final Logger log = LoggerFactory.getLogger(LiveConnection.class);

    private final String id;
    private final String userId;
    private final EventSink sink;
    private final Instant connectedAt;
    private final Set<String> topics = new HashSet<>();  // guarded by this
    private final Object writeLock = new Object();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);

    public LiveConnection(String id, String userId, EventSink sink) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("connection id is required");
        }
        if (userId == null || userId.isEmpty()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink is required");
        }
        this.id = id;
        this.userId = userId;
        this.sink = sink;
        this.connectedAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    public String userTopic() {
        return Topics.user(userId);
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public ConnectionState state() {
        return state.get();
    }

    public boolean isClosed() {
        return state.get() == ConnectionState.CLOSED;
    }

    public synchronized Set<String> topics() {
        return Set.copyOf(topics);
    }

    EventSink sink() {
        return sink;
    }

    /**
     * Write one frame. Returns false if the connection is closed or the sink rejected the frame;
     * never throws.
     */
    public boolean deliver(String frame) {
        synchronized (writeLock) {
            if (isClosed()) {
                return false;
            }
            try {
                sink.send(frame);
                return true;
            } catch (IOException | RuntimeException e) {
                log.warn("Write to connection {} (user={}) failed: {}", id, userId, e.toString());
                return false;
            }
        }
    }

    /**
     * Run {@code action} while holding the write lock, so no other frame can be written in between.
     */
    <T> T exclusively(Supplier<T> action) {
        synchronized (writeLock) {
            return action.get();
        }
    }

    boolean markOpen() {
        return state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN);
    }

    // Caller holds this monitor.
    boolean markClosed() {
        return state.getAndSet(ConnectionState.CLOSED) != ConnectionState.CLOSED;
    }

    // Caller holds this monitor.
    boolean addTopic(String topic) {
        return topics.add(topic);
    }

    // Caller holds this monitor.
    boolean removeTopic(String topic) {
        return topics.remove(topic);
    }

    // Caller holds this monitor.
    Set<String> drainTopics() {
        Set<String> drained = Set.copyOf(topics);
        topics.clear();
        return drained;
    }

    @Override
    public String toString() {
        return "LiveConnection{id=" + id + ", user=" + userId + ", state=" + state.get() + "}";
    }
}
