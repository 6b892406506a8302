package in.kinship.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Topic subscriptions for live connections.
 *
 * Subscribe and unsubscribe for a connection that is unknown (typically one that closed while
 * the request was in flight) are logged and ignored.
 */
public final class TopicRouter {
    private static final Logger log = LoggerFactory.getLogger(TopicRouter.class);

    private final ConnectionRegistry registry;

    public TopicRouter(ConnectionRegistry registry) {
        this.registry = registry;
    }

    public void subscribe(String connectionId, String topic) {
        Objects.requireNonNull(topic, "topic");
        if (registry.attach(connectionId, topic)) {
            log.debug("Connection {} subscribed to {}", connectionId, topic);
        } else {
            log.debug("Subscribe ignored: connection {} is not live (topic={})", connectionId, topic);
        }
    }

    public void unsubscribe(String connectionId, String topic) {
        Objects.requireNonNull(topic, "topic");
        if (registry.detach(connectionId, topic)) {
            log.debug("Connection {} unsubscribed from {}", connectionId, topic);
        } else {
            log.debug("Unsubscribe ignored: connection {} is not live (topic={})", connectionId, topic);
        }
    }

    /**
     * Snapshot of the connection ids listening to {@code topic}; empty for an unknown topic.
     */
    public Set<String> listenersOf(String topic) {
        if (topic == null) {
            return Set.of();
        }
        return registry.listenersOf(topic);
    }

    public int topicCount() {
        return registry.topicCount();
    }
}
