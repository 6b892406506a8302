package in.kinship.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.kinship.domain.realtime.CloseReason;
import in.kinship.infrastructure.metrics.EventMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * In-process publisher: resolves the topic's listeners and writes the frame to each one on the
 * calling thread. A listener whose write fails is removed from the registry; the others still
 * get the frame.
 */
public final class LocalEventPublisher implements EventPublisher {
    private static final Logger log = LoggerFactory.getLogger(LocalEventPublisher.class);

    private final ConnectionRegistry registry;
    private final TopicRouter router;
    private final EventFrameCodec codec;
    private final EventMetrics metrics;

    public LocalEventPublisher(ConnectionRegistry registry, TopicRouter router,
                               EventFrameCodec codec, EventMetrics metrics) {
        this.registry = registry;
        this.router = router;
        this.codec = codec;
        this.metrics = metrics;
    }

    @Override
    public void publish(String topic, String eventName, Object payload) {
        try {
            Set<String> listeners = router.listenersOf(topic);
            metrics.recordPublished(eventName, listeners.size());
            if (listeners.isEmpty()) {
                log.debug("No listeners for {} on {}", eventName, topic);
                return;
            }

            String frame = codec.encode(eventName, payload);
            int delivered = 0;
            for (String connectionId : listeners) {
                Optional<LiveConnection> connection = registry.find(connectionId);
                if (connection.isEmpty()) {
                    continue;  // removed after the snapshot was taken
                }
                if (connection.get().deliver(frame)) {
                    delivered++;
                    metrics.recordDelivery(true);
                } else {
                    metrics.recordDelivery(false);
                    registry.remove(connectionId, CloseReason.WRITE_FAILED);
                }
            }

            log.debug("Published {} to {}: {}/{} delivered", eventName, topic, delivered, listeners.size());
        } catch (JsonProcessingException e) {
            log.warn("Dropping {} on {}: payload not serializable: {}", eventName, topic, e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.error("Publish of {} to {} failed", eventName, topic, e);
        }
    }
}
