package in.kinship.realtime;

import in.kinship.domain.realtime.EventName;
import in.kinship.domain.realtime.Topics;

/**
 * Fan-out of server events to live connections.
 *
 * Implementations never throw: delivery is a best-effort hint and must not fail the operation
 * that triggered it. A broker-backed implementation for multi-process deployments can replace
 * {@link LocalEventPublisher} without touching callers.
 */
public interface EventPublisher {

    void publish(String topic, String eventName, Object payload);

    default void publish(String topic, EventName event, Object payload) {
        publish(topic, event.wireName(), payload);
    }

    default void publishToUser(String userId, EventName event, Object payload) {
        publish(Topics.user(userId), event, payload);
    }

    default void publishToConversation(String conversationId, EventName event, Object payload) {
        publish(Topics.conversation(conversationId), event, payload);
    }
}
