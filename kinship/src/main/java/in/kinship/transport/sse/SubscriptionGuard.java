package in.kinship.transport.sse;

import in.kinship.domain.realtime.Topics;
import in.kinship.realtime.ConnectionRegistry;

import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Authorization of subscription requests.
 *
 * A caller may only steer its own connections, may only listen to its own user topic, and may
 * only listen to conversations it takes part in.
 */
public final class SubscriptionGuard {

    private final ConnectionRegistry registry;
    // (conversationId, userId) -> participant?
    private final BiPredicate<String, String> participation;

    public SubscriptionGuard(ConnectionRegistry registry, BiPredicate<String, String> participation) {
        this.registry = registry;
        this.participation = participation;
    }

    /**
     * @return the denial reason if {@code clientId} is live and owned by someone else
     */
    public Optional<String> checkOwnership(String userId, String clientId) {
        return registry.find(clientId)
            .filter(connection -> !connection.userId().equals(userId))
            .map(connection -> "Connection belongs to another user");
    }

    /**
     * @return the denial reason if {@code userId} may not listen to {@code topic}
     */
    public Optional<String> checkTopic(String userId, String topic) {
        String id = Topics.idOf(topic);
        if (Topics.isUserTopic(topic) && !id.equals(userId)) {
            return Optional.of("Cannot subscribe to another user's channel");
        }
        if (Topics.isConversationTopic(topic) && !participation.test(id, userId)) {
            return Optional.of("Not a participant in this conversation");
        }
        return Optional.empty();
    }
}
