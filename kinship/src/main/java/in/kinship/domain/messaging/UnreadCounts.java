package in.kinship.domain.messaging;

import java.util.Map;

/**
 * Unread totals served to the client's periodic refresh.
 */
public record UnreadCounts(
    int totalUnread,
    Map<String, Integer> perConversation,
    long unreadNotifications
) {
    public UnreadCounts {
        perConversation = Map.copyOf(perConversation);
    }
}
