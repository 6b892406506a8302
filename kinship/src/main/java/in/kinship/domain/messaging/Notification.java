package in.kinship.domain.messaging;

import java.time.Instant;

/**
 * Stored in-app notification.
 */
public record Notification(
    String id,
    String userId,
    String type,
    String title,
    String body,
    String link,
    boolean read,
    Instant createdAt
) {
    public static final String TYPE_NEW_MESSAGE = "NEW_MESSAGE";

    public Notification markedRead() {
        return new Notification(id, userId, type, title, body, link, true, createdAt);
    }
}
