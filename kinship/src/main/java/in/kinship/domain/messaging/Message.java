package in.kinship.domain.messaging;

import java.time.Instant;

/**
 * Chat message. Deletion is soft: deleted messages stay stored but are hidden from listings.
 */
public record Message(
    String id,
    String conversationId,
    String senderId,
    String senderName,
    String content,
    String replyToId,     // null when not a reply
    boolean edited,
    boolean deleted,
    Instant createdAt,
    Instant updatedAt
) {
    public Message withContent(String newContent, Instant at) {
        return new Message(id, conversationId, senderId, senderName, newContent, replyToId,
                           true, deleted, createdAt, at);
    }

    public Message asDeleted(Instant at) {
        return new Message(id, conversationId, senderId, senderName, content, replyToId,
                           edited, true, createdAt, at);
    }

    public boolean isFrom(String userId) {
        return senderId.equals(userId);
    }
}
