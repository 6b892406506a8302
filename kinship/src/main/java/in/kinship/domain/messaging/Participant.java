package in.kinship.domain.messaging;

import java.time.Instant;

/**
 * Per-user read position inside a conversation.
 */
public record Participant(
    String conversationId,
    String userId,
    Instant lastReadAt
) {
    public Participant readAt(Instant at) {
        return new Participant(conversationId, userId, at);
    }
}
