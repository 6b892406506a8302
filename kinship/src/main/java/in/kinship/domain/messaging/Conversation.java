package in.kinship.domain.messaging;

import java.time.Instant;
import java.util.Set;

/**
 * A conversation between two or more users.
 */
public record Conversation(
    String id,
    Set<String> participantIds,
    Instant createdAt,
    Instant updatedAt
) {
    public Conversation {
        participantIds = Set.copyOf(participantIds);
    }

    public boolean hasParticipant(String userId) {
        return userId != null && participantIds.contains(userId);
    }

    public Conversation touched(Instant at) {
        return new Conversation(id, participantIds, createdAt, at);
    }
}
