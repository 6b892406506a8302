package in.kinship.infrastructure.persistence;

import in.kinship.domain.messaging.Conversation;
import in.kinship.domain.messaging.Participant;
import in.kinship.repository.ConversationRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class InMemoryConversationRepository implements ConversationRepository {

    private final ConcurrentMap<String, Conversation> conversations = new ConcurrentHashMap<>();
    // key: conversationId + '|' + userId
    private final ConcurrentMap<String, Participant> participants = new ConcurrentHashMap<>();

    @Override
    public Conversation save(Conversation conversation) {
        conversations.put(conversation.id(), conversation);
        for (String userId : conversation.participantIds()) {
            participants.putIfAbsent(key(conversation.id(), userId),
                new Participant(conversation.id(), userId, null));
        }
        return conversation;
    }

    @Override
    public Optional<Conversation> findById(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(conversations.get(conversationId));
    }

    @Override
    public List<Conversation> findByParticipant(String userId) {
        return conversations.values().stream()
            .filter(c -> c.hasParticipant(userId))
            .sorted(Comparator.comparing(Conversation::updatedAt).reversed())
            .toList();
    }

    @Override
    public Optional<Participant> findParticipant(String conversationId, String userId) {
        if (conversationId == null || userId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(participants.get(key(conversationId, userId)));
    }

    @Override
    public Participant saveParticipant(Participant participant) {
        participants.put(key(participant.conversationId(), participant.userId()), participant);
        return participant;
    }

    private static String key(String conversationId, String userId) {
        return conversationId + '|' + userId;
    }
}
