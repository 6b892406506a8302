package in.kinship.repository;

import in.kinship.domain.messaging.Conversation;
import in.kinship.domain.messaging.Participant;

import java.util.List;
import java.util.Optional;

public interface ConversationRepository {

    Conversation save(Conversation conversation);

    Optional<Conversation> findById(String conversationId);

    List<Conversation> findByParticipant(String userId);

    Optional<Participant> findParticipant(String conversationId, String userId);

    Participant saveParticipant(Participant participant);
}
