package in.kinship.repository;

import in.kinship.domain.messaging.Message;

import java.util.List;
import java.util.Optional;

public interface MessageRepository {

    Message save(Message message);

    Optional<Message> findById(String messageId);

    /**
     * All messages of a conversation, deleted ones included, in send order.
     */
    List<Message> findByConversation(String conversationId);

    /**
     * Record a read receipt.
     *
     * @return true if the receipt is new
     */
    boolean markRead(String messageId, String userId);

    boolean isReadBy(String messageId, String userId);
}
