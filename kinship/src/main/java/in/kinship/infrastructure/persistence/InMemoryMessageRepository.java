package in.kinship.infrastructure.persistence;

import in.kinship.domain.messaging.Message;
import in.kinship.repository.MessageRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class InMemoryMessageRepository implements MessageRepository {

    private final ConcurrentMap<String, Message> messages = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<String>> idsByConversation = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> readersByMessage = new ConcurrentHashMap<>();

    @Override
    public Message save(Message message) {
        Message previous = messages.put(message.id(), message);
        if (previous == null) {
            List<String> ids = idsByConversation.computeIfAbsent(message.conversationId(), k -> new ArrayList<>());
            synchronized (ids) {
                ids.add(message.id());
            }
        }
        return message;
    }

    @Override
    public Optional<Message> findById(String messageId) {
        if (messageId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(messages.get(messageId));
    }

    @Override
    public List<Message> findByConversation(String conversationId) {
        List<String> ids = idsByConversation.get(conversationId);
        if (ids == null) {
            return List.of();
        }
        List<String> snapshot;
        synchronized (ids) {
            snapshot = List.copyOf(ids);
        }
        List<Message> result = new ArrayList<>(snapshot.size());
        for (String id : snapshot) {
            Message message = messages.get(id);
            if (message != null) {
                result.add(message);
            }
        }
        return result;
    }

    @Override
    public boolean markRead(String messageId, String userId) {
        return readersByMessage
            .computeIfAbsent(messageId, k -> ConcurrentHashMap.newKeySet())
            .add(userId);
    }

    @Override
    public boolean isReadBy(String messageId, String userId) {
        Set<String> readers = readersByMessage.get(messageId);
        return readers != null && readers.contains(userId);
    }
}
