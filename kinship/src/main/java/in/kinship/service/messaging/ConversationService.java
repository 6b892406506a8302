package in.kinship.service.messaging;

import in.kinship.domain.messaging.Conversation;
import in.kinship.domain.messaging.Message;
import in.kinship.domain.messaging.MessagePage;
import in.kinship.domain.messaging.Notification;
import in.kinship.domain.messaging.Participant;
import in.kinship.domain.messaging.UnreadCounts;
import in.kinship.domain.realtime.EventName;
import in.kinship.realtime.EventPublisher;
import in.kinship.repository.ConversationRepository;
import in.kinship.repository.MessageRepository;
import in.kinship.repository.NotificationRepository;
import in.kinship.repository.UserSettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Conversations, messages and notifications.
 *
 * Every state change is persisted first and then published to the live-event layer. Publishing is
 * a hint for connected clients: a failure there is logged and never fails the operation, and
 * clients that missed an event catch up through {@link #unreadCounts(String)} and
 * {@link #listMessages(String, String, String, Integer)}.
 */
public final class ConversationService {
    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    public static final int MAX_CONTENT_LENGTH = 2000;
    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 100;
    private static final int PREVIEW_LENGTH = 50;

    private final ConversationRepository conversationRepo;
    private final MessageRepository messageRepo;
    private final NotificationRepository notificationRepo;
    private final UserSettingsRepository settingsRepo;
    private final EventPublisher publisher;
    private final Clock clock;

    public ConversationService(ConversationRepository conversationRepo,
                               MessageRepository messageRepo,
                               NotificationRepository notificationRepo,
                               UserSettingsRepository settingsRepo,
                               EventPublisher publisher) {
        this(conversationRepo, messageRepo, notificationRepo, settingsRepo, publisher, Clock.systemUTC());
    }

    public ConversationService(ConversationRepository conversationRepo,
                               MessageRepository messageRepo,
                               NotificationRepository notificationRepo,
                               UserSettingsRepository settingsRepo,
                               EventPublisher publisher,
                               Clock clock) {
        this.conversationRepo = conversationRepo;
        this.messageRepo = messageRepo;
        this.notificationRepo = notificationRepo;
        this.settingsRepo = settingsRepo;
        this.publisher = publisher;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // Conversations
    // ═══════════════════════════════════════════════════════════════

    public Conversation createConversation(String creatorId, Collection<String> participantIds) {
        if (participantIds == null) {
            throw new InvalidRequestException("participantIds is required");
        }
        Set<String> members = new LinkedHashSet<>();
        members.add(creatorId);
        for (String id : participantIds) {
            if (id != null && !id.isBlank()) {
                members.add(id.trim());
            }
        }
        if (members.size() < 2) {
            throw new InvalidRequestException("A conversation needs at least one other participant");
        }

        Instant now = clock.instant();
        Conversation conversation = conversationRepo.save(
            new Conversation(UUID.randomUUID().toString(), members, now, now));
        log.info("Conversation created: id={}, creator={}, participants={}",
            conversation.id(), creatorId, members.size());
        return conversation;
    }

    // ═══════════════════════════════════════════════════════════════
    // Messages
    // ═══════════════════════════════════════════════════════════════

    public Message sendMessage(String conversationId, String senderId, String senderName,
                               String content, String replyToId) {
        Conversation conversation = requireParticipant(conversationId, senderId);
        String text = validContent(content);

        if (replyToId != null && !replyToId.isBlank()) {
            boolean sameConversation = messageRepo.findById(replyToId)
                .map(m -> m.conversationId().equals(conversationId))
                .orElse(false);
            if (!sameConversation) {
                throw new InvalidRequestException("replyToId does not reference a message in this conversation");
            }
        } else {
            replyToId = null;
        }

        Instant now = clock.instant();
        Message message = messageRepo.save(new Message(
            UUID.randomUUID().toString(), conversationId, senderId, senderName,
            text, replyToId, false, false, now, now));
        conversationRepo.save(conversation.touched(now));

        publishToConversation(conversationId, EventName.MESSAGE_CREATED, message);
        notifyOthers(conversation, message);

        log.debug("Message {} sent to conversation {} by {}", message.id(), conversationId, senderId);
        return message;
    }

    public Message editMessage(String messageId, String userId, String content) {
        Message message = requireMessage(messageId);
        if (!message.isFrom(userId)) {
            throw new ForbiddenException("Only the sender can edit a message", userId);
        }
        if (message.deleted()) {
            throw new InvalidRequestException("Cannot edit a deleted message");
        }

        Message updated = messageRepo.save(message.withContent(validContent(content), clock.instant()));
        publishToConversation(updated.conversationId(), EventName.MESSAGE_EDITED, updated);
        return updated;
    }

    /**
     * Soft-delete a message. Deleting an already deleted message changes nothing and publishes
     * nothing.
     */
    public Message deleteMessage(String messageId, String userId) {
        Message message = requireMessage(messageId);
        if (!message.isFrom(userId)) {
            throw new ForbiddenException("Only the sender can delete a message", userId);
        }
        if (message.deleted()) {
            return message;
        }

        Message deleted = messageRepo.save(message.asDeleted(clock.instant()));
        publishToConversation(deleted.conversationId(), EventName.MESSAGE_DELETED, Map.of("id", deleted.id()));
        return deleted;
    }

    public void setTyping(String conversationId, String userId, String userName, boolean typing) {
        requireParticipant(conversationId, userId);
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("userId", userId);
        payload.put("userName", userName);
        publishToConversation(conversationId,
            typing ? EventName.TYPING_STARTED : EventName.TYPING_STOPPED, payload);
    }

    /**
     * Page through non-deleted messages, oldest first. {@code cursor} is the id of the last
     * message of the previous page. Viewing a page moves the caller's read position to now.
     */
    public MessagePage listMessages(String conversationId, String userId, String cursor, Integer limit) {
        requireParticipant(conversationId, userId);

        int pageSize = limit == null ? DEFAULT_PAGE_SIZE : limit;
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }

        List<Message> visible = new ArrayList<>();
        for (Message m : messageRepo.findByConversation(conversationId)) {
            if (!m.deleted()) {
                visible.add(m);
            }
        }

        int start = 0;
        if (cursor != null && !cursor.isBlank()) {
            int position = indexOf(visible, cursor);
            if (position < 0) {
                throw new InvalidRequestException("Unknown cursor: " + cursor);
            }
            start = position + 1;
        }

        int end = Math.min(start + pageSize, visible.size());
        List<Message> page = visible.subList(start, end);
        String nextCursor = page.size() == pageSize ? page.get(page.size() - 1).id() : null;

        updateLastRead(conversationId, userId);
        return new MessagePage(page, nextCursor);
    }

    /**
     * Record read receipts for every unread message from other participants.
     *
     * @return number of messages newly marked read
     */
    public int markRead(String conversationId, String userId) {
        requireParticipant(conversationId, userId);

        int marked = 0;
        for (Message m : messageRepo.findByConversation(conversationId)) {
            if (m.deleted() || m.isFrom(userId)) {
                continue;
            }
            if (messageRepo.markRead(m.id(), userId)) {
                marked++;
            }
        }
        updateLastRead(conversationId, userId);
        log.debug("User {} marked {} messages read in {}", userId, marked, conversationId);
        return marked;
    }

    /**
     * Messages from others sent after the user's read position, per conversation with at least
     * one, plus unread notifications.
     */
    public UnreadCounts unreadCounts(String userId) {
        Map<String, Integer> perConversation = new LinkedHashMap<>();
        int total = 0;

        for (Conversation conversation : conversationRepo.findByParticipant(userId)) {
            Instant lastReadAt = conversationRepo.findParticipant(conversation.id(), userId)
                .map(Participant::lastReadAt)
                .orElse(null);

            int count = 0;
            for (Message m : messageRepo.findByConversation(conversation.id())) {
                if (m.deleted() || m.isFrom(userId)) {
                    continue;
                }
                if (lastReadAt == null || m.createdAt().isAfter(lastReadAt)) {
                    count++;
                }
            }
            if (count > 0) {
                perConversation.put(conversation.id(), count);
                total += count;
            }
        }

        return new UnreadCounts(total, perConversation, notificationRepo.countUnread(userId));
    }

    // ═══════════════════════════════════════════════════════════════
    // Notifications
    // ═══════════════════════════════════════════════════════════════

    public List<Notification> notifications(String userId) {
        return notificationRepo.findByUser(userId);
    }

    public int markNotificationsRead(String userId) {
        return notificationRepo.markAllRead(userId);
    }

    public void setNotificationsEnabled(String userId, boolean enabled) {
        settingsRepo.setNotificationsEnabled(userId, enabled);
        log.info("Notifications {} for user {}", enabled ? "enabled" : "disabled", userId);
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    /**
     * @throws NotFoundException  if the conversation does not exist
     * @throws ForbiddenException if the user is not a participant
     */
    public Conversation requireParticipant(String conversationId, String userId) {
        Conversation conversation = conversationRepo.findById(conversationId)
            .orElseThrow(() -> new NotFoundException("Conversation not found", conversationId));
        if (!conversation.hasParticipant(userId)) {
            throw new ForbiddenException("Not a participant in this conversation", userId);
        }
        return conversation;
    }

    /**
     * Participation check without exceptions, for subscription authorization.
     */
    public boolean isParticipant(String conversationId, String userId) {
        return conversationRepo.findById(conversationId)
            .map(c -> c.hasParticipant(userId))
            .orElse(false);
    }

    private Message requireMessage(String messageId) {
        return messageRepo.findById(messageId)
            .orElseThrow(() -> new NotFoundException("Message not found", messageId));
    }

    private static String validContent(String content) {
        String text = content == null ? "" : content.trim();
        if (text.isEmpty()) {
            throw new InvalidRequestException("Message content is required");
        }
        if (text.length() > MAX_CONTENT_LENGTH) {
            throw new InvalidRequestException("Message content exceeds " + MAX_CONTENT_LENGTH + " characters");
        }
        return text;
    }

    private void notifyOthers(Conversation conversation, Message message) {
        String preview = message.content().length() > PREVIEW_LENGTH
            ? message.content().substring(0, PREVIEW_LENGTH) + "..."
            : message.content();

        for (String participantId : conversation.participantIds()) {
            if (message.isFrom(participantId) || !settingsRepo.notificationsEnabled(participantId)) {
                continue;
            }
            Notification notification = notificationRepo.save(new Notification(
                UUID.randomUUID().toString(),
                participantId,
                Notification.TYPE_NEW_MESSAGE,
                "New Message",
                message.senderName() + ": " + preview,
                "/messages?conversationId=" + conversation.id(),
                false,
                message.createdAt()));
            try {
                publisher.publishToUser(participantId, EventName.NOTIFICATION_CREATED, notification);
            } catch (RuntimeException e) {
                log.warn("Publishing notification for {} failed: {}", participantId, e.toString());
            }
        }
    }

    private void publishToConversation(String conversationId, EventName event, Object payload) {
        try {
            publisher.publishToConversation(conversationId, event, payload);
        } catch (RuntimeException e) {
            log.warn("Publishing {} to conversation {} failed: {}", event.wireName(), conversationId, e.toString());
        }
    }

    private void updateLastRead(String conversationId, String userId) {
        Instant now = clock.instant();
        Participant participant = conversationRepo.findParticipant(conversationId, userId)
            .orElse(new Participant(conversationId, userId, null));
        conversationRepo.saveParticipant(participant.readAt(now));
    }

    private static int indexOf(List<Message> messages, String id) {
        for (int i = 0; i < messages.size(); i++) {
            if (messages.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
