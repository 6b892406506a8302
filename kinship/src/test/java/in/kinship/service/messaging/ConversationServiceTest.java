package in.kinship.service.messaging;

import in.kinship.domain.messaging.Conversation;
import in.kinship.domain.messaging.Message;
import in.kinship.domain.messaging.MessagePage;
import in.kinship.domain.messaging.Notification;
import in.kinship.domain.messaging.UnreadCounts;
import in.kinship.domain.realtime.EventName;
import in.kinship.infrastructure.persistence.InMemoryConversationRepository;
import in.kinship.infrastructure.persistence.InMemoryMessageRepository;
import in.kinship.infrastructure.persistence.InMemoryNotificationRepository;
import in.kinship.infrastructure.persistence.InMemoryUserSettingsRepository;
import in.kinship.realtime.EventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationServiceTest {

    @Mock
    private EventPublisher publisher;

    private InMemoryUserSettingsRepository settings;
    private ConversationService service;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        settings = new InMemoryUserSettingsRepository();
        service = new ConversationService(
            new InMemoryConversationRepository(),
            new InMemoryMessageRepository(),
            new InMemoryNotificationRepository(),
            settings,
            publisher,
            new TickingClock(Instant.parse("2024-05-01T10:00:00Z")));
        conversation = service.createConversation("alice", List.of("bob", "carol"));
    }

    // ═══════════════════════════════════════════════════════════════
    // Conversations
    // ═══════════════════════════════════════════════════════════════

    @Test
    void createConversationIncludesCreator() {
        assertEquals(Set.of("alice", "bob", "carol"), conversation.participantIds());
    }

    @Test
    void createConversationNeedsAnotherParticipant() {
        assertThrows(InvalidRequestException.class, () -> service.createConversation("alice", List.of()));
        assertThrows(InvalidRequestException.class, () -> service.createConversation("alice", List.of("alice", " ")));
        assertThrows(InvalidRequestException.class, () -> service.createConversation("alice", null));
    }

    // ═══════════════════════════════════════════════════════════════
    // Sending
    // ═══════════════════════════════════════════════════════════════

    @Test
    void sendPublishesToConversationAndNotifiesOthers() {
        settings.setNotificationsEnabled("carol", false);

        Message message = service.sendMessage(conversation.id(), "alice", "Alice", "  hello  ", null);

        assertEquals("hello", message.content());
        verify(publisher).publishToConversation(conversation.id(), EventName.MESSAGE_CREATED, message);

        ArgumentCaptor<Object> notification = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publishToUser(eq("bob"), eq(EventName.NOTIFICATION_CREATED), notification.capture());
        Notification n = (Notification) notification.getValue();
        assertEquals(Notification.TYPE_NEW_MESSAGE, n.type());
        assertEquals("New Message", n.title());
        assertEquals("Alice: hello", n.body());
        assertEquals("/messages?conversationId=" + conversation.id(), n.link());

        verify(publisher, never()).publishToUser(eq("alice"), any(), any());
        verify(publisher, never()).publishToUser(eq("carol"), any(), any());
        assertEquals(1, service.notifications("bob").size());
        assertEquals(0, service.notifications("carol").size());
    }

    @Test
    void notificationPreviewIsTruncated() {
        String content = "x".repeat(80);

        service.sendMessage(conversation.id(), "alice", "Alice", content, null);

        Notification n = service.notifications("bob").get(0);
        assertEquals("Alice: " + "x".repeat(50) + "...", n.body());
    }

    @Test
    void nonParticipantCannotSend() {
        assertThrows(ForbiddenException.class,
            () -> service.sendMessage(conversation.id(), "mallory", "Mallory", "hi", null));
        verifyNoInteractions(publisher);
    }

    @Test
    void unknownConversationIsNotFound() {
        NotFoundException e = assertThrows(NotFoundException.class,
            () -> service.sendMessage("nope", "alice", "Alice", "hi", null));
        assertEquals("nope", e.getResourceId());
        assertEquals(404, e.status());
    }

    @Test
    void contentMustBeOneToTwoThousandChars() {
        assertThrows(InvalidRequestException.class,
            () -> service.sendMessage(conversation.id(), "alice", "Alice", "   ", null));
        assertThrows(InvalidRequestException.class,
            () -> service.sendMessage(conversation.id(), "alice", "Alice", null, null));
        assertThrows(InvalidRequestException.class,
            () -> service.sendMessage(conversation.id(), "alice", "Alice", "x".repeat(2001), null));

        Message longest = service.sendMessage(conversation.id(), "alice", "Alice", "x".repeat(2000), null);
        assertEquals(2000, longest.content().length());
    }

    @Test
    void replyMustPointIntoSameConversation() {
        Conversation other = service.createConversation("alice", List.of("dave"));
        Message elsewhere = service.sendMessage(other.id(), "alice", "Alice", "hi dave", null);
        Message here = service.sendMessage(conversation.id(), "alice", "Alice", "hi all", null);

        assertThrows(InvalidRequestException.class,
            () -> service.sendMessage(conversation.id(), "bob", "Bob", "re", elsewhere.id()));

        Message reply = service.sendMessage(conversation.id(), "bob", "Bob", "re", here.id());
        assertEquals(here.id(), reply.replyToId());
    }

    @Test
    void publisherFailureDoesNotFailTheSend() {
        doThrow(new IllegalStateException("broker down"))
            .when(publisher).publishToConversation(any(), any(EventName.class), any());

        Message message = service.sendMessage(conversation.id(), "alice", "Alice", "still stored", null);

        MessagePage page = service.listMessages(conversation.id(), "bob", null, null);
        assertEquals(List.of(message), page.data());
    }

    // ═══════════════════════════════════════════════════════════════
    // Edit / delete / typing
    // ═══════════════════════════════════════════════════════════════

    @Test
    void editPublishesUpdatedMessage() {
        Message original = service.sendMessage(conversation.id(), "alice", "Alice", "helo", null);

        Message edited = service.editMessage(original.id(), "alice", "hello");

        assertTrue(edited.edited());
        assertEquals("hello", edited.content());
        verify(publisher).publishToConversation(conversation.id(), EventName.MESSAGE_EDITED, edited);
    }

    @Test
    void onlySenderMayEditOrDelete() {
        Message original = service.sendMessage(conversation.id(), "alice", "Alice", "mine", null);

        assertThrows(ForbiddenException.class, () -> service.editMessage(original.id(), "bob", "hijack"));
        assertThrows(ForbiddenException.class, () -> service.deleteMessage(original.id(), "bob"));
        assertThrows(NotFoundException.class, () -> service.editMessage("missing", "alice", "x"));
        assertThrows(NotFoundException.class, () -> service.deleteMessage("missing", "alice"));
    }

    @Test
    void deleteIsSoftAndPublishesId() {
        Message original = service.sendMessage(conversation.id(), "alice", "Alice", "oops", null);

        Message deleted = service.deleteMessage(original.id(), "alice");

        assertTrue(deleted.deleted());
        verify(publisher).publishToConversation(conversation.id(), EventName.MESSAGE_DELETED, Map.of("id", original.id()));
        assertEquals(List.of(), service.listMessages(conversation.id(), "bob", null, null).data());
        assertThrows(InvalidRequestException.class, () -> service.editMessage(original.id(), "alice", "again"));

        service.deleteMessage(original.id(), "alice");
        verify(publisher, times(1)).publishToConversation(eq(conversation.id()), eq(EventName.MESSAGE_DELETED), any());
    }

    @Test
    void typingPublishesStartAndStop() {
        service.setTyping(conversation.id(), "bob", "Bob", true);
        service.setTyping(conversation.id(), "bob", "Bob", false);

        Map<String, String> payload = Map.of("userId", "bob", "userName", "Bob");
        verify(publisher).publishToConversation(conversation.id(), EventName.TYPING_STARTED, payload);
        verify(publisher).publishToConversation(conversation.id(), EventName.TYPING_STOPPED, payload);
        assertThrows(ForbiddenException.class, () -> service.setTyping(conversation.id(), "mallory", "M", true));
    }

    // ═══════════════════════════════════════════════════════════════
    // Reading
    // ═══════════════════════════════════════════════════════════════

    @Test
    void listMessagesPagesOldestFirst() {
        for (int i = 1; i <= 5; i++) {
            service.sendMessage(conversation.id(), "alice", "Alice", "m" + i, null);
        }

        MessagePage first = service.listMessages(conversation.id(), "bob", null, 2);
        MessagePage second = service.listMessages(conversation.id(), "bob", first.nextCursor(), 2);
        MessagePage third = service.listMessages(conversation.id(), "bob", second.nextCursor(), 2);

        assertEquals(List.of("m1", "m2"), first.data().stream().map(Message::content).toList());
        assertEquals(List.of("m3", "m4"), second.data().stream().map(Message::content).toList());
        assertEquals(List.of("m5"), third.data().stream().map(Message::content).toList());
        assertNull(third.nextCursor());
    }

    @Test
    void listMessagesValidatesLimitAndCursor() {
        assertThrows(InvalidRequestException.class, () -> service.listMessages(conversation.id(), "bob", null, 0));
        assertThrows(InvalidRequestException.class, () -> service.listMessages(conversation.id(), "bob", null, 101));
        assertThrows(InvalidRequestException.class, () -> service.listMessages(conversation.id(), "bob", "bogus", null));
        assertThrows(ForbiddenException.class, () -> service.listMessages(conversation.id(), "mallory", null, null));
    }

    @Test
    void unreadCountsFollowReadPosition() {
        service.sendMessage(conversation.id(), "alice", "Alice", "one", null);
        service.sendMessage(conversation.id(), "alice", "Alice", "two", null);
        service.sendMessage(conversation.id(), "bob", "Bob", "mine", null);

        UnreadCounts before = service.unreadCounts("bob");
        assertEquals(2, before.totalUnread());
        assertEquals(Map.of(conversation.id(), 2), before.perConversation());
        assertEquals(2, before.unreadNotifications());

        assertEquals(2, service.markRead(conversation.id(), "bob"));
        assertEquals(0, service.markRead(conversation.id(), "bob"));

        UnreadCounts after = service.unreadCounts("bob");
        assertEquals(0, after.totalUnread());
        assertEquals(Map.of(), after.perConversation());

        service.sendMessage(conversation.id(), "carol", "Carol", "late", null);
        assertEquals(1, service.unreadCounts("bob").totalUnread());
    }

    @Test
    void viewingMessagesMovesReadPosition() {
        service.sendMessage(conversation.id(), "alice", "Alice", "one", null);

        service.listMessages(conversation.id(), "carol", null, null);

        assertEquals(0, service.unreadCounts("carol").totalUnread());
        assertEquals(1, service.unreadCounts("bob").totalUnread());
    }

    // ═══════════════════════════════════════════════════════════════
    // Notifications
    // ═══════════════════════════════════════════════════════════════

    @Test
    void markNotificationsReadClearsUnread() {
        service.sendMessage(conversation.id(), "alice", "Alice", "one", null);
        service.sendMessage(conversation.id(), "alice", "Alice", "two", null);

        assertEquals(2, service.markNotificationsRead("bob"));

        assertEquals(0, service.unreadCounts("bob").unreadNotifications());
        assertTrue(service.notifications("bob").stream().allMatch(Notification::read));
        assertEquals(0, service.markNotificationsRead("bob"));
    }

    @Test
    void disablingNotificationsStopsNewOnes() {
        service.setNotificationsEnabled("bob", false);

        service.sendMessage(conversation.id(), "alice", "Alice", "quiet", null);

        assertEquals(List.of(), service.notifications("bob"));
        verify(publisher, never()).publishToUser(eq("bob"), any(), any());
    }

    @Test
    void participationCheck() {
        assertTrue(service.isParticipant(conversation.id(), "bob"));
        assertFalse(service.isParticipant(conversation.id(), "mallory"));
        assertFalse(service.isParticipant("nope", "bob"));
    }
}
