package in.kinship.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.kinship.domain.messaging.Conversation;
import in.kinship.domain.messaging.Message;
import in.kinship.service.messaging.ConversationService;
import in.kinship.service.messaging.InvalidRequestException;
import in.kinship.service.messaging.MessagingException;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversation, message and notification endpoints. Every route requires authentication.
 */
public final class ConversationHandlers {
    private static final Logger log = LoggerFactory.getLogger(ConversationHandlers.class);

    public static final class CreateConversationRequest {
        public List<String> participantIds;
    }

    public static final class SendMessageRequest {
        public String content;
        public String replyToId;
    }

    public static final class EditMessageRequest {
        public String content;
    }

    public static final class TypingRequest {
        public Boolean isTyping;
    }

    public static final class NotificationSettingsRequest {
        public Boolean enabled;
    }

    @FunctionalInterface
    private interface Step {
        void run() throws Exception;
    }

    @FunctionalInterface
    private interface Action {
        void run(AuthContext auth) throws Exception;
    }

    @FunctionalInterface
    private interface BodyAction<T> {
        void run(AuthContext auth, T body) throws Exception;
    }

    private final Authenticator authenticator;
    private final ConversationService service;

    public ConversationHandlers(Authenticator authenticator, ConversationService service) {
        this.authenticator = authenticator;
        this.service = service;
    }

    // ═══════════════════════════════════════════════════════════════
    // Conversations
    // ═══════════════════════════════════════════════════════════════

    /**
     * POST /api/conversations
     */
    public void createConversation(HttpServerExchange exchange) {
        withBody(exchange, CreateConversationRequest.class, (auth, req) -> {
            Conversation conversation = service.createConversation(auth.userId(), req.participantIds);
            HttpResponses.json(exchange, StatusCodes.CREATED, conversation);
        });
    }

    /**
     * GET /api/conversations/{conversationId}/messages?cursor=&limit=
     */
    public void listMessages(HttpServerExchange exchange) {
        authenticated(exchange, auth -> {
            String conversationId = pathParam(exchange, "conversationId");
            String cursor = queryParam(exchange, "cursor");
            Integer limit = intQueryParam(exchange, "limit");
            HttpResponses.ok(exchange, service.listMessages(conversationId, auth.userId(), cursor, limit));
        });
    }

    /**
     * POST /api/conversations/{conversationId}/messages
     */
    public void sendMessage(HttpServerExchange exchange) {
        withBody(exchange, SendMessageRequest.class, (auth, req) -> {
            Message message = service.sendMessage(pathParam(exchange, "conversationId"),
                auth.userId(), auth.displayName(), req.content, req.replyToId);
            HttpResponses.json(exchange, StatusCodes.CREATED, message);
        });
    }

    /**
     * POST /api/conversations/{conversationId}/typing
     */
    public void typing(HttpServerExchange exchange) {
        withBody(exchange, TypingRequest.class, (auth, req) -> {
            if (req.isTyping == null) {
                throw new InvalidRequestException("isTyping is required");
            }
            service.setTyping(pathParam(exchange, "conversationId"), auth.userId(), auth.displayName(), req.isTyping);
            HttpResponses.success(exchange);
        });
    }

    /**
     * POST /api/conversations/{conversationId}/read
     */
    public void markRead(HttpServerExchange exchange) {
        authenticated(exchange, auth -> {
            int marked = service.markRead(pathParam(exchange, "conversationId"), auth.userId());
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("markedRead", marked);
            HttpResponses.ok(exchange, response);
        });
    }

    /**
     * GET /api/conversations/unread
     */
    public void unreadCounts(HttpServerExchange exchange) {
        authenticated(exchange, auth -> HttpResponses.ok(exchange, service.unreadCounts(auth.userId())));
    }

    // ═══════════════════════════════════════════════════════════════
    // Messages
    // ═══════════════════════════════════════════════════════════════

    /**
     * PATCH /api/messages/{messageId}
     */
    public void editMessage(HttpServerExchange exchange) {
        withBody(exchange, EditMessageRequest.class, (auth, req) -> {
            Message updated = service.editMessage(pathParam(exchange, "messageId"), auth.userId(), req.content);
            HttpResponses.ok(exchange, updated);
        });
    }

    /**
     * DELETE /api/messages/{messageId}
     */
    public void deleteMessage(HttpServerExchange exchange) {
        authenticated(exchange, auth -> {
            service.deleteMessage(pathParam(exchange, "messageId"), auth.userId());
            HttpResponses.success(exchange);
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // Notifications
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /api/notifications
     */
    public void notifications(HttpServerExchange exchange) {
        authenticated(exchange, auth -> HttpResponses.ok(exchange, service.notifications(auth.userId())));
    }

    /**
     * POST /api/notifications/read
     */
    public void markNotificationsRead(HttpServerExchange exchange) {
        authenticated(exchange, auth -> {
            int marked = service.markNotificationsRead(auth.userId());
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("markedRead", marked);
            HttpResponses.ok(exchange, response);
        });
    }

    /**
     * PUT /api/users/me/notifications
     */
    public void updateNotificationSettings(HttpServerExchange exchange) {
        withBody(exchange, NotificationSettingsRequest.class, (auth, req) -> {
            if (req.enabled == null) {
                throw new InvalidRequestException("enabled is required");
            }
            service.setNotificationsEnabled(auth.userId(), req.enabled);
            HttpResponses.success(exchange);
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // Plumbing
    // ═══════════════════════════════════════════════════════════════

    private void authenticated(HttpServerExchange exchange, Action action) {
        AuthContext auth = authenticator.authenticate(exchange);
        if (auth == null) {
            HttpResponses.unauthorized(exchange);
            return;
        }
        run(exchange, () -> action.run(auth));
    }

    private <T> void withBody(HttpServerExchange exchange, Class<T> type, BodyAction<T> action) {
        AuthContext auth = authenticator.authenticate(exchange);
        if (auth == null) {
            HttpResponses.unauthorized(exchange);
            return;
        }
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            T request;
            try {
                request = HttpResponses.MAPPER.readValue(body, type);
            } catch (JsonProcessingException e) {
                HttpResponses.badRequest(ex, "Invalid JSON body");
                return;
            }
            if (request == null) {
                HttpResponses.badRequest(ex, "Request body is required");
                return;
            }
            run(ex, () -> action.run(auth, request));
        }, StandardCharsets.UTF_8);
    }

    private void run(HttpServerExchange exchange, Step step) {
        try {
            step.run();
        } catch (MessagingException e) {
            log.debug("{} {} -> {}: {}", exchange.getRequestMethod(), exchange.getRequestPath(),
                e.status(), e.getMessage());
            HttpResponses.error(exchange, e.status(), e.getMessage());
        } catch (Exception e) {
            log.error("{} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage(), e);
            HttpResponses.serverError(exchange, "Internal server error");
        }
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match == null ? null : match.getParameters().get(name);
    }

    private static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.peekFirst();
    }

    private static Integer intQueryParam(HttpServerExchange exchange, String name) {
        String value = queryParam(exchange, name);
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidRequestException(name + " must be a number");
        }
    }
}
