package in.kinship.transport.sse;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.kinship.domain.realtime.Topics;
import in.kinship.realtime.TopicRouter;
import in.kinship.transport.http.AuthContext;
import in.kinship.transport.http.Authenticator;
import in.kinship.transport.http.HttpResponses;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * POST /api/sse/subscribe - adds or removes a topic on one of the caller's live connections.
 *
 * Body: {@code {"clientId": "...", "channel": "conversation:55", "action": "subscribe"}}.
 * Any {@code action} other than {@code unsubscribe}, or none, subscribes.
 * A clientId that is no longer live is accepted and ignored.
 */
public final class SseSubscriptionHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(SseSubscriptionHandler.class);

    static final String ACTION_UNSUBSCRIBE = "unsubscribe";

    /**
     * Request body.
     */
    public static final class SubscriptionRequest {
        public String clientId;
        public String channel;
        public String action;
    }

    private final Authenticator authenticator;
    private final TopicRouter router;
    private final SubscriptionGuard guard;
    private final boolean enforceOwnership;

    public SseSubscriptionHandler(Authenticator authenticator, TopicRouter router,
                                  SubscriptionGuard guard, boolean enforceOwnership) {
        this.authenticator = authenticator;
        this.router = router;
        this.guard = guard;
        this.enforceOwnership = enforceOwnership;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        AuthContext auth = authenticator.authenticate(exchange);
        if (auth == null) {
            HttpResponses.unauthorized(exchange);
            return;
        }
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                handle(ex, auth, body);
            } catch (Exception e) {
                log.error("Subscription request failed: {}", e.getMessage(), e);
                HttpResponses.serverError(ex, "Failed to update subscription");
            }
        }, StandardCharsets.UTF_8);
    }

    private void handle(HttpServerExchange exchange, AuthContext auth, String body) {
        SubscriptionRequest request;
        try {
            request = HttpResponses.MAPPER.readValue(body, SubscriptionRequest.class);
        } catch (JsonProcessingException e) {
            HttpResponses.badRequest(exchange, "Invalid JSON body");
            return;
        }
        if (request == null || isBlank(request.clientId) || isBlank(request.channel)) {
            HttpResponses.badRequest(exchange, "Missing clientId or channel");
            return;
        }

        // anything but an explicit unsubscribe subscribes
        boolean subscribe = !ACTION_UNSUBSCRIBE.equals(request.action);

        if (!Topics.isKnown(request.channel)) {
            HttpResponses.badRequest(exchange, "Unknown channel: " + request.channel);
            return;
        }

        if (enforceOwnership) {
            Optional<String> denial = guard.checkOwnership(auth.userId(), request.clientId);
            if (denial.isEmpty() && subscribe) {
                denial = guard.checkTopic(auth.userId(), request.channel);
            }
            if (denial.isPresent()) {
                log.warn("Subscription denied: user={}, clientId={}, channel={}: {}",
                    auth.userId(), request.clientId, request.channel, denial.get());
                HttpResponses.forbidden(exchange, denial.get());
                return;
            }
        }

        if (subscribe) {
            router.subscribe(request.clientId, request.channel);
        } else {
            router.unsubscribe(request.clientId, request.channel);
        }
        HttpResponses.success(exchange);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
