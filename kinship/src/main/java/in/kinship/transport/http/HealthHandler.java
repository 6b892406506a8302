package in.kinship.transport.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import in.kinship.realtime.ConnectionRegistry;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;

import java.time.Instant;

/**
 * GET /api/health - liveness plus live-connection counts. Unauthenticated.
 */
public final class HealthHandler implements HttpHandler {

    private final ConnectionRegistry registry;

    public HealthHandler(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ObjectNode health = HttpResponses.MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", Instant.now().toString());
        health.put("connections", registry.connectionCount());
        health.put("users", registry.userCount());
        health.put("topics", registry.topicCount());
        HttpResponses.ok(exchange, health);
    }
}
