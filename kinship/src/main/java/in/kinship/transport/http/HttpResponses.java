package in.kinship.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.kinship.util.Json;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * JSON response helpers shared by the HTTP handlers. Error bodies are {@code {"error": "..."}}.
 */
public final class HttpResponses {
    private static final Logger log = LoggerFactory.getLogger(HttpResponses.class);

    public static final ObjectMapper MAPPER = Json.newMapper();

    private HttpResponses() {
    }

    public static void json(HttpServerExchange exchange, int status, Object body) {
        String text;
        try {
            text = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize response body: {}", e.getMessage(), e);
            status = StatusCodes.INTERNAL_SERVER_ERROR;
            text = "{\"error\":\"Internal server error\"}";
        }
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(text, StandardCharsets.UTF_8);
    }

    public static void ok(HttpServerExchange exchange, Object body) {
        json(exchange, StatusCodes.OK, body);
    }

    public static void success(HttpServerExchange exchange) {
        json(exchange, StatusCodes.OK, Map.of("success", true));
    }

    public static void error(HttpServerExchange exchange, int status, String message) {
        json(exchange, status, Map.of("error", message));
    }

    public static void unauthorized(HttpServerExchange exchange) {
        error(exchange, StatusCodes.UNAUTHORIZED, "Unauthorized");
    }

    public static void badRequest(HttpServerExchange exchange, String message) {
        error(exchange, StatusCodes.BAD_REQUEST, message);
    }

    public static void forbidden(HttpServerExchange exchange, String message) {
        error(exchange, StatusCodes.FORBIDDEN, message);
    }

    public static void notFound(HttpServerExchange exchange, String message) {
        error(exchange, StatusCodes.NOT_FOUND, message);
    }

    public static void serverError(HttpServerExchange exchange, String message) {
        error(exchange, StatusCodes.INTERNAL_SERVER_ERROR, message);
    }
}
