package in.kinship.transport.sse;

import in.kinship.domain.realtime.CloseReason;
import in.kinship.realtime.ConnectionLifecycleManager;
import in.kinship.realtime.LiveConnection;
import in.kinship.transport.http.AuthContext;
import in.kinship.transport.http.Authenticator;
import in.kinship.transport.http.HttpResponses;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;

/**
 * GET /api/sse - opens a server-sent event stream for the authenticated user.
 *
 * The stream holds one worker thread for its whole life: the thread pumps the connection's
 * {@link StreamingEventSink} into the response until the sink is closed or the client goes away,
 * then drives the connection to CLOSED.
 */
public final class SseStreamHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(SseStreamHandler.class);

    private static final HttpString X_ACCEL_BUFFERING = HttpString.tryFromString("X-Accel-Buffering");

    private final Authenticator authenticator;
    private final ConnectionLifecycleManager lifecycle;
    private final int queueCapacity;

    public SseStreamHandler(Authenticator authenticator, ConnectionLifecycleManager lifecycle, int queueCapacity) {
        this.authenticator = authenticator;
        this.lifecycle = lifecycle;
        this.queueCapacity = queueCapacity;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }

        AuthContext auth = authenticator.authenticate(exchange);
        if (auth == null) {
            HttpResponses.unauthorized(exchange);
            return;
        }

        exchange.startBlocking();
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders()
            .put(Headers.CONTENT_TYPE, "text/event-stream; charset=utf-8")
            .put(Headers.CACHE_CONTROL, "no-cache")
            .put(Headers.CONNECTION, "keep-alive")
            .put(X_ACCEL_BUFFERING, "no");

        StreamingEventSink sink = new StreamingEventSink(queueCapacity);
        exchange.getConnection().addCloseListener(connection -> sink.close());

        LiveConnection connection = lifecycle.open(auth.userId(), sink);
        CloseReason reason = CloseReason.CLIENT_DISCONNECTED;
        try {
            OutputStream out = exchange.getOutputStream();
            sink.pump(out);
        } catch (IOException e) {
            log.debug("SSE stream {} write failed: {}", connection.id(), e.toString());
            reason = CloseReason.WRITE_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reason = CloseReason.SERVER_SHUTDOWN;
        } finally {
            lifecycle.close(connection.id(), reason);
            exchange.endExchange();
        }
    }
}
