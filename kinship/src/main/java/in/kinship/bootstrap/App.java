package in.kinship.bootstrap;

import in.kinship.auth.JwtService;
import in.kinship.config.RealtimeConfig;
import in.kinship.infrastructure.metrics.PrometheusEventMetrics;
import in.kinship.infrastructure.metrics.PrometheusMetricsHandler;
import in.kinship.infrastructure.persistence.InMemoryConversationRepository;
import in.kinship.infrastructure.persistence.InMemoryMessageRepository;
import in.kinship.infrastructure.persistence.InMemoryNotificationRepository;
import in.kinship.infrastructure.persistence.InMemoryUserSettingsRepository;
import in.kinship.realtime.ConnectionIdGenerator;
import in.kinship.realtime.ConnectionLifecycleManager;
import in.kinship.realtime.ConnectionRegistry;
import in.kinship.realtime.EventFrameCodec;
import in.kinship.realtime.EventPublisher;
import in.kinship.realtime.HeartbeatScheduler;
import in.kinship.realtime.LocalEventPublisher;
import in.kinship.realtime.TopicRouter;
import in.kinship.service.messaging.ConversationService;
import in.kinship.transport.http.Authenticator;
import in.kinship.transport.http.ConversationHandlers;
import in.kinship.transport.http.HealthHandler;
import in.kinship.transport.sse.SseStreamHandler;
import in.kinship.transport.sse.SseSubscriptionHandler;
import in.kinship.transport.sse.SubscriptionGuard;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Composition root: wires the live-event layer, messaging and the Undertow server.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private final RealtimeConfig config;
    private final JwtService jwtService;
    private final ConnectionRegistry registry;
    private final TopicRouter router;
    private final EventPublisher publisher;
    private final ConnectionLifecycleManager lifecycle;
    private final ConversationService conversations;
    private final Undertow server;
    private volatile boolean started;

    private App(RealtimeConfig config, CollectorRegistry metricsRegistry) {
        this.config = config;

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusEventMetrics metrics = new PrometheusEventMetrics(metricsRegistry);

        // ═══════════════════════════════════════════════════════════════
        // Auth
        // ═══════════════════════════════════════════════════════════════
        this.jwtService = new JwtService(config.jwtSecret(), config.jwtExpirationMs());
        Authenticator authenticator = new Authenticator(jwtService);

        // ═══════════════════════════════════════════════════════════════
        // Live events
        // ═══════════════════════════════════════════════════════════════
        EventFrameCodec codec = new EventFrameCodec();
        this.registry = new ConnectionRegistry();
        this.router = new TopicRouter(registry);
        this.publisher = new LocalEventPublisher(registry, router, codec, metrics);
        this.lifecycle = new ConnectionLifecycleManager(registry, codec,
            new HeartbeatScheduler(config.heartbeatInterval()), new ConnectionIdGenerator(), metrics);

        // ═══════════════════════════════════════════════════════════════
        // Messaging
        // ═══════════════════════════════════════════════════════════════
        this.conversations = new ConversationService(
            new InMemoryConversationRepository(),
            new InMemoryMessageRepository(),
            new InMemoryNotificationRepository(),
            new InMemoryUserSettingsRepository(),
            publisher);

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        SseStreamHandler sseStream = new SseStreamHandler(authenticator, lifecycle, config.outboundQueueCapacity());
        SseSubscriptionHandler sseSubscribe = new SseSubscriptionHandler(authenticator, router,
            new SubscriptionGuard(registry, conversations::isParticipant), config.enforceOwnership());
        ConversationHandlers api = new ConversationHandlers(authenticator, conversations);

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/api/health", new HealthHandler(registry))
            .get("/api/sse", sseStream)
            .post("/api/sse/subscribe", sseSubscribe)
            .post("/api/conversations", api::createConversation)
            .get("/api/conversations/unread", api::unreadCounts)
            .get("/api/conversations/{conversationId}/messages", api::listMessages)
            .post("/api/conversations/{conversationId}/messages", api::sendMessage)
            .post("/api/conversations/{conversationId}/typing", api::typing)
            .post("/api/conversations/{conversationId}/read", api::markRead)
            .add(Methods.PATCH, "/api/messages/{messageId}", api::editMessage)
            .delete("/api/messages/{messageId}", api::deleteMessage)
            .get("/api/notifications", api::notifications)
            .post("/api/notifications/read", api::markNotificationsRead)
            .put("/api/users/me/notifications", api::updateNotificationSettings)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "Kinship realtime server\n\n" +
                    "SSE:  GET /api/sse?token=<jwt>, POST /api/sse/subscribe\n" +
                    "API:  /api/conversations, /api/messages, /api/notifications\n" +
                    "Ops:  GET /api/health, /metrics\n"
                );
            });

        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, PUT, PATCH, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        // one worker thread per open event stream
        this.server = Undertow.builder()
            .addHttpListener(config.port(), config.host())
            .setWorkerThreads(config.workerThreads())
            .setHandler(corsHandler)
            .build();
    }

    public static App create(RealtimeConfig config) {
        return create(config, CollectorRegistry.defaultRegistry);
    }

    public static App create(RealtimeConfig config, CollectorRegistry metricsRegistry) {
        return new App(config, metricsRegistry);
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        server.start();
        started = true;
        log.info("✓ Kinship realtime server started on http://{}:{}/ (heartbeat={}s, queue={})",
            config.host(), port(), config.heartbeatInterval().getSeconds(), config.outboundQueueCapacity());
    }

    /**
     * Close every live connection, then stop the server.
     */
    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        lifecycle.shutdown();
        server.stop();
        log.info("Kinship realtime server stopped");
    }

    /**
     * The bound port; differs from the configured one when that was 0.
     */
    public int port() {
        if (!started) {
            return config.port();
        }
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    public JwtService jwtService() {
        return jwtService;
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public TopicRouter router() {
        return router;
    }

    public EventPublisher publisher() {
        return publisher;
    }

    public ConnectionLifecycleManager lifecycle() {
        return lifecycle;
    }

    public ConversationService conversations() {
        return conversations;
    }

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Kinship realtime server starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        RealtimeConfig config = RealtimeConfig.fromEnv();
        try {
            StartupConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.exit(1);
        }

        App app = App.create(config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            app.stop();
        }, "shutdown-hook"));
        app.start();
    }
}
