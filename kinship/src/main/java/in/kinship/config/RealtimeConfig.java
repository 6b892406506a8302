package in.kinship.config;

import in.kinship.util.Env;

import java.time.Duration;

/**
 * Server and live-event settings.
 *
 * Loaded once at startup by {@link #fromEnv()} and checked by the startup validator.
 */
public record RealtimeConfig(
    String host,
    int port,
    String jwtSecret,
    long jwtExpirationMs,
    Duration heartbeatInterval,
    int outboundQueueCapacity,
    int workerThreads,
    boolean enforceOwnership,
    boolean productionMode
) {
    public static final String DEV_JWT_SECRET = "kinship-dev-secret-change-in-production";

    public static RealtimeConfig fromEnv() {
        return new RealtimeConfig(
            Env.get("HOST", "0.0.0.0"),
            Env.getInt("PORT", 9090),
            Env.get("JWT_SECRET", DEV_JWT_SECRET),
            Env.getLong("JWT_EXPIRATION_HOURS", 24) * 3_600_000L,
            Duration.ofSeconds(Env.getLong("SSE_HEARTBEAT_SECONDS", 30)),
            Env.getInt("SSE_OUTBOUND_QUEUE", 256),
            Env.getInt("SSE_WORKER_THREADS", 256),
            Env.getBool("SSE_ENFORCE_OWNERSHIP", true),
            Env.getBool("PRODUCTION_MODE", false)
        );
    }

    /**
     * Defaults suitable for tests and local runs.
     */
    public static RealtimeConfig defaults() {
        return new RealtimeConfig("0.0.0.0", 9090, DEV_JWT_SECRET, 24 * 3_600_000L,
            Duration.ofSeconds(30), 256, 256, true, false);
    }

    public RealtimeConfig withPort(int newPort) {
        return new RealtimeConfig(host, newPort, jwtSecret, jwtExpirationMs, heartbeatInterval,
            outboundQueueCapacity, workerThreads, enforceOwnership, productionMode);
    }

    public RealtimeConfig withHeartbeatInterval(Duration interval) {
        return new RealtimeConfig(host, port, jwtSecret, jwtExpirationMs, interval,
            outboundQueueCapacity, workerThreads, enforceOwnership, productionMode);
    }
}
