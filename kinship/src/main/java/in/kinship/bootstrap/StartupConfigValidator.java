package in.kinship.bootstrap;

import in.kinship.config.RealtimeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Throws IllegalStateException if configuration is invalid;
 * in production mode a missing or default JWT secret is a hard failure, otherwise a warning.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private static final int MIN_SECRET_LENGTH = 32;

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(RealtimeConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");
        log.info("Production mode: {}", config.productionMode());

        if (config.port() < 0 || config.port() > 65535) {
            throw new IllegalStateException("INVALID CONFIG: PORT out of range: " + config.port());
        }
        if (config.heartbeatInterval() == null || config.heartbeatInterval().isZero()
                || config.heartbeatInterval().isNegative()) {
            throw new IllegalStateException("INVALID CONFIG: SSE_HEARTBEAT_SECONDS must be positive");
        }
        if (config.outboundQueueCapacity() <= 0) {
            throw new IllegalStateException("INVALID CONFIG: SSE_OUTBOUND_QUEUE must be positive");
        }
        if (config.workerThreads() <= 0) {
            throw new IllegalStateException("INVALID CONFIG: SSE_WORKER_THREADS must be positive");
        }
        if (config.jwtExpirationMs() <= 0) {
            throw new IllegalStateException("INVALID CONFIG: JWT_EXPIRATION_HOURS must be positive");
        }

        if (config.productionMode()) {
            validateProductionMode(config);
        } else {
            warnNonProductionMode(config);
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateProductionMode(RealtimeConfig config) {
        log.info("PRODUCTION MODE detected - enforcing strict validation");

        String secret = config.jwtSecret();
        if (secret == null || secret.isBlank() || RealtimeConfig.DEV_JWT_SECRET.equals(secret)) {
            throw new IllegalStateException(
                "INVALID CONFIG: PRODUCTION MODE requires JWT_SECRET to be set\n" +
                "System refuses to start."
            );
        }
        if (secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(
                "INVALID CONFIG: JWT_SECRET must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        log.info("✓ JWT secret configured");

        if (!config.enforceOwnership()) {
            throw new IllegalStateException(
                "INVALID CONFIG: PRODUCTION MODE requires SSE_ENFORCE_OWNERSHIP=true");
        }
        log.info("✓ Subscription ownership enforced");
    }

    private static void warnNonProductionMode(RealtimeConfig config) {
        if (RealtimeConfig.DEV_JWT_SECRET.equals(config.jwtSecret())) {
            log.warn("⚠️  Using the development JWT secret - set JWT_SECRET before going live");
        }
        if (!config.enforceOwnership()) {
            log.warn("⚠️  SSE_ENFORCE_OWNERSHIP=false - any user may subscribe any connection to any channel");
        }
    }

    private StartupConfigValidator() {}
}
