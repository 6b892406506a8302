package in.kinship.realtime;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Client ids of the form {@code <userId>-<epochMillis>-<random>}.
 *
 * The only source of connection ids, so an id that was removed from the registry never comes back.
 */
public final class ConnectionIdGenerator {
    private static final char[] ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int RANDOM_LENGTH = 12;

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    public ConnectionIdGenerator() {
        this(Clock.systemUTC());
    }

    public ConnectionIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next(String userId) {
        StringBuilder id = new StringBuilder(userId.length() + 32)
            .append(userId)
            .append('-')
            .append(clock.millis())
            .append('-');
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            id.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return id.toString();
    }
}
