package in.kinship.domain.realtime;

/**
 * Live connection states. {@code CLOSED} is terminal; a reconnecting client gets a new connection.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSED
}
