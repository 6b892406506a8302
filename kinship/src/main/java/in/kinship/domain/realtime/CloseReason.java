package in.kinship.domain.realtime;

/**
 * Why a live connection left the {@code OPEN} state.
 */
public enum CloseReason {
    CLIENT_DISCONNECTED,
    WRITE_FAILED,
    HEARTBEAT_FAILED,
    SERVER_SHUTDOWN
}
