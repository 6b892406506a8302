package in.kinship.realtime;

/**
 * Thrown when a connection id is registered while another connection with that id is live.
 */
public class DuplicateConnectionException extends RuntimeException {

    private final String connectionId;

    public DuplicateConnectionException(String connectionId) {
        super("Connection already registered: " + connectionId);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
