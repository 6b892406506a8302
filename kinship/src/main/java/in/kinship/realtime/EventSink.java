package in.kinship.realtime;

import java.io.IOException;

/**
 * Write handle of one live connection. Implementations must not block on network I/O in
 * {@link #send(String)}; a failed send means the client is gone.
 */
public interface EventSink {

    /**
     * Hand one encoded frame to the transport.
     *
     * @throws IOException if the underlying stream is closed or cannot accept the frame
     */
    void send(String frame) throws IOException;

    /**
     * Release the transport. Must be idempotent.
     */
    void close();
}
